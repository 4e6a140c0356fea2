package deepGrid;

/**
 * Emitted when a position's pending GRID is paid out.
 */
public record RewardsClaimedEvent(
        String vaultId,
        String claimant,
        String positionId,
        long amount) implements ProtocolEvent {

    @Override
    public String type() {
        return "REWARDS_CLAIMED";
    }
}
