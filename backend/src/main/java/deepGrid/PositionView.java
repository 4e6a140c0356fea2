package deepGrid;

/**
 * Immutable view of a share position.
 */
public record PositionView(String positionId, String vaultId, String owner, long shares, long rewardDebt) {

    static PositionView of(SharePosition position) {
        return new PositionView(
                position.getPositionId(),
                position.getVaultId(),
                position.getOwner(),
                position.getShares(),
                position.getRewardDebt());
    }
}
