package deepGrid;

/**
 * Emitted when a share position is redeemed in full.
 */
public record WithdrawEvent(
        String vaultId,
        String withdrawer,
        String positionId,
        long baseAmount,
        long quoteAmount,
        long sharesBurned,
        long totalShares) implements ProtocolEvent {

    @Override
    public String type() {
        return "WITHDRAW";
    }
}
