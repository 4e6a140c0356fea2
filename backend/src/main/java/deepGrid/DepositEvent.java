package deepGrid;

/**
 * Emitted when liquidity is added and a share position minted.
 */
public record DepositEvent(
        String vaultId,
        String depositor,
        String positionId,
        long baseAmount,
        long quoteAmount,
        long sharesMinted,
        long totalShares) implements ProtocolEvent {

    @Override
    public String type() {
        return "DEPOSIT";
    }
}
