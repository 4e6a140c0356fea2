package deepGrid;

/**
 * Emitted after the keeper replaces a vault's resting orders.
 */
public record RebalanceEvent(
        String vaultId,
        long midPrice,
        long bidPrice,
        long askPrice,
        int ordersCancelled,
        int ordersPlaced) implements ProtocolEvent {

    @Override
    public String type() {
        return "REBALANCE";
    }
}
