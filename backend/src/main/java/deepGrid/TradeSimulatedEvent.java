package deepGrid;

/**
 * Emitted when the reference price moves and sweeps crossed orders.
 */
public record TradeSimulatedEvent(
        String bookId,
        long oldMidPrice,
        long newMidPrice,
        int bidsFilled,
        int asksFilled,
        long bidFillBase,
        long quoteEarned) implements ProtocolEvent {

    @Override
    public String type() {
        return "TRADE_SIMULATED";
    }
}
