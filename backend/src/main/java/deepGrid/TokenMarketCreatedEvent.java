package deepGrid;

/**
 * Emitted when a fixed-price GRID market is seeded.
 */
public record TokenMarketCreatedEvent(
        String marketId,
        long tokenReserve,
        long priceQuotePerToken) implements ProtocolEvent {

    @Override
    public String type() {
        return "TOKEN_MARKET_CREATED";
    }
}
