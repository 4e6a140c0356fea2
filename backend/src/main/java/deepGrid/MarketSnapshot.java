package deepGrid;

/**
 * Immutable view of a fixed-price market.
 */
public record MarketSnapshot(String marketId, long tokenReserve, long quoteReserve, long priceQuotePerToken) {
}
