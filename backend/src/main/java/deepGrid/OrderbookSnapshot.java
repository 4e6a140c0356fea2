package deepGrid;

import java.util.List;

/**
 * A snapshot of the simulated order book at a point in time.
 */
public record OrderbookSnapshot(
        String bookId,
        long midPrice,
        List<OrderDetails> bids,
        List<OrderDetails> asks,
        long pendingFillBase,
        long pendingFillQuote) {

    public OrderbookSnapshot {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }
}
