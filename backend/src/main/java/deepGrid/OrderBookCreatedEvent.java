package deepGrid;

/**
 * Emitted when a simulated order book is opened.
 */
public record OrderBookCreatedEvent(
        String bookId,
        long midPrice) implements ProtocolEvent {

    @Override
    public String type() {
        return "ORDER_BOOK_CREATED";
    }
}
