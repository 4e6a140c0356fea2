package deepGrid;

/**
 * A protocol event with its position in the global operation order.
 */
public record LoggedEvent(long sequence, ProtocolEvent event) {

    public String type() {
        return event.type();
    }
}
