package deepGrid;

/**
 * Structured record emitted by every state-changing protocol operation.
 */
public interface ProtocolEvent {

    /**
     * Stable name of the event kind, used as the {@code type} field on the wire.
     */
    String type();
}
