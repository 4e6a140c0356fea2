package deepGrid;

/**
 * Emitted when pending fills are credited to a vault.
 */
public record SettlementEvent(
        String vaultId,
        long baseReturned,
        long quoteEarned) implements ProtocolEvent {

    @Override
    public String type() {
        return "SETTLEMENT";
    }
}
