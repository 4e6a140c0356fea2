package deepGrid;

/**
 * Emitted when an empty vault is created.
 */
public record VaultCreatedEvent(
        String vaultId) implements ProtocolEvent {

    @Override
    public String type() {
        return "VAULT_CREATED";
    }
}
