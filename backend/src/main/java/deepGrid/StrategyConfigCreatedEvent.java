package deepGrid;

/**
 * Emitted when a keeper strategy configuration is registered.
 */
public record StrategyConfigCreatedEvent(
        String configId,
        long spreadBps,
        long orderSize,
        int numOrdersPerSide,
        String keeper) implements ProtocolEvent {

    @Override
    public String type() {
        return "STRATEGY_CONFIG_CREATED";
    }
}
