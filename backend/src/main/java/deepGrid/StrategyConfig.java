package deepGrid;

import java.util.Objects;

/**
 * Immutable market-making parameters of one keeper.
 */
public final class StrategyConfig {
    private final String configId;
    private final long spreadBps;
    private final long orderSize;
    private final int numOrdersPerSide;
    private final String keeper;

    /**
     * @param configId         arena identifier
     * @param spreadBps        half-width of the quoted band around the mid, in basis points
     * @param orderSize        base size of every order, scaled by 1e9
     * @param numOrdersPerSide placement attempts per side on each rebalance
     * @param keeper           the only identity allowed to rebalance with this config
     */
    StrategyConfig(String configId, long spreadBps, long orderSize, int numOrdersPerSide, String keeper) {
        this.configId = Objects.requireNonNull(configId, "configId");
        if (spreadBps < 0L || spreadBps >= WideMath.BPS_DENOMINATOR) {
            throw new ProtocolException(ErrorCode.INVALID_CONFIG, "spreadBps must be in [0, 10000)");
        }
        if (orderSize <= 0L) {
            throw new ProtocolException(ErrorCode.INVALID_CONFIG, "orderSize must be positive");
        }
        if (numOrdersPerSide <= 0) {
            throw new ProtocolException(ErrorCode.INVALID_CONFIG, "numOrdersPerSide must be positive");
        }
        if (keeper == null || keeper.isBlank()) {
            throw new ProtocolException(ErrorCode.INVALID_CONFIG, "keeper is required");
        }
        this.spreadBps = spreadBps;
        this.orderSize = orderSize;
        this.numOrdersPerSide = numOrdersPerSide;
        this.keeper = keeper;
    }

    public String getConfigId() {
        return configId;
    }

    public long getSpreadBps() {
        return spreadBps;
    }

    public long getOrderSize() {
        return orderSize;
    }

    public int getNumOrdersPerSide() {
        return numOrdersPerSide;
    }

    public String getKeeper() {
        return keeper;
    }

    public boolean isKeeper(String identity) {
        return keeper.equals(identity);
    }
}
