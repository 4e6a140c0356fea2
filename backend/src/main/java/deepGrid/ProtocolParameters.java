package deepGrid;

/**
 * Protocol constants that tests and deployments may override.
 *
 * @param emissionPerAccrual GRID minted into the reward pool by every accrual
 * @param lpShareBps         share of collected fees returned to liquidity providers
 * @param burnShareBps       share of bought-back GRID that is burned
 */
public record ProtocolParameters(long emissionPerAccrual, long lpShareBps, long burnShareBps) {

    public static final ProtocolParameters DEFAULTS = new ProtocolParameters(100_000_000_000L, 6_000L, 5_000L);

    public ProtocolParameters {
        if (emissionPerAccrual <= 0L) {
            throw new ProtocolException(ErrorCode.INVALID_PARAMETERS, "emissionPerAccrual must be positive");
        }
        if (lpShareBps < 0L || lpShareBps >= WideMath.BPS_DENOMINATOR) {
            throw new ProtocolException(ErrorCode.INVALID_PARAMETERS, "lpShareBps must be in [0, 10000)");
        }
        if (burnShareBps < 0L || burnShareBps > WideMath.BPS_DENOMINATOR) {
            throw new ProtocolException(ErrorCode.INVALID_PARAMETERS, "burnShareBps must be in [0, 10000]");
        }
    }
}
