package deepGrid;

import java.math.BigInteger;

/**
 * Integer helpers for scaled amounts. Products are taken in {@link BigInteger} so an intermediate
 * never wraps; only the final quotient has to fit in a {@code long}.
 */
public final class WideMath {

    /** Implicit decimal factor of every amount and price. */
    public static final long FLOAT_SCALING = 1_000_000_000L;

    /** Implicit factor of the reward-per-share accumulator. */
    public static final long REWARD_PRECISION = 1_000_000_000_000L;

    public static final long BPS_DENOMINATOR = 10_000L;

    private static final BigInteger REWARD_PRECISION_WIDE = BigInteger.valueOf(REWARD_PRECISION);

    private WideMath() {
    }

    /**
     * Computes {@code a * b / divisor}, truncated toward zero.
     */
    public static long mulDiv(long a, long b, long divisor) {
        if (divisor == 0L) {
            throw new ProtocolException(ErrorCode.ARITHMETIC_OVERFLOW, "division by zero");
        }
        BigInteger result = BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(divisor));
        try {
            return result.longValueExact();
        } catch (ArithmeticException ex) {
            throw new ProtocolException(ErrorCode.ARITHMETIC_OVERFLOW, "result does not fit in 64 bits: " + result, ex);
        }
    }

    /**
     * Accumulator increase for spreading {@code emission} over {@code totalShares}, at 1e12 precision.
     * The result is unbounded, so it stays a {@link BigInteger}.
     */
    public static BigInteger rewardIncrease(long emission, long totalShares) {
        if (totalShares <= 0L) {
            throw new ProtocolException(ErrorCode.ARITHMETIC_OVERFLOW, "total shares must be positive");
        }
        return BigInteger.valueOf(emission)
                .multiply(REWARD_PRECISION_WIDE)
                .divide(BigInteger.valueOf(totalShares));
    }

    /**
     * Computes {@code shares * rewardPerShare / 1e12}, the reward earned by {@code shares} since genesis.
     */
    public static long accumulatedReward(long shares, BigInteger rewardPerShare) {
        BigInteger result = BigInteger.valueOf(shares)
                .multiply(rewardPerShare)
                .divide(REWARD_PRECISION_WIDE);
        try {
            return result.longValueExact();
        } catch (ArithmeticException ex) {
            throw new ProtocolException(ErrorCode.ARITHMETIC_OVERFLOW, "reward does not fit in 64 bits: " + result, ex);
        }
    }

    public static long bps(long amount, long basisPoints) {
        return mulDiv(amount, basisPoints, BPS_DENOMINATOR);
    }

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException ex) {
            throw new ProtocolException(ErrorCode.ARITHMETIC_OVERFLOW, "sum overflows: " + a + " + " + b, ex);
        }
    }

    public static long requireNonNegative(long amount, String label) {
        if (amount < 0L) {
            throw new ProtocolException(ErrorCode.INVALID_AMOUNT, label + " must be non-negative");
        }
        return amount;
    }
}
