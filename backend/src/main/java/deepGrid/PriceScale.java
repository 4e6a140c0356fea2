package deepGrid;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Represents the integer scaling used to convert between external decimal amounts
 * and the protocol's scaled integer representation.
 */
public final class PriceScale {
    public static final PriceScale DEFAULT = fromPrecision(9);

    private final int precision;
    private final long scaleFactor;

    private PriceScale(int precision, long scaleFactor) {
        if (precision < 0 || precision > 18) {
            throw new IllegalArgumentException("precision must be between 0 and 18");
        }
        if (scaleFactor <= 0) {
            throw new IllegalArgumentException("scaleFactor must be positive");
        }
        this.precision = precision;
        this.scaleFactor = scaleFactor;
    }

    public static PriceScale fromPrecision(int precision) {
        long scale = BigDecimal.ONE.movePointRight(precision).longValueExact();
        return new PriceScale(precision, scale);
    }

    public int precision() {
        return precision;
    }

    public long scaleFactor() {
        return scaleFactor;
    }

    public long toScaled(BigDecimal decimalAmount) {
        try {
            BigDecimal bd = decimalAmount.setScale(precision, RoundingMode.UNNECESSARY);
            return bd.movePointRight(precision).longValueExact();
        } catch (ArithmeticException ex) {
            throw new ProtocolException(ErrorCode.INVALID_AMOUNT,
                    "Amount does not align with precision " + precision + ": " + decimalAmount, ex);
        }
    }

    public long toScaled(String decimalAmount) {
        if (decimalAmount == null || decimalAmount.isBlank()) {
            throw new ProtocolException(ErrorCode.INVALID_AMOUNT, "Amount is required");
        }
        try {
            return toScaled(new BigDecimal(decimalAmount.trim()));
        } catch (NumberFormatException ex) {
            throw new ProtocolException(ErrorCode.INVALID_AMOUNT, "Not a decimal amount: " + decimalAmount, ex);
        }
    }

    public BigDecimal toDisplay(long scaledAmount) {
        return BigDecimal.valueOf(scaledAmount, precision).stripTrailingZeros();
    }

    public boolean isAligned(String decimalAmount) {
        try {
            toScaled(decimalAmount);
            return true;
        } catch (ProtocolException ex) {
            return false;
        }
    }
}
