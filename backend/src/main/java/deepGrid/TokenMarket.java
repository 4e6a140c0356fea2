package deepGrid;

import java.util.Objects;

/**
 * Fixed-price GRID market funded once at creation. Buying never moves the price.
 */
public final class TokenMarket {
    private final String marketId;
    private final long priceQuotePerToken;
    private long tokenReserve;
    private long quoteReserve;

    TokenMarket(String marketId, long tokenReserve, long priceQuotePerToken) {
        this.marketId = Objects.requireNonNull(marketId, "marketId");
        WideMath.requireNonNegative(tokenReserve, "token reserve");
        if (priceQuotePerToken <= 0L) {
            throw new ProtocolException(ErrorCode.INVALID_AMOUNT, "price must be positive");
        }
        this.tokenReserve = tokenReserve;
        this.priceQuotePerToken = priceQuotePerToken;
    }

    /**
     * Tokens {@code quoteIn} would buy, checked against the reserve without changing anything.
     */
    long quote(long quoteIn) {
        WideMath.requireNonNegative(quoteIn, "quote in");
        if (quoteIn == 0L) {
            throw new ProtocolException(ErrorCode.ZERO_AMOUNT, "Purchase amount must be positive");
        }
        long tokenOut = WideMath.mulDiv(quoteIn, WideMath.FLOAT_SCALING, priceQuotePerToken);
        if (tokenOut > tokenReserve) {
            throw new ProtocolException(ErrorCode.INSUFFICIENT_RESERVE,
                    "Market " + marketId + " holds " + tokenReserve + " tokens, " + tokenOut + " requested");
        }
        WideMath.add(quoteReserve, quoteIn);
        return tokenOut;
    }

    long buy(long quoteIn) {
        long tokenOut = quote(quoteIn);
        quoteReserve += quoteIn;
        tokenReserve -= tokenOut;
        return tokenOut;
    }

    public String getMarketId() {
        return marketId;
    }

    public long getTokenReserve() {
        return tokenReserve;
    }

    public long getQuoteReserve() {
        return quoteReserve;
    }

    public long getPriceQuotePerToken() {
        return priceQuotePerToken;
    }

    public MarketSnapshot snapshot() {
        return new MarketSnapshot(marketId, tokenReserve, quoteReserve, priceQuotePerToken);
    }
}
