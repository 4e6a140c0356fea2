package deepGrid;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the keeper's order cycle for a vault: replaces its resting orders around the current mid
 * and settles fills back into the vault ledger.
 */
public final class StrategyController {
    private static final Logger LOG = LoggerFactory.getLogger(StrategyController.class);

    private StrategyController() {
    }

    /**
     * Cancels the vault's orders, releases everything the vault had locked, then quotes
     * {@code numOrdersPerSide} bids and asks at {@code mid -/+ mid * spreadBps / 10000}.
     * Placements the unlocked balance cannot cover are skipped.
     *
     * <p>Releasing the whole locked amount is exact only while locked totals equal open-order
     * commitments; every placement here locks exactly what it commits.
     */
    static RebalanceEvent rebalance(String caller, Vault vault, StrategyConfig config, Orderbook book) {
        Objects.requireNonNull(vault, "vault");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(book, "book");
        if (!config.isKeeper(caller)) {
            throw new ProtocolException(ErrorCode.NOT_KEEPER, "Caller " + caller + " is not the configured keeper");
        }

        long mid = book.getMidPrice();
        long offset = WideMath.bps(mid, config.getSpreadBps());
        long bidPrice = mid - offset;
        long askPrice = WideMath.add(mid, offset);
        long orderSize = config.getOrderSize();
        long bidCost = WideMath.mulDiv(orderSize, bidPrice, WideMath.FLOAT_SCALING);

        String owner = vault.getVaultId();
        int cancelled = book.cancelAll(owner);
        vault.unlockBase(vault.getLockedBase());
        vault.unlockQuote(vault.getLockedQuote());

        int placed = 0;
        for (int i = 0; i < config.getNumOrdersPerSide(); i++) {
            if (bidCost > 0L && vault.getAvailableQuote() >= bidCost) {
                book.place(OrderSide.BID, bidPrice, orderSize, owner);
                vault.lockQuote(bidCost);
                placed++;
            } else {
                LOG.debug("Skipping bid for vault {}: needs {} quote, {} available", owner, bidCost, vault.getAvailableQuote());
            }
            if (vault.getAvailableBase() >= orderSize) {
                book.place(OrderSide.ASK, askPrice, orderSize, owner);
                vault.lockBase(orderSize);
                placed++;
            } else {
                LOG.debug("Skipping ask for vault {}: needs {} base, {} available", owner, orderSize, vault.getAvailableBase());
            }
        }

        LOG.info("Rebalanced vault {} on {}: mid={}, bid={}, ask={}, cancelled={}, placed={}",
                owner, book.getBookId(), mid, bidPrice, askPrice, cancelled, placed);
        return new RebalanceEvent(owner, mid, bidPrice, askPrice, cancelled, placed);
    }

    /**
     * Drains the book's pending fills into the vault. Each side unlocks the lesser of its fill and
     * its locked amount. Earned quote goes to the fee bucket, not the pooled quote, until a buyback
     * splits it.
     */
    static SettlementEvent settle(Vault vault, Orderbook book) {
        Objects.requireNonNull(vault, "vault");
        Objects.requireNonNull(book, "book");
        WideMath.add(vault.getBaseBalance(), book.getPendingFillBase());
        WideMath.add(vault.getAccruedFeeQuote(), book.getPendingFillQuote());

        PendingFills fills = book.takePendingFills();
        vault.unlockBase(Math.min(fills.base(), vault.getLockedBase()));
        vault.unlockQuote(Math.min(fills.quote(), vault.getLockedQuote()));
        vault.creditBase(fills.base());
        vault.addFeeQuote(fills.quote());

        LOG.info("Settled vault {} from {}: baseReturned={}, quoteEarned={}",
                vault.getVaultId(), book.getBookId(), fills.base(), fills.quote());
        return new SettlementEvent(vault.getVaultId(), fills.base(), fills.quote());
    }
}
