package deepGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic stand-in for an external central limit order book.
 *
 * <p>Orders rest unordered on each side. Nothing is matched order-against-order; instead
 * {@link #simulateTrade(boolean, long)} moves the reference price and fills, in full, every order
 * the move sweeps through. Realized value accumulates until {@link #takePendingFills()} drains it.
 */
public final class Orderbook {
    private static final Logger LOG = LoggerFactory.getLogger(Orderbook.class);

    private final String bookId;
    private final List<Order> bids = new ArrayList<>();
    private final List<Order> asks = new ArrayList<>();
    private long nextOrderId = 1L;
    private long midPrice;
    private long pendingFillBase;
    private long pendingFillQuote;

    Orderbook(String bookId, long initialMidPrice) {
        this.bookId = Objects.requireNonNull(bookId, "bookId");
        if (initialMidPrice <= 0L) {
            throw new ProtocolException(ErrorCode.INVALID_AMOUNT, "initial mid price must be positive");
        }
        this.midPrice = initialMidPrice;
    }

    /**
     * Rests a new order. Balance coverage is the caller's responsibility.
     */
    long place(OrderSide side, long price, long size, String owner) {
        Order order = new Order(nextOrderId, side, price, size, owner);
        nextOrderId++;
        if (side == OrderSide.BID) {
            bids.add(order);
        } else {
            asks.add(order);
        }
        LOG.debug("Book {} placed {} #{} price={} size={} owner={}", bookId, side, order.getOrderId(), price, size, owner);
        return order.getOrderId();
    }

    /**
     * Removes every order of {@code owner} from both sides.
     */
    int cancelAll(String owner) {
        Objects.requireNonNull(owner, "owner");
        int cancelled = removeOwned(bids, owner) + removeOwned(asks, owner);
        if (cancelled > 0) {
            LOG.debug("Book {} cancelled {} orders for {}", bookId, cancelled, owner);
        }
        return cancelled;
    }

    private static int removeOwned(List<Order> side, String owner) {
        int before = side.size();
        side.removeIf(order -> order.getOwner().equals(owner));
        return before - side.size();
    }

    /**
     * Moves the reference price by {@code priceDelta} and fills every order the move gaps through.
     * A rise fills asks at or below the new mid; a fall fills bids at or above it. A fall never
     * takes the price below 1.
     */
    TradeSimulatedEvent simulateTrade(boolean directionUp, long priceDelta) {
        WideMath.requireNonNegative(priceDelta, "price delta");
        long oldMid = midPrice;
        long newMid;
        if (directionUp) {
            newMid = WideMath.add(oldMid, priceDelta);
        } else {
            newMid = oldMid - priceDelta >= 1L ? oldMid - priceDelta : 1L;
        }

        List<Order> side = directionUp ? asks : bids;
        List<Order> crossed = new ArrayList<>();
        long baseFilled = 0L;
        long quoteEarned = 0L;
        for (Order order : side) {
            if (!order.isCrossedBy(newMid)) {
                continue;
            }
            crossed.add(order);
            if (directionUp) {
                quoteEarned = WideMath.add(quoteEarned, order.getNotional());
            } else {
                baseFilled = WideMath.add(baseFilled, order.getSize());
            }
        }
        long newPendingBase = WideMath.add(pendingFillBase, baseFilled);
        long newPendingQuote = WideMath.add(pendingFillQuote, quoteEarned);

        midPrice = newMid;
        for (Order order : crossed) {
            order.fill();
        }
        side.removeAll(crossed);
        pendingFillBase = newPendingBase;
        pendingFillQuote = newPendingQuote;

        int bidsFilled = directionUp ? 0 : crossed.size();
        int asksFilled = directionUp ? crossed.size() : 0;
        LOG.info("Book {} mid {} -> {}: bidsFilled={}, asksFilled={}, base={}, quote={}",
                bookId, oldMid, newMid, bidsFilled, asksFilled, baseFilled, quoteEarned);
        return new TradeSimulatedEvent(bookId, oldMid, newMid, bidsFilled, asksFilled, baseFilled, quoteEarned);
    }

    /**
     * Reads and zeroes the pending fill accumulators. A second call without new fills returns zeros.
     */
    PendingFills takePendingFills() {
        PendingFills fills = new PendingFills(pendingFillBase, pendingFillQuote);
        pendingFillBase = 0L;
        pendingFillQuote = 0L;
        return fills;
    }

    public String getBookId() {
        return bookId;
    }

    public long getMidPrice() {
        return midPrice;
    }

    public long getPendingFillBase() {
        return pendingFillBase;
    }

    public long getPendingFillQuote() {
        return pendingFillQuote;
    }

    public int size() {
        return bids.size() + asks.size();
    }

    public List<OrderDetails> getBids() {
        return details(bids);
    }

    public List<OrderDetails> getAsks() {
        return details(asks);
    }

    public List<OrderDetails> getOrdersFor(String owner) {
        List<OrderDetails> owned = new ArrayList<>();
        for (Order order : bids) {
            if (order.getOwner().equals(owner)) {
                owned.add(order.toDetails());
            }
        }
        for (Order order : asks) {
            if (order.getOwner().equals(owner)) {
                owned.add(order.toDetails());
            }
        }
        return owned;
    }

    private static List<OrderDetails> details(List<Order> side) {
        List<OrderDetails> details = new ArrayList<>(side.size());
        for (Order order : side) {
            details.add(order.toDetails());
        }
        return List.copyOf(details);
    }

    public OrderbookSnapshot snapshot() {
        return new OrderbookSnapshot(bookId, midPrice, getBids(), getAsks(), pendingFillBase, pendingFillQuote);
    }
}
