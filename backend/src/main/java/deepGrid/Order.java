package deepGrid;

import java.util.Objects;

/**
 * A resting order on the simulated book. Fills are all-or-nothing: an order is either untouched
 * or consumed in full when the reference price gaps through it.
 */
public final class Order {

    private final long orderId;
    private final OrderSide side;
    private final long price;
    private final long size;
    private final String owner;
    private long filled;

    /**
     * Constructs a resting order.
     *
     * @param orderId identifier unique within its book
     * @param side    side of the book the order rests on
     * @param price   limit price, quote per base scaled by 1e9
     * @param size    base amount scaled by 1e9
     * @param owner   identifier of the vault that placed the order
     */
    public Order(long orderId, OrderSide side, long price, long size, String owner) {
        if (orderId <= 0L) {
            throw new IllegalArgumentException("orderId must be positive");
        }
        this.orderId = orderId;
        this.side = Objects.requireNonNull(side, "side");
        this.owner = Objects.requireNonNull(owner, "owner");
        if (price <= 0L) {
            throw new ProtocolException(ErrorCode.INVALID_AMOUNT, "price must be positive");
        }
        if (size <= 0L) {
            throw new ProtocolException(ErrorCode.INVALID_AMOUNT, "size must be positive");
        }
        this.price = price;
        this.size = size;
    }

    public long getOrderId() {
        return orderId;
    }

    public OrderSide getSide() {
        return side;
    }

    public long getPrice() {
        return price;
    }

    public long getSize() {
        return size;
    }

    public String getOwner() {
        return owner;
    }

    public long getFilled() {
        return filled;
    }

    public boolean isFilled() {
        return filled == size;
    }

    /**
     * Quote value of the whole order at its limit price.
     */
    public long getNotional() {
        return WideMath.mulDiv(size, price, WideMath.FLOAT_SCALING);
    }

    /**
     * Whether a move of the reference price to {@code midPrice} sweeps through this order.
     */
    public boolean isCrossedBy(long midPrice) {
        return side == OrderSide.ASK ? price <= midPrice : price >= midPrice;
    }

    void fill() {
        if (isFilled()) {
            throw new IllegalStateException("Order " + orderId + " is already filled");
        }
        filled = size;
    }

    public OrderDetails toDetails() {
        return new OrderDetails(orderId, owner, side, price, size, filled);
    }
}
