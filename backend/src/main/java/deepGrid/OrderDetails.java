package deepGrid;

/**
 * Immutable view of a resting order.
 */
public record OrderDetails(long orderId, String owner, OrderSide side, long price, long size, long filled) {
}
