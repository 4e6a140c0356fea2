package deepGrid;

/**
 * Indicates whether a resting order buys base (bid) or sells base (ask).
 */
public enum OrderSide {
    BID,
    ASK
}
