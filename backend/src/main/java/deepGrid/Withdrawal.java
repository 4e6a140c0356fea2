package deepGrid;

/**
 * Amounts paid out by a full withdrawal of one share position.
 */
public record Withdrawal(long baseOut, long quoteOut, long sharesBurned) {
}
