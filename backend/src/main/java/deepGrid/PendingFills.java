package deepGrid;

/**
 * Value realized by fills since the last settlement sweep.
 *
 * @param base  base bought by filled bids
 * @param quote quote earned by filled asks
 */
public record PendingFills(long base, long quote) {
}
