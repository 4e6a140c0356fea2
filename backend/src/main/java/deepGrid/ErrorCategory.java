package deepGrid;

/**
 * Failure classes every protocol abort falls into.
 */
public enum ErrorCategory {
    VALIDATION,
    AUTHORIZATION,
    CONSISTENCY,
    INSUFFICIENCY,
    NOT_FOUND
}
