package deepGrid;

/**
 * Abort reasons surfaced by the protocol core. Each code belongs to exactly one {@link ErrorCategory}.
 */
public enum ErrorCode {

    ZERO_DEPOSIT(ErrorCategory.VALIDATION),
    ZERO_SHARES(ErrorCategory.VALIDATION),
    ZERO_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_CONFIG(ErrorCategory.VALIDATION),
    INVALID_PARAMETERS(ErrorCategory.VALIDATION),
    ARITHMETIC_OVERFLOW(ErrorCategory.VALIDATION),

    NOT_KEEPER(ErrorCategory.AUTHORIZATION),
    MISSING_IDENTITY(ErrorCategory.AUTHORIZATION),
    NOT_POSITION_OWNER(ErrorCategory.AUTHORIZATION),
    INVALID_CAPABILITY(ErrorCategory.AUTHORIZATION),

    VAULT_MISMATCH(ErrorCategory.CONSISTENCY),

    INSUFFICIENT_BALANCE(ErrorCategory.INSUFFICIENCY),
    INSUFFICIENT_FEES(ErrorCategory.INSUFFICIENCY),
    INSUFFICIENT_RESERVE(ErrorCategory.INSUFFICIENCY),
    NOTHING_TO_CLAIM(ErrorCategory.INSUFFICIENCY),
    NO_FEES(ErrorCategory.INSUFFICIENCY),

    NOT_FOUND(ErrorCategory.NOT_FOUND);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
