package deepGrid;

import io.javalin.http.Context;
import io.javalin.http.UnauthorizedResponse;

/**
 * Resolves the caller identity of an HTTP request from its bearer token.
 */
public final class AuthService {
    private static final String AUTH_HEADER = "Authorization";

    private final AccountManager accountManager;

    public AuthService(AccountManager accountManager) {
        this.accountManager = accountManager;
    }

    public UserAccount requireUser(Context ctx) {
        String token = extractToken(ctx);
        return accountManager.findByToken(token)
                .orElseThrow(() -> new UnauthorizedResponse("Invalid or missing API token"));
    }

    public UserAccount requireAdmin(Context ctx) {
        UserAccount account = requireUser(ctx);
        if (!account.isAdmin()) {
            throw new UnauthorizedResponse("Admin privileges required");
        }
        return account;
    }

    static String extractToken(Context ctx) {
        return parseBearer(ctx.header(AUTH_HEADER));
    }

    static String parseBearer(String header) {
        if (header == null || header.isBlank()) {
            throw new UnauthorizedResponse("Missing Authorization header");
        }
        String trimmed = header.trim();
        if (trimmed.length() < 7 || !trimmed.regionMatches(true, 0, "Bearer ", 0, 7)) {
            throw new UnauthorizedResponse("Authorization header must be Bearer token");
        }
        return trimmed.substring(trimmed.indexOf(' ') + 1).trim();
    }
}
