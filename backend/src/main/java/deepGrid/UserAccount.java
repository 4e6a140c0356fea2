package deepGrid;

import java.util.Objects;
import java.util.UUID;

/**
 * An identity allowed to call the protocol API. The user id is the identity the core sees as
 * depositor, claimant or keeper.
 */
public final class UserAccount {
    private final String userId;
    private final String apiKey;
    private final boolean admin;

    public static UserAccount create(String userId, boolean admin) {
        return new UserAccount(userId, generateApiKey(), admin);
    }

    public static UserAccount createWithApiKey(String userId, String apiKey, boolean admin) {
        return new UserAccount(userId, apiKey, admin);
    }

    private static String generateApiKey() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private UserAccount(String userId, String apiKey, boolean admin) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.admin = admin;
    }

    public String getUserId() {
        return userId;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean isAdmin() {
        return admin;
    }
}
