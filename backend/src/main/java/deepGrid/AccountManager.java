package deepGrid;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory account repository with token based authentication.
 */
public final class AccountManager {
    private final ConcurrentHashMap<String, UserAccount> accountsById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, UserAccount> accountsByToken = new ConcurrentHashMap<>();

    public UserAccount registerAccount(String userId, boolean admin) {
        UserAccount account = UserAccount.create(userId, admin);
        storeAccount(account);
        return account;
    }

    public UserAccount registerAccountWithApiKey(String userId, String apiKey, boolean admin) {
        Objects.requireNonNull(apiKey, "apiKey");
        UserAccount existingWithToken = accountsByToken.get(apiKey);
        if (existingWithToken != null && !existingWithToken.getUserId().equals(userId)) {
            throw new IllegalArgumentException("API token already assigned to another user");
        }
        UserAccount account = UserAccount.createWithApiKey(userId, apiKey, admin);
        storeAccount(account);
        return account;
    }

    public Optional<UserAccount> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(accountsByToken.get(token));
    }

    public Collection<UserAccount> getAllAccounts() {
        return accountsById.values();
    }

    private void storeAccount(UserAccount account) {
        Objects.requireNonNull(account, "account");
        UserAccount previous = accountsById.put(account.getUserId(), account);
        if (previous != null) {
            accountsByToken.remove(previous.getApiKey());
        }
        accountsByToken.put(account.getApiKey(), account);
    }
}
