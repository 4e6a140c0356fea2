package deepGrid;

import io.javalin.http.UnauthorizedResponse;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class AuthServiceTest {

    @Test
    void bearerTokenIsExtracted() {
        Assertions.assertEquals("alpha-dev-key", AuthService.parseBearer("Bearer alpha-dev-key"));
        Assertions.assertEquals("alpha-dev-key", AuthService.parseBearer("  bearer   alpha-dev-key "));
    }

    @Test
    void missingOrForeignSchemesAreUnauthorized() {
        Assertions.assertThrows(UnauthorizedResponse.class, () -> AuthService.parseBearer(null));
        Assertions.assertThrows(UnauthorizedResponse.class, () -> AuthService.parseBearer(""));
        Assertions.assertThrows(UnauthorizedResponse.class, () -> AuthService.parseBearer("Basic dXNlcjpwYXNz"));
    }

    @Test
    void reRegisteringAUserRotatesTheirToken() {
        AccountManager accounts = new AccountManager();
        accounts.registerAccountWithApiKey("alpha", "old-key", false);

        accounts.registerAccountWithApiKey("alpha", "new-key", true);

        Assertions.assertTrue(accounts.findByToken("old-key").isEmpty());
        Assertions.assertTrue(accounts.findByToken("new-key").orElseThrow().isAdmin());
        Assertions.assertEquals(1, accounts.getAllAccounts().size());
    }

    @Test
    void tokenCannotBeSharedBetweenUsers() {
        AccountManager accounts = new AccountManager();
        accounts.registerAccountWithApiKey("alpha", "shared", false);

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> accounts.registerAccountWithApiKey("beta", "shared", false));
    }

    @Test
    void generatedTokensResolveToTheirAccount() {
        AccountManager accounts = new AccountManager();
        UserAccount account = accounts.registerAccount("gamma", false);

        Assertions.assertEquals("gamma", accounts.findByToken(account.getApiKey()).orElseThrow().getUserId());
        Assertions.assertTrue(accounts.findByToken(" ").isEmpty());
    }
}
