package deepGrid;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MainTest {

    @Test
    void errorCategoriesMapToHttpStatuses() {
        Assertions.assertEquals(400, Main.statusFor(ErrorCode.ZERO_DEPOSIT.category()));
        Assertions.assertEquals(403, Main.statusFor(ErrorCode.NOT_KEEPER.category()));
        Assertions.assertEquals(409, Main.statusFor(ErrorCode.VAULT_MISMATCH.category()));
        Assertions.assertEquals(422, Main.statusFor(ErrorCode.INSUFFICIENT_RESERVE.category()));
        Assertions.assertEquals(404, Main.statusFor(ErrorCode.NOT_FOUND.category()));
    }

    @Test
    void tradeDirectionIsParsedLeniently() {
        Assertions.assertTrue(Main.parseDirection("up"));
        Assertions.assertTrue(Main.parseDirection(" U "));
        Assertions.assertFalse(Main.parseDirection("Down"));
        Assertions.assertThrows(ProtocolException.class, () -> Main.parseDirection("sideways"));
    }
}
