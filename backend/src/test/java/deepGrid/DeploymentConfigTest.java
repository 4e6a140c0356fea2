package deepGrid;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class DeploymentConfigTest {

    @Test
    void parsesEverySection() {
        DeploymentConfig config = DeploymentConfig.parse("{"
                + "\"orderBook\": {\"initialMidPrice\": 2000000000},"
                + "\"strategy\": {\"spreadBps\": 25, \"orderSize\": 500000000, \"numOrdersPerSide\": 3, \"keeper\": \"bot\"},"
                + "\"tokenMarket\": {\"tokenReserve\": 7000000000, \"price\": 50000000},"
                + "\"parameters\": {\"emissionPerAccrual\": 10, \"lpShareBps\": 5000, \"burnShareBps\": 10000},"
                + "\"accounts\": ["
                + "{\"userId\": \"bot\", \"apiKey\": \"bot-key\", \"admin\": true},"
                + "{\"userId\": \"eve\", \"apiKey\": \"eve-key\"},"
                + "{\"userId\": \"nokey\"}"
                + "]}");

        Assertions.assertEquals(2_000_000_000L, config.initialMidPrice());
        Assertions.assertEquals(25L, config.spreadBps());
        Assertions.assertEquals(500_000_000L, config.orderSize());
        Assertions.assertEquals(3, config.numOrdersPerSide());
        Assertions.assertEquals("bot", config.keeper());
        Assertions.assertEquals(7_000_000_000L, config.tokenReserve());
        Assertions.assertEquals(50_000_000L, config.tokenPrice());
        Assertions.assertEquals(new ProtocolParameters(10L, 5_000L, 10_000L), config.parameters());
        Assertions.assertEquals(2, config.accounts().size());
        Assertions.assertEquals(new DeploymentConfig.SeedAccount("bot", "bot-key", true), config.accounts().get(0));
        Assertions.assertFalse(config.accounts().get(1).admin());
    }

    @Test
    void missingSectionsFallBackToDefaults() {
        DeploymentConfig config = DeploymentConfig.parse("{}");

        Assertions.assertEquals(DeploymentConfig.defaults(), config);
        Assertions.assertEquals(ProtocolParameters.DEFAULTS, config.parameters());
        Assertions.assertEquals(DeploymentConfig.DEFAULT_KEEPER, config.keeper());
    }

    @Test
    void malformedDocumentsAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> DeploymentConfig.parse("[1, 2]"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> DeploymentConfig.parse("{ \"orderBook\": "));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DeploymentConfig.parse("{ \"strategy\": { \"spreadBps\": \"wide\" } }"));
    }

    @Test
    void oversizedOrderCountIsRejectedNotTruncated() {
        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> DeploymentConfig.parse("{ \"strategy\": { \"numOrdersPerSide\": 4294967298 } }"));

        Assertions.assertTrue(ex.getMessage().contains("numOrdersPerSide"));
    }

    @Test
    void invalidParametersSurfaceAsProtocolErrors() {
        ProtocolException ex = Assertions.assertThrows(ProtocolException.class,
                () -> DeploymentConfig.parse("{ \"parameters\": { \"lpShareBps\": 10000 } }"));

        Assertions.assertEquals(ErrorCode.INVALID_PARAMETERS, ex.getCode());
    }

    @Test
    void deployCreatesWorkingObjects() {
        DeepGridProtocol protocol = new DeepGridProtocol();

        DeploymentConfig.Deployment deployment = DeploymentConfig.defaults().deploy(protocol);

        Assertions.assertEquals(DeploymentConfig.DEFAULT_MID_PRICE, protocol.getOrderbook(deployment.bookId()).midPrice());
        Assertions.assertEquals(DeploymentConfig.DEFAULT_TOKEN_RESERVE,
                protocol.getMarket(deployment.marketId()).tokenReserve());
        Assertions.assertEquals(0L, protocol.getVault(deployment.vaultId()).totalShares());
        Assertions.assertEquals(4, protocol.getEvents().size());
    }

    @Test
    void bundledConfigMatchesDefaults() {
        DeploymentConfig bundled = DeploymentConfig.load();

        Assertions.assertEquals(DeploymentConfig.DEFAULT_MID_PRICE, bundled.initialMidPrice());
        Assertions.assertEquals(ProtocolParameters.DEFAULTS, bundled.parameters());
        Assertions.assertFalse(bundled.accounts().isEmpty());
    }
}
