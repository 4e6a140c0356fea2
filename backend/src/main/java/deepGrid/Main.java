package deepGrid;

import io.javalin.Javalin;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);
    private static final PriceScale SCALE = PriceScale.DEFAULT;

    public static void main(String[] args) {
        DeploymentConfig config = DeploymentConfig.load();
        DeepGridProtocol protocol = new DeepGridProtocol(config.parameters());
        DeploymentConfig.Deployment deployment = config.deploy(protocol);

        AccountManager accountManager = new AccountManager();
        if (config.accounts().isEmpty()) {
            accountManager.registerAccount(config.keeper(), true);
            accountManager.registerAccount("alpha", false);
            accountManager.registerAccount("beta", false);
        } else {
            for (DeploymentConfig.SeedAccount seed : config.accounts()) {
                try {
                    accountManager.registerAccountWithApiKey(seed.userId(), seed.apiKey(), seed.admin());
                } catch (IllegalArgumentException ex) {
                    LOG.warn("Failed to register seed account {}: {}", seed.userId(), ex.getMessage());
                }
            }
        }

        LOG.info("Provisioned accounts:");
        for (UserAccount account : accountManager.getAllAccounts()) {
            LOG.info("user={} token={} admin={}", account.getUserId(), account.getApiKey(), account.isAdmin());
        }

        EventFeedService feed = new EventFeedService();
        protocol.getEvents().onEvent(feed::broadcast);
        AuthService authService = new AuthService(accountManager);

        Javalin app = Javalin.create(javalinConfig -> javalinConfig.jsonMapper(new GsonJsonMapper()))
                .start("0.0.0.0", resolvePort());

        app.options("/*", ctx -> ctx.status(204));

        app.before(ctx -> {
            ctx.header("Access-Control-Allow-Origin", "*");
            ctx.header("Access-Control-Allow-Headers", "Origin, Content-Type, Accept, Authorization");
            ctx.header("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        });

        app.exception(ProtocolException.class, (ex, ctx) -> {
            LOG.warn("Rejected {} {}: {} {}", ctx.method(), ctx.path(), ex.getCode(), ex.getMessage());
            ctx.status(statusFor(ex.getCategory())).json(Map.of(
                    "status", "error",
                    "code", ex.getCode().name(),
                    "message", ex.getMessage()));
        });

        app.get("/api/deployment", ctx -> ctx.json(deployment));

        app.post("/api/vaults/{vaultId}/deposit", ctx -> {
            UserAccount user = authService.requireUser(ctx);
            DepositPayload payload = ctx.bodyValidator(DepositPayload.class)
                    .check(p -> p.base() != null || p.quote() != null, "base or quote is required")
                    .get();
            long base = payload.base() != null ? SCALE.toScaled(payload.base()) : 0L;
            long quote = payload.quote() != null ? SCALE.toScaled(payload.quote()) : 0L;
            ctx.json(protocol.deposit(user.getUserId(), ctx.pathParam("vaultId"), base, quote));
        });

        app.post("/api/vaults/{vaultId}/positions/{positionId}/withdraw", ctx -> {
            UserAccount user = authService.requireUser(ctx);
            ctx.json(protocol.withdraw(user.getUserId(), ctx.pathParam("vaultId"), ctx.pathParam("positionId")));
        });

        app.post("/api/vaults/{vaultId}/rebalance", ctx -> {
            UserAccount user = authService.requireUser(ctx);
            RebalancePayload payload = ctx.bodyValidator(RebalancePayload.class)
                    .check(p -> p.configId() != null && p.bookId() != null, "configId and bookId are required")
                    .get();
            ctx.json(protocol.rebalance(user.getUserId(), ctx.pathParam("vaultId"), payload.configId(), payload.bookId()));
        });

        app.post("/api/vaults/{vaultId}/settle", ctx -> {
            authService.requireUser(ctx);
            SettlePayload payload = ctx.bodyValidator(SettlePayload.class)
                    .check(p -> p.bookId() != null, "bookId is required")
                    .get();
            ctx.json(protocol.settle(ctx.pathParam("vaultId"), payload.bookId()));
        });

        app.post("/api/books/{bookId}/trade", ctx -> {
            authService.requireAdmin(ctx);
            TradePayload payload = ctx.bodyValidator(TradePayload.class)
                    .check(p -> p.direction() != null && p.delta() != null, "direction and delta are required")
                    .get();
            boolean up = parseDirection(payload.direction());
            ctx.json(protocol.simulateTrade(ctx.pathParam("bookId"), up, SCALE.toScaled(payload.delta())));
        });

        app.post("/api/vaults/{vaultId}/rewards/accrue", ctx -> {
            authService.requireAdmin(ctx);
            String vaultId = ctx.pathParam("vaultId");
            protocol.accrueRewards(vaultId, protocol.getTreasury()).ifPresentOrElse(
                    ctx::json,
                    () -> ctx.json(Map.of("status", "skipped", "vaultId", vaultId, "reason", "vault has no shares")));
        });

        app.post("/api/vaults/{vaultId}/positions/{positionId}/claim", ctx -> {
            UserAccount user = authService.requireUser(ctx);
            ctx.json(protocol.claimRewards(user.getUserId(), ctx.pathParam("vaultId"), ctx.pathParam("positionId"),
                    protocol.getTreasury()));
        });

        app.post("/api/vaults/{vaultId}/buyback", ctx -> {
            authService.requireAdmin(ctx);
            BuybackPayload payload = ctx.bodyValidator(BuybackPayload.class)
                    .check(p -> p.marketId() != null, "marketId is required")
                    .get();
            ctx.json(protocol.executeBuyback(ctx.pathParam("vaultId"), payload.marketId(), protocol.getTreasury()));
        });

        app.get("/api/vaults/{vaultId}", ctx -> ctx.json(protocol.getVault(ctx.pathParam("vaultId"))));
        app.get("/api/books/{bookId}", ctx -> ctx.json(protocol.getOrderbook(ctx.pathParam("bookId"))));
        app.get("/api/markets/{marketId}", ctx -> ctx.json(protocol.getMarket(ctx.pathParam("marketId"))));

        app.get("/api/positions", ctx -> {
            UserAccount user = authService.requireUser(ctx);
            ctx.json(protocol.getPositionsOf(user.getUserId()));
        });

        app.get("/api/vaults/{vaultId}/positions/{positionId}/pending", ctx -> {
            String positionId = ctx.pathParam("positionId");
            long pending = protocol.pendingRewards(ctx.pathParam("vaultId"), positionId);
            ctx.json(Map.of("positionId", positionId, "pending", pending));
        });

        app.get("/api/balance", ctx -> {
            UserAccount user = authService.requireUser(ctx);
            ctx.json(Map.of("holder", user.getUserId(), "grid", protocol.getTokenBalance(user.getUserId())));
        });

        app.get("/api/events", ctx -> {
            List<Map<String, Object>> payload = protocol.getEvents().history().stream()
                    .map(EventFeedService::toPayload)
                    .toList();
            ctx.json(payload);
        });

        app.ws("/ws/events", ws -> {
            ws.onConnect(ctx -> {
                feed.register(ctx.session);
                feed.sendHistory(ctx.session, protocol.getEvents().history());
            });
            ws.onClose(ctx -> feed.unregister(ctx.session));
        });
    }

    static int statusFor(ErrorCategory category) {
        return switch (category) {
            case VALIDATION -> 400;
            case AUTHORIZATION -> 403;
            case CONSISTENCY -> 409;
            case INSUFFICIENCY -> 422;
            case NOT_FOUND -> 404;
        };
    }

    static boolean parseDirection(String token) {
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "UP", "U" -> true;
            case "DOWN", "D" -> false;
            default -> throw new ProtocolException(ErrorCode.INVALID_AMOUNT, "direction must be up or down: " + token);
        };
    }

    private static int resolvePort() {
        String envPort = System.getenv("PORT");
        if (envPort != null && !envPort.isBlank()) {
            try {
                return Integer.parseInt(envPort.trim());
            } catch (NumberFormatException ex) {
                LOG.warn("Invalid PORT environment value '{}', falling back to 7070", envPort);
            }
        }
        return 7070;
    }

    private record DepositPayload(String base, String quote) {
    }

    private record RebalancePayload(String configId, String bookId) {
    }

    private record SettlePayload(String bookId) {
    }

    private record TradePayload(String direction, String delta) {
    }

    private record BuybackPayload(String marketId) {
    }
}
