package deepGrid;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstrap description of a deployment: the order book, keeper strategy, GRID market,
 * protocol parameters and the accounts allowed to call the HTTP API.
 */
public record DeploymentConfig(
        long initialMidPrice,
        long spreadBps,
        long orderSize,
        int numOrdersPerSide,
        String keeper,
        long tokenReserve,
        long tokenPrice,
        ProtocolParameters parameters,
        List<SeedAccount> accounts) {

    private static final Logger LOG = LoggerFactory.getLogger(DeploymentConfig.class);
    private static final Gson JSON = new Gson();
    private static final String CONFIG_ENV = "DEEPGRID_CONFIG";
    private static final String CONFIG_RESOURCE = "/deepgrid.json";

    public static final long DEFAULT_MID_PRICE = 10_000_000_000L;
    public static final long DEFAULT_SPREAD_BPS = 50L;
    public static final long DEFAULT_ORDER_SIZE = 1_000_000_000L;
    public static final int DEFAULT_ORDERS_PER_SIDE = 2;
    public static final String DEFAULT_KEEPER = "keeper";
    public static final long DEFAULT_TOKEN_RESERVE = 1_000_000_000_000_000L;
    public static final long DEFAULT_TOKEN_PRICE = 100_000_000L;

    public DeploymentConfig {
        accounts = List.copyOf(accounts);
    }

    public record SeedAccount(String userId, String apiKey, boolean admin) {
    }

    /**
     * Ids of the objects created by {@link #deploy(DeepGridProtocol)}.
     */
    public record Deployment(String vaultId, String configId, String bookId, String marketId) {
    }

    public static DeploymentConfig defaults() {
        return new DeploymentConfig(DEFAULT_MID_PRICE, DEFAULT_SPREAD_BPS, DEFAULT_ORDER_SIZE, DEFAULT_ORDERS_PER_SIDE,
                DEFAULT_KEEPER, DEFAULT_TOKEN_RESERVE, DEFAULT_TOKEN_PRICE, ProtocolParameters.DEFAULTS, List.of());
    }

    /**
     * Reads the file named by {@code DEEPGRID_CONFIG}, else the bundled {@code deepgrid.json},
     * else falls back to {@link #defaults()}.
     */
    public static DeploymentConfig load() {
        String override = System.getenv(CONFIG_ENV);
        if (override != null && !override.isBlank()) {
            Path path = Path.of(override.trim());
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                LOG.info("Loading deployment config from {}", path);
                return parse(reader);
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read deployment config " + path, ex);
            }
        }
        try (InputStream stream = DeploymentConfig.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (stream == null) {
                LOG.info("No {} on classpath, using defaults", CONFIG_RESOURCE);
                return defaults();
            }
            return parse(new InputStreamReader(stream, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, ex);
        }
    }

    public static DeploymentConfig parse(String json) {
        return parse(new java.io.StringReader(json));
    }

    static DeploymentConfig parse(Reader reader) {
        JsonElement root;
        try {
            root = JSON.fromJson(reader, JsonElement.class);
        } catch (JsonParseException ex) {
            throw new IllegalArgumentException("Deployment config must be valid JSON", ex);
        }
        if (root == null || !root.isJsonObject()) {
            throw new IllegalArgumentException("Deployment config must be a JSON object");
        }
        JsonObject object = root.getAsJsonObject();
        JsonObject book = getOptionalObject(object, "orderBook");
        JsonObject strategy = getOptionalObject(object, "strategy");
        JsonObject market = getOptionalObject(object, "tokenMarket");
        JsonObject params = getOptionalObject(object, "parameters");

        ProtocolParameters defaults = ProtocolParameters.DEFAULTS;
        ProtocolParameters parameters = new ProtocolParameters(
                getLong(params, "emissionPerAccrual", defaults.emissionPerAccrual()),
                getLong(params, "lpShareBps", defaults.lpShareBps()),
                getLong(params, "burnShareBps", defaults.burnShareBps()));

        String keeper = getOptionalString(strategy, "keeper");
        return new DeploymentConfig(
                getLong(book, "initialMidPrice", DEFAULT_MID_PRICE),
                getLong(strategy, "spreadBps", DEFAULT_SPREAD_BPS),
                getLong(strategy, "orderSize", DEFAULT_ORDER_SIZE),
                getInt(strategy, "numOrdersPerSide", DEFAULT_ORDERS_PER_SIDE),
                keeper != null ? keeper : DEFAULT_KEEPER,
                getLong(market, "tokenReserve", DEFAULT_TOKEN_RESERVE),
                getLong(market, "price", DEFAULT_TOKEN_PRICE),
                parameters,
                extractAccounts(object));
    }

    /**
     * Creates the vault, strategy config, order book and GRID market this config describes.
     */
    public Deployment deploy(DeepGridProtocol protocol) {
        String vaultId = protocol.createVault().vaultId();
        String configId = protocol.createStrategyConfig(spreadBps, orderSize, numOrdersPerSide, keeper).configId();
        String bookId = protocol.createOrderBook(initialMidPrice).bookId();
        String marketId = protocol.createTokenMarket(protocol.getTreasury(), tokenReserve, tokenPrice).marketId();
        Deployment deployment = new Deployment(vaultId, configId, bookId, marketId);
        LOG.info("Deployed {}", deployment);
        return deployment;
    }

    private static List<SeedAccount> extractAccounts(JsonObject object) {
        if (!object.has("accounts") || !object.get("accounts").isJsonArray()) {
            return List.of();
        }
        List<SeedAccount> seeds = new ArrayList<>();
        for (JsonElement element : object.getAsJsonArray("accounts")) {
            if (!element.isJsonObject()) {
                continue;
            }
            JsonObject account = element.getAsJsonObject();
            String userId = getOptionalString(account, "userId");
            String apiKey = getOptionalString(account, "apiKey");
            if (userId == null || apiKey == null) {
                LOG.warn("Skipping seed account with missing userId or apiKey");
                continue;
            }
            boolean admin = account.has("admin") && account.get("admin").getAsBoolean();
            seeds.add(new SeedAccount(userId, apiKey, admin));
        }
        return List.copyOf(seeds);
    }

    private static JsonObject getOptionalObject(JsonObject object, String member) {
        if (object.has(member) && object.get(member).isJsonObject()) {
            return object.getAsJsonObject(member);
        }
        return new JsonObject();
    }

    private static long getLong(JsonObject object, String member, long fallback) {
        if (!object.has(member) || object.get(member).isJsonNull()) {
            return fallback;
        }
        try {
            return object.get(member).getAsLong();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
            throw new IllegalArgumentException("'" + member + "' must be an integer", ex);
        }
    }

    private static int getInt(JsonObject object, String member, int fallback) {
        long value = getLong(object, member, fallback);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("'" + member + "' is out of range: " + value, ex);
        }
    }

    private static String getOptionalString(JsonObject object, String member) {
        if (object.has(member) && object.get(member).isJsonPrimitive()) {
            String value = object.get(member).getAsString();
            return value != null && !value.isBlank() ? value : null;
        }
        return null;
    }
}
