package deepGrid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point of the protocol core.
 *
 * <p>Entities live in an arena keyed by opaque ids. Every operation runs under one lock, so each is
 * a single indivisible transition and operations are applied in one global order. A failing
 * operation throws {@link ProtocolException} before its first write.
 */
public final class DeepGridProtocol {
    private static final Logger LOG = LoggerFactory.getLogger(DeepGridProtocol.class);

    private final ReentrantLock txLock = new ReentrantLock();
    private final ProtocolParameters parameters;
    private final GridTreasury treasury = new GridTreasury();
    private final IncentiveAccumulator incentives;
    private final BuybackEngine buyback;
    private final EventLog events = new EventLog();

    private final Map<String, Vault> vaults = new LinkedHashMap<>();
    private final Map<String, SharePosition> positions = new LinkedHashMap<>();
    private final Map<String, Orderbook> books = new LinkedHashMap<>();
    private final Map<String, StrategyConfig> configs = new LinkedHashMap<>();
    private final Map<String, TokenMarket> markets = new LinkedHashMap<>();

    private final IdGenerator vaultIds = new IdGenerator("vault");
    private final IdGenerator positionIds = new IdGenerator("share");
    private final IdGenerator bookIds = new IdGenerator("book");
    private final IdGenerator configIds = new IdGenerator("config");
    private final IdGenerator marketIds = new IdGenerator("market");

    public DeepGridProtocol() {
        this(ProtocolParameters.DEFAULTS);
    }

    public DeepGridProtocol(ProtocolParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.incentives = new IncentiveAccumulator(parameters);
        this.buyback = new BuybackEngine(parameters);
    }

    /**
     * Capability required to mint or burn GRID through the protocol.
     */
    public GridTreasury getTreasury() {
        return treasury;
    }

    public EventLog getEvents() {
        return events;
    }

    // Vault ---------------------------------------------------------------------------------

    public VaultCreatedEvent createVault() {
        return inTransaction(() -> {
            Vault vault = new Vault(vaultIds.nextId());
            vaults.put(vault.getVaultId(), vault);
            LOG.info("Created vault {}", vault.getVaultId());
            return events.append(new VaultCreatedEvent(vault.getVaultId()));
        });
    }

    public DepositEvent deposit(String depositor, String vaultId, long baseAmount, long quoteAmount) {
        requireIdentity(depositor);
        return inTransaction(() -> {
            Vault vault = requireVault(vaultId);
            SharePosition position = vault.deposit(positionIds.nextId(), depositor, baseAmount, quoteAmount);
            positions.put(position.getPositionId(), position);
            LOG.info("Deposit into {} by {}: base={}, quote={}, shares={}, totalShares={}",
                    vaultId, depositor, baseAmount, quoteAmount, position.getShares(), vault.getTotalShares());
            return events.append(new DepositEvent(vaultId, depositor, position.getPositionId(), baseAmount, quoteAmount,
                    position.getShares(), vault.getTotalShares()));
        });
    }

    public WithdrawEvent withdraw(String caller, String vaultId, String positionId) {
        return inTransaction(() -> {
            Vault vault = requireVault(vaultId);
            SharePosition position = requireOwnedPosition(caller, positionId);
            Withdrawal withdrawal = vault.withdraw(position);
            positions.remove(positionId);
            LOG.info("Withdraw from {} by {}: base={}, quote={}, sharesBurned={}, totalShares={}",
                    vaultId, caller, withdrawal.baseOut(), withdrawal.quoteOut(), withdrawal.sharesBurned(), vault.getTotalShares());
            return events.append(new WithdrawEvent(vaultId, caller, positionId, withdrawal.baseOut(), withdrawal.quoteOut(),
                    withdrawal.sharesBurned(), vault.getTotalShares()));
        });
    }

    // Strategy ------------------------------------------------------------------------------

    public StrategyConfigCreatedEvent createStrategyConfig(long spreadBps, long orderSize, int numOrdersPerSide, String keeper) {
        return inTransaction(() -> {
            StrategyConfig config = new StrategyConfig(configIds.nextId(), spreadBps, orderSize, numOrdersPerSide, keeper);
            configs.put(config.getConfigId(), config);
            LOG.info("Created strategy config {}: spreadBps={}, orderSize={}, ordersPerSide={}, keeper={}",
                    config.getConfigId(), spreadBps, orderSize, numOrdersPerSide, keeper);
            return events.append(new StrategyConfigCreatedEvent(config.getConfigId(), spreadBps, orderSize, numOrdersPerSide, keeper));
        });
    }

    public RebalanceEvent rebalance(String caller, String vaultId, String configId, String bookId) {
        return inTransaction(() -> events.append(
                StrategyController.rebalance(caller, requireVault(vaultId), requireConfig(configId), requireBook(bookId))));
    }

    public SettlementEvent settle(String vaultId, String bookId) {
        return inTransaction(() -> events.append(StrategyController.settle(requireVault(vaultId), requireBook(bookId))));
    }

    // Order book ----------------------------------------------------------------------------

    public OrderBookCreatedEvent createOrderBook(long initialMidPrice) {
        return inTransaction(() -> {
            Orderbook book = new Orderbook(bookIds.nextId(), initialMidPrice);
            books.put(book.getBookId(), book);
            LOG.info("Created order book {} at mid {}", book.getBookId(), initialMidPrice);
            return events.append(new OrderBookCreatedEvent(book.getBookId(), initialMidPrice));
        });
    }

    public TradeSimulatedEvent simulateTrade(String bookId, boolean directionUp, long priceDelta) {
        return inTransaction(() -> events.append(requireBook(bookId).simulateTrade(directionUp, priceDelta)));
    }

    // Incentives ----------------------------------------------------------------------------

    /**
     * Emits one round of GRID into the vault's reward pool; empty when the vault has no shares.
     */
    public Optional<RewardsAccruedEvent> accrueRewards(String vaultId, GridTreasury treasuryCap) {
        return inTransaction(() -> {
            requireTreasury(treasuryCap);
            return incentives.accrue(requireVault(vaultId), treasuryCap).map(events::append);
        });
    }

    public RewardsClaimedEvent claimRewards(String caller, String vaultId, String positionId, GridTreasury treasuryCap) {
        return inTransaction(() -> {
            requireTreasury(treasuryCap);
            Vault vault = requireVault(vaultId);
            SharePosition position = requireOwnedPosition(caller, positionId);
            return events.append(IncentiveAccumulator.claim(vault, position, treasuryCap));
        });
    }

    public long pendingRewards(String vaultId, String positionId) {
        return inTransaction(() -> IncentiveAccumulator.pending(requireVault(vaultId), requirePosition(positionId)));
    }

    // Buyback -------------------------------------------------------------------------------

    public TokenMarketCreatedEvent createTokenMarket(GridTreasury treasuryCap, long initialTokenReserve, long priceQuotePerToken) {
        return inTransaction(() -> {
            requireTreasury(treasuryCap);
            TokenMarket market = BuybackEngine.createMarket(marketIds.nextId(), treasuryCap, initialTokenReserve, priceQuotePerToken);
            markets.put(market.getMarketId(), market);
            return events.append(new TokenMarketCreatedEvent(market.getMarketId(), initialTokenReserve, priceQuotePerToken));
        });
    }

    public BuybackEvent executeBuyback(String vaultId, String marketId, GridTreasury treasuryCap) {
        return inTransaction(() -> {
            requireTreasury(treasuryCap);
            return events.append(buyback.executeBuyback(requireVault(vaultId), requireMarket(marketId), treasuryCap));
        });
    }

    // Views ---------------------------------------------------------------------------------

    public VaultSnapshot getVault(String vaultId) {
        return inTransaction(() -> requireVault(vaultId).snapshot());
    }

    public OrderbookSnapshot getOrderbook(String bookId) {
        return inTransaction(() -> requireBook(bookId).snapshot());
    }

    public MarketSnapshot getMarket(String marketId) {
        return inTransaction(() -> requireMarket(marketId).snapshot());
    }

    public PositionView getPosition(String positionId) {
        return inTransaction(() -> PositionView.of(requirePosition(positionId)));
    }

    public List<PositionView> getPositionsOf(String owner) {
        return inTransaction(() -> {
            List<PositionView> owned = new ArrayList<>();
            for (SharePosition position : positions.values()) {
                if (position.getOwner().equals(owner)) {
                    owned.add(PositionView.of(position));
                }
            }
            return owned;
        });
    }

    public long getTokenBalance(String holder) {
        return inTransaction(() -> treasury.balanceOf(holder));
    }

    // Internals -----------------------------------------------------------------------------

    private <T> T inTransaction(Supplier<T> operation) {
        txLock.lock();
        try {
            return operation.get();
        } finally {
            txLock.unlock();
        }
    }

    private void requireTreasury(GridTreasury treasuryCap) {
        if (treasuryCap != treasury) {
            throw new ProtocolException(ErrorCode.INVALID_CAPABILITY, "Treasury capability does not belong to this protocol");
        }
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new ProtocolException(ErrorCode.MISSING_IDENTITY, "Caller identity is required");
        }
    }

    private Vault requireVault(String vaultId) {
        return require(vaults, vaultId, "vault");
    }

    private Orderbook requireBook(String bookId) {
        return require(books, bookId, "order book");
    }

    private StrategyConfig requireConfig(String configId) {
        return require(configs, configId, "strategy config");
    }

    private TokenMarket requireMarket(String marketId) {
        return require(markets, marketId, "token market");
    }

    private SharePosition requirePosition(String positionId) {
        return require(positions, positionId, "share position");
    }

    private SharePosition requireOwnedPosition(String caller, String positionId) {
        SharePosition position = requirePosition(positionId);
        if (!position.getOwner().equals(caller)) {
            throw new ProtocolException(ErrorCode.NOT_POSITION_OWNER,
                    "Position " + positionId + " is not owned by " + caller);
        }
        return position;
    }

    private static <T> T require(Map<String, T> arena, String id, String label) {
        T entity = id == null ? null : arena.get(id);
        if (entity == null) {
            throw new ProtocolException(ErrorCode.NOT_FOUND, "Unknown " + label + ": " + id);
        }
        return entity;
    }
}
