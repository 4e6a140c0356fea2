package deepGrid;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class DeepGridProtocolTest {

    private static final long ONE = WideMath.FLOAT_SCALING;

    private DeepGridProtocol protocol;
    private String vaultId;
    private String configId;
    private String bookId;
    private String marketId;

    @BeforeEach
    void setUp() {
        protocol = new DeepGridProtocol();
        vaultId = protocol.createVault().vaultId();
        configId = protocol.createStrategyConfig(50L, ONE, 2, "keeper").configId();
        bookId = protocol.createOrderBook(10 * ONE).bookId();
        marketId = protocol.createTokenMarket(protocol.getTreasury(), 1_000_000 * ONE, 100_000_000L).marketId();
    }

    @Test
    void fullFlywheelTurnsSpreadIntoRewards() {
        String positionId = protocol.deposit("alice", vaultId, 10 * ONE, 30 * ONE).positionId();

        Assertions.assertEquals(4, protocol.rebalance("keeper", vaultId, configId, bookId).ordersPlaced());
        Assertions.assertEquals(2, protocol.simulateTrade(bookId, true, 100_000_000L).asksFilled());

        SettlementEvent settlement = protocol.settle(vaultId, bookId);
        Assertions.assertEquals(20_100_000_000L, settlement.quoteEarned());

        BuybackEvent buyback = protocol.executeBuyback(vaultId, marketId, protocol.getTreasury());
        Assertions.assertEquals(12_060_000_000L, buyback.lpPortion());
        Assertions.assertEquals(8_040_000_000L, buyback.buybackPortion());
        Assertions.assertEquals(80_400_000_000L, buyback.tokensBought());
        Assertions.assertEquals(40_200_000_000L, buyback.tokensBurned());
        Assertions.assertEquals(40_200_000_000L, buyback.tokensToRewards());

        Assertions.assertTrue(protocol.accrueRewards(vaultId, protocol.getTreasury()).isPresent());
        Assertions.assertEquals(100 * ONE, protocol.pendingRewards(vaultId, positionId));

        RewardsClaimedEvent claimed = protocol.claimRewards("alice", vaultId, positionId, protocol.getTreasury());
        Assertions.assertEquals(100 * ONE, claimed.amount());
        Assertions.assertEquals(100 * ONE, protocol.getTokenBalance("alice"));

        VaultSnapshot vault = protocol.getVault(vaultId);
        Assertions.assertEquals(0L, vault.accruedFeeQuote());
        Assertions.assertEquals(40_200_000_000L, vault.rewardPoolBalance());
        Assertions.assertEquals(vault.rewardPoolBalance(), protocol.getTokenBalance(vaultId));

        // ask fills leave their base lock in place until the next rebalance
        WithdrawEvent withdrawal = protocol.withdraw("alice", vaultId, positionId);
        Assertions.assertEquals(8 * ONE, withdrawal.baseAmount());
        Assertions.assertEquals(42_060_000_000L, withdrawal.quoteAmount());
        Assertions.assertEquals(0L, withdrawal.totalShares());
    }

    @Test
    void exitingLiquidityProviderCannotTakeAccruedFees() {
        String positionId = protocol.deposit("alice", vaultId, 10 * ONE, 30 * ONE).positionId();
        protocol.rebalance("keeper", vaultId, configId, bookId);
        protocol.simulateTrade(bookId, true, 100_000_000L);
        protocol.settle(vaultId, bookId);

        WithdrawEvent withdrawal = protocol.withdraw("alice", vaultId, positionId);

        Assertions.assertEquals(30 * ONE, withdrawal.quoteAmount());
        Assertions.assertEquals(20_100_000_000L, protocol.getVault(vaultId).accruedFeeQuote());

        BuybackEvent buyback = protocol.executeBuyback(vaultId, marketId, protocol.getTreasury());

        Assertions.assertEquals(20_100_000_000L, buyback.totalFees());
        VaultSnapshot vault = protocol.getVault(vaultId);
        Assertions.assertEquals(0L, vault.accruedFeeQuote());
        Assertions.assertEquals(12_060_000_000L, vault.quoteBalance());
        Assertions.assertEquals(vault.rewardPoolBalance(), protocol.getTokenBalance(vaultId));
    }

    @Test
    void eventsAreSequencedInOperationOrder() {
        List<LoggedEvent> seen = new ArrayList<>();
        protocol.getEvents().onEvent(seen::add);

        protocol.deposit("alice", vaultId, 5 * ONE, 5 * ONE);
        protocol.rebalance("keeper", vaultId, configId, bookId);

        List<LoggedEvent> history = protocol.getEvents().history();
        Assertions.assertEquals(6, history.size());
        Assertions.assertEquals("VAULT_CREATED", history.get(0).type());
        Assertions.assertEquals("DEPOSIT", history.get(4).type());
        Assertions.assertEquals("REBALANCE", history.get(5).type());
        for (int i = 0; i < history.size(); i++) {
            Assertions.assertEquals(i + 1L, history.get(i).sequence());
        }
        Assertions.assertEquals(2, seen.size());
        Assertions.assertEquals(history.subList(4, 6), seen);
        Assertions.assertEquals(2, protocol.getEvents().since(4L).size());
    }

    @Test
    void failingListenerDoesNotAbortOperation() {
        protocol.getEvents().onEvent(event -> {
            throw new IllegalStateException("listener down");
        });

        DepositEvent deposit = protocol.deposit("alice", vaultId, ONE, ONE);

        Assertions.assertEquals(2 * ONE, protocol.getVault(vaultId).totalShares());
        Assertions.assertEquals(deposit.positionId(), protocol.getPosition(deposit.positionId()).positionId());
    }

    @Test
    void rejectedOperationLeavesStateAndHistoryUntouched() {
        String positionId = protocol.deposit("alice", vaultId, 5 * ONE, 5 * ONE).positionId();
        protocol.accrueRewards(vaultId, protocol.getTreasury());
        int eventsBefore = protocol.getEvents().size();
        VaultSnapshot vaultBefore = protocol.getVault(vaultId);

        ProtocolException ex = Assertions.assertThrows(ProtocolException.class,
                () -> protocol.claimRewards("alice", vaultId, positionId, new GridTreasury()));

        Assertions.assertEquals(ErrorCode.INVALID_CAPABILITY, ex.getCode());
        Assertions.assertEquals(eventsBefore, protocol.getEvents().size());
        Assertions.assertEquals(vaultBefore, protocol.getVault(vaultId));
        Assertions.assertEquals(0L, protocol.getTokenBalance("alice"));
    }

    @Test
    void onlyOwnerMayWithdrawOrClaim() {
        String positionId = protocol.deposit("alice", vaultId, 5 * ONE, 5 * ONE).positionId();
        protocol.accrueRewards(vaultId, protocol.getTreasury());

        ProtocolException withdraw = Assertions.assertThrows(ProtocolException.class,
                () -> protocol.withdraw("bob", vaultId, positionId));
        ProtocolException claim = Assertions.assertThrows(ProtocolException.class,
                () -> protocol.claimRewards("bob", vaultId, positionId, protocol.getTreasury()));

        Assertions.assertEquals(ErrorCode.NOT_POSITION_OWNER, withdraw.getCode());
        Assertions.assertEquals(ErrorCode.NOT_POSITION_OWNER, claim.getCode());
        Assertions.assertEquals(10 * ONE, protocol.getVault(vaultId).totalShares());
    }

    @Test
    void withdrawnPositionIsGone() {
        String positionId = protocol.deposit("alice", vaultId, 5 * ONE, 5 * ONE).positionId();

        WithdrawEvent event = protocol.withdraw("alice", vaultId, positionId);

        Assertions.assertEquals(5 * ONE, event.baseAmount());
        Assertions.assertEquals(5 * ONE, event.quoteAmount());
        Assertions.assertEquals(0L, event.totalShares());
        Assertions.assertTrue(protocol.getPositionsOf("alice").isEmpty());
        ProtocolException ex = Assertions.assertThrows(ProtocolException.class, () -> protocol.getPosition(positionId));
        Assertions.assertEquals(ErrorCode.NOT_FOUND, ex.getCode());
    }

    @Test
    void positionsAreListedPerOwner() {
        protocol.deposit("alice", vaultId, ONE, ONE);
        protocol.deposit("alice", vaultId, ONE, 0L);
        protocol.deposit("bob", vaultId, 0L, ONE);

        Assertions.assertEquals(2, protocol.getPositionsOf("alice").size());
        Assertions.assertEquals(1, protocol.getPositionsOf("bob").size());
    }

    @Test
    void anonymousDepositIsRejected() {
        ProtocolException ex = Assertions.assertThrows(ProtocolException.class,
                () -> protocol.deposit(" ", vaultId, ONE, ONE));

        Assertions.assertEquals(ErrorCode.MISSING_IDENTITY, ex.getCode());
    }

    @Test
    void unknownEntitiesAreReportedAsNotFound() {
        Assertions.assertEquals(ErrorCode.NOT_FOUND, Assertions.assertThrows(ProtocolException.class,
                () -> protocol.deposit("alice", "vault-99", ONE, ONE)).getCode());
        Assertions.assertEquals(ErrorCode.NOT_FOUND, Assertions.assertThrows(ProtocolException.class,
                () -> protocol.settle(vaultId, "book-99")).getCode());
        Assertions.assertEquals(ErrorCode.NOT_FOUND, Assertions.assertThrows(ProtocolException.class,
                () -> protocol.executeBuyback(vaultId, "market-99", protocol.getTreasury())).getCode());
    }

    @Test
    void marketCreationRequiresProtocolTreasury() {
        ProtocolException ex = Assertions.assertThrows(ProtocolException.class,
                () -> protocol.createTokenMarket(new GridTreasury(), ONE, ONE));

        Assertions.assertEquals(ErrorCode.INVALID_CAPABILITY, ex.getCode());
    }

    @Test
    void accrualOnEmptyVaultEmitsNothing() {
        int before = protocol.getEvents().size();

        Assertions.assertTrue(protocol.accrueRewards(vaultId, protocol.getTreasury()).isEmpty());
        Assertions.assertEquals(before, protocol.getEvents().size());
    }
}
