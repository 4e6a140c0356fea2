package deepGrid;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reward-per-share emission engine. Each accrual adds {@code emission * 1e12 / totalShares} to the
 * vault accumulator, so a position's pending reward is
 * {@code shares * rewardPerShare / 1e12 - rewardDebt} without visiting other depositors.
 */
public final class IncentiveAccumulator {
    private static final Logger LOG = LoggerFactory.getLogger(IncentiveAccumulator.class);

    private final ProtocolParameters parameters;

    public IncentiveAccumulator(ProtocolParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    /**
     * Mints one emission into the vault's reward pool. Does nothing while the vault has no shares.
     */
    Optional<RewardsAccruedEvent> accrue(Vault vault, GridTreasury treasury) {
        Objects.requireNonNull(vault, "vault");
        Objects.requireNonNull(treasury, "treasury");
        long totalShares = vault.getTotalShares();
        if (totalShares == 0L) {
            LOG.debug("Vault {} has no shares, skipping accrual", vault.getVaultId());
            return Optional.empty();
        }

        long emission = parameters.emissionPerAccrual();
        BigInteger newRewardPerShare = vault.getRewardPerShare().add(WideMath.rewardIncrease(emission, totalShares));
        WideMath.add(vault.getRewardPoolBalance(), emission);
        WideMath.add(treasury.getTotalSupply(), emission);

        treasury.mint(vault.getVaultId(), emission);
        vault.setRewardPerShare(newRewardPerShare);
        vault.addRewardPool(emission);

        LOG.info("Accrued {} GRID to vault {}: rewardPerShare={}", emission, vault.getVaultId(), newRewardPerShare);
        return Optional.of(new RewardsAccruedEvent(vault.getVaultId(), emission, newRewardPerShare));
    }

    /**
     * GRID the position could claim right now.
     */
    static long pending(Vault vault, SharePosition position) {
        vault.requireOwnPosition(position);
        long accumulated = WideMath.accumulatedReward(position.getShares(), vault.getRewardPerShare());
        // the debt was snapshotted from an accumulator that never decreases
        return accumulated - position.getRewardDebt();
    }

    /**
     * Pays out everything pending for the position from the vault's reward custody and resets its
     * debt to the current accumulator.
     */
    static RewardsClaimedEvent claim(Vault vault, SharePosition position, GridTreasury treasury) {
        Objects.requireNonNull(treasury, "treasury");
        long amount = pending(vault, position);
        if (amount <= 0L) {
            throw new ProtocolException(ErrorCode.NOTHING_TO_CLAIM, "Position " + position.getPositionId() + " has no pending rewards");
        }
        if (amount > vault.getRewardPoolBalance()) {
            throw new ProtocolException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Reward pool holds " + vault.getRewardPoolBalance() + ", cannot pay " + amount);
        }
        treasury.requireBalance(vault.getVaultId(), amount);

        long newDebt = WideMath.accumulatedReward(position.getShares(), vault.getRewardPerShare());
        vault.setShareRewardDebt(position, newDebt);
        vault.deductRewardPool(amount);
        treasury.transfer(vault.getVaultId(), position.getOwner(), amount);

        LOG.info("Claimed {} GRID from vault {} for {} ({})", amount, vault.getVaultId(), position.getOwner(), position.getPositionId());
        return new RewardsClaimedEvent(vault.getVaultId(), position.getOwner(), position.getPositionId(), amount);
    }
}
