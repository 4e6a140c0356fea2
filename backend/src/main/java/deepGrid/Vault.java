package deepGrid;

import java.math.BigInteger;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Share-based ledger for one base/quote pool.
 *
 * <p>Tracks pooled balances, the portion of them committed to open orders, fees awaiting the
 * buyback and the reward-per-share accumulator. Fees sit in their own bucket outside the pooled
 * quote, so withdrawals and order locks never reach them. Every mutator checks its preconditions before
 * touching a field, so a rejected call leaves the vault exactly as it was.
 */
public final class Vault {
    private static final Logger LOG = LoggerFactory.getLogger(Vault.class);

    private final String vaultId;
    private long baseBalance;
    private long quoteBalance;
    private long totalShares;
    private long lockedBase;
    private long lockedQuote;
    private long accruedFeeQuote;
    private BigInteger rewardPerShare = BigInteger.ZERO;
    private long rewardPoolBalance;

    Vault(String vaultId) {
        this.vaultId = Objects.requireNonNull(vaultId, "vaultId");
    }

    /**
     * Adds liquidity and mints a new position. The first depositor gets one share per unit of value;
     * later depositors get shares in proportion to the value already pooled.
     */
    SharePosition deposit(String positionId, String owner, long baseAmount, long quoteAmount) {
        WideMath.requireNonNegative(baseAmount, "base amount");
        WideMath.requireNonNegative(quoteAmount, "quote amount");
        if (baseAmount == 0L && quoteAmount == 0L) {
            throw new ProtocolException(ErrorCode.ZERO_DEPOSIT, "Deposit must include base or quote");
        }

        long depositValue = WideMath.add(baseAmount, quoteAmount);
        long shares;
        if (totalShares == 0L) {
            shares = depositValue;
        } else {
            long poolValue = WideMath.add(baseBalance, quoteBalance);
            if (poolValue == 0L) {
                throw new ProtocolException(ErrorCode.ZERO_SHARES, "Vault " + vaultId + " has shares but no assets");
            }
            shares = WideMath.mulDiv(depositValue, totalShares, poolValue);
        }
        if (shares == 0L) {
            throw new ProtocolException(ErrorCode.ZERO_SHARES, "Deposit too small to mint a share");
        }

        long newBase = WideMath.add(baseBalance, baseAmount);
        long newQuote = WideMath.add(quoteBalance, quoteAmount);
        long newTotal = WideMath.add(totalShares, shares);
        long rewardDebt = WideMath.accumulatedReward(shares, rewardPerShare);

        baseBalance = newBase;
        quoteBalance = newQuote;
        totalShares = newTotal;
        LOG.debug("Vault {} minted {} shares for {} (base={}, quote={})", vaultId, shares, owner, baseAmount, quoteAmount);
        return new SharePosition(positionId, vaultId, owner, shares, rewardDebt);
    }

    /**
     * Burns the whole position and pays out its pro-rata slice of the unlocked pool.
     */
    Withdrawal withdraw(SharePosition position) {
        requireOwnPosition(position);
        long shares = position.getShares();
        long availableBase = getAvailableBase();
        long availableQuote = getAvailableQuote();
        long baseOut = WideMath.mulDiv(shares, availableBase, totalShares);
        long quoteOut = WideMath.mulDiv(shares, availableQuote, totalShares);
        if (baseOut > availableBase || quoteOut > availableQuote) {
            throw new ProtocolException(ErrorCode.INSUFFICIENT_BALANCE, "Withdrawal exceeds available balance");
        }

        baseBalance -= baseOut;
        quoteBalance -= quoteOut;
        totalShares -= shares;
        position.burn();
        return new Withdrawal(baseOut, quoteOut, shares);
    }

    void requireOwnPosition(SharePosition position) {
        Objects.requireNonNull(position, "position");
        if (!vaultId.equals(position.getVaultId())) {
            throw new ProtocolException(ErrorCode.VAULT_MISMATCH,
                    "Position " + position.getPositionId() + " belongs to " + position.getVaultId() + ", not " + vaultId);
        }
        if (position.isBurned()) {
            throw new ProtocolException(ErrorCode.NOT_FOUND, "Position " + position.getPositionId() + " was already withdrawn");
        }
    }

    // Order commitments ---------------------------------------------------------------------

    void lockBase(long amount) {
        WideMath.requireNonNegative(amount, "lock amount");
        if (amount > getAvailableBase()) {
            throw new ProtocolException(ErrorCode.INSUFFICIENT_BALANCE, "Cannot lock " + amount + " base");
        }
        lockedBase += amount;
    }

    void lockQuote(long amount) {
        WideMath.requireNonNegative(amount, "lock amount");
        if (amount > getAvailableQuote()) {
            throw new ProtocolException(ErrorCode.INSUFFICIENT_BALANCE, "Cannot lock " + amount + " quote");
        }
        lockedQuote += amount;
    }

    void unlockBase(long amount) {
        if (amount < 0L || amount > lockedBase) {
            throw new IllegalStateException("Unlocking " + amount + " base with only " + lockedBase + " locked");
        }
        lockedBase -= amount;
    }

    void unlockQuote(long amount) {
        if (amount < 0L || amount > lockedQuote) {
            throw new IllegalStateException("Unlocking " + amount + " quote with only " + lockedQuote + " locked");
        }
        lockedQuote -= amount;
    }

    // Fill proceeds and fees ----------------------------------------------------------------

    void creditBase(long amount) {
        WideMath.requireNonNegative(amount, "base credit");
        baseBalance = WideMath.add(baseBalance, amount);
    }

    void creditQuote(long amount) {
        WideMath.requireNonNegative(amount, "quote credit");
        quoteBalance = WideMath.add(quoteBalance, amount);
    }

    void addFeeQuote(long amount) {
        WideMath.requireNonNegative(amount, "fee amount");
        accruedFeeQuote = WideMath.add(accruedFeeQuote, amount);
    }

    void checkTakeFees(long amount) {
        WideMath.requireNonNegative(amount, "fee amount");
        if (amount > accruedFeeQuote) {
            throw new ProtocolException(ErrorCode.INSUFFICIENT_FEES,
                    "Requested " + amount + " fees, only " + accruedFeeQuote + " accrued");
        }
    }

    /**
     * Sweeps accrued fees out of the fee bucket and hands them to the caller.
     */
    long takeFees(long amount) {
        checkTakeFees(amount);
        accruedFeeQuote -= amount;
        return amount;
    }

    // Reward accumulator --------------------------------------------------------------------

    void setRewardPerShare(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.compareTo(rewardPerShare) < 0) {
            throw new IllegalStateException("reward per share cannot decrease: " + rewardPerShare + " -> " + value);
        }
        rewardPerShare = value;
    }

    void setShareRewardDebt(SharePosition position, long rewardDebt) {
        requireOwnPosition(position);
        position.setRewardDebt(rewardDebt);
    }

    void addRewardPool(long amount) {
        WideMath.requireNonNegative(amount, "reward amount");
        rewardPoolBalance = WideMath.add(rewardPoolBalance, amount);
    }

    void deductRewardPool(long amount) {
        if (amount < 0L || amount > rewardPoolBalance) {
            throw new ProtocolException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Reward pool holds " + rewardPoolBalance + ", cannot pay " + amount);
        }
        rewardPoolBalance -= amount;
    }

    // Views ---------------------------------------------------------------------------------

    public String getVaultId() {
        return vaultId;
    }

    public long getBaseBalance() {
        return baseBalance;
    }

    public long getQuoteBalance() {
        return quoteBalance;
    }

    public long getTotalShares() {
        return totalShares;
    }

    public long getLockedBase() {
        return lockedBase;
    }

    public long getLockedQuote() {
        return lockedQuote;
    }

    public long getAvailableBase() {
        return baseBalance - lockedBase;
    }

    public long getAvailableQuote() {
        return quoteBalance - lockedQuote;
    }

    public long getAccruedFeeQuote() {
        return accruedFeeQuote;
    }

    public BigInteger getRewardPerShare() {
        return rewardPerShare;
    }

    public long getRewardPoolBalance() {
        return rewardPoolBalance;
    }

    public VaultSnapshot snapshot() {
        return new VaultSnapshot(
                vaultId,
                baseBalance,
                quoteBalance,
                totalShares,
                lockedBase,
                lockedQuote,
                getAvailableBase(),
                getAvailableQuote(),
                accruedFeeQuote,
                rewardPerShare,
                rewardPoolBalance);
    }
}
