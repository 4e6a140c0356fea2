package deepGrid;

import java.math.BigInteger;

/**
 * Immutable view of a vault's ledger.
 */
public record VaultSnapshot(
        String vaultId,
        long baseBalance,
        long quoteBalance,
        long totalShares,
        long lockedBase,
        long lockedQuote,
        long availableBase,
        long availableQuote,
        long accruedFeeQuote,
        BigInteger rewardPerShare,
        long rewardPoolBalance) {
}
