package deepGrid;

import java.math.BigInteger;

/**
 * Emitted when GRID is minted into a vault's reward pool.
 */
public record RewardsAccruedEvent(
        String vaultId,
        long mintedAmount,
        BigInteger rewardPerShare) implements ProtocolEvent {

    @Override
    public String type() {
        return "REWARDS_ACCRUED";
    }
}
