package deepGrid;

import java.util.Objects;

/**
 * A depositor's claim on a vault, created by one deposit and redeemable only as a whole.
 */
public final class SharePosition {
    private final String positionId;
    private final String vaultId;
    private final String owner;
    private long shares;
    private long rewardDebt;

    SharePosition(String positionId, String vaultId, String owner, long shares, long rewardDebt) {
        this.positionId = Objects.requireNonNull(positionId, "positionId");
        this.vaultId = Objects.requireNonNull(vaultId, "vaultId");
        this.owner = Objects.requireNonNull(owner, "owner");
        if (shares <= 0L) {
            throw new IllegalArgumentException("shares must be positive");
        }
        this.shares = shares;
        this.rewardDebt = rewardDebt;
    }

    public String getPositionId() {
        return positionId;
    }

    public String getVaultId() {
        return vaultId;
    }

    public String getOwner() {
        return owner;
    }

    public long getShares() {
        return shares;
    }

    public long getRewardDebt() {
        return rewardDebt;
    }

    public boolean isBurned() {
        return shares == 0L;
    }

    void setRewardDebt(long rewardDebt) {
        this.rewardDebt = rewardDebt;
    }

    long burn() {
        long burned = shares;
        shares = 0L;
        rewardDebt = 0L;
        return burned;
    }
}
