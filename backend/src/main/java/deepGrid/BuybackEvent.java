package deepGrid;

/**
 * Emitted when accrued fees are split and the buyback leg executed.
 */
public record BuybackEvent(
        String vaultId,
        String marketId,
        long totalFees,
        long lpPortion,
        long buybackPortion,
        long tokensBought,
        long tokensBurned,
        long tokensToRewards) implements ProtocolEvent {

    @Override
    public String type() {
        return "BUYBACK";
    }
}
