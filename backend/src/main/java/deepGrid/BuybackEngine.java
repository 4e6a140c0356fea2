package deepGrid;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns accrued spread fees into GRID: the LP share stays in the vault, the rest buys GRID at the
 * fixed-price market, and the purchase is split between burning and the vault's reward pool.
 */
public final class BuybackEngine {
    private static final Logger LOG = LoggerFactory.getLogger(BuybackEngine.class);

    private final ProtocolParameters parameters;

    public BuybackEngine(ProtocolParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    /**
     * Seeds a market by minting its whole token reserve.
     */
    static TokenMarket createMarket(String marketId, GridTreasury treasury, long initialTokenReserve, long price) {
        Objects.requireNonNull(treasury, "treasury");
        TokenMarket market = new TokenMarket(marketId, initialTokenReserve, price);
        WideMath.add(treasury.getTotalSupply(), initialTokenReserve);
        treasury.mint(marketId, initialTokenReserve);
        LOG.info("Created token market {}: reserve={}, price={}", marketId, initialTokenReserve, price);
        return market;
    }

    BuybackEvent executeBuyback(Vault vault, TokenMarket market, GridTreasury treasury) {
        Objects.requireNonNull(vault, "vault");
        Objects.requireNonNull(market, "market");
        Objects.requireNonNull(treasury, "treasury");
        long totalFees = vault.getAccruedFeeQuote();
        if (totalFees == 0L) {
            throw new ProtocolException(ErrorCode.NO_FEES, "Vault " + vault.getVaultId() + " has no accrued fees");
        }

        long lpPortion = WideMath.bps(totalFees, parameters.lpShareBps());
        long buybackPortion = totalFees - lpPortion;
        vault.checkTakeFees(totalFees);
        long tokensBought = market.quote(buybackPortion);
        long tokensBurned = WideMath.bps(tokensBought, parameters.burnShareBps());
        long tokensToRewards = tokensBought - tokensBurned;
        WideMath.add(vault.getQuoteBalance(), lpPortion);
        WideMath.add(vault.getRewardPoolBalance(), tokensToRewards);
        WideMath.add(treasury.balanceOf(vault.getVaultId()), tokensBought);

        long collected = vault.takeFees(totalFees);
        vault.creditQuote(lpPortion);
        long spent = collected - lpPortion;
        long received = market.buy(spent);
        treasury.transfer(market.getMarketId(), vault.getVaultId(), received);
        treasury.burn(vault.getVaultId(), tokensBurned);
        vault.addRewardPool(tokensToRewards);

        LOG.info("Buyback for vault {} via {}: fees={}, lp={}, spent={}, bought={}, burned={}, rewards={}",
                vault.getVaultId(), market.getMarketId(), totalFees, lpPortion, spent, received, tokensBurned, tokensToRewards);
        return new BuybackEvent(vault.getVaultId(), market.getMarketId(), totalFees, lpPortion, buybackPortion,
                tokensBought, tokensBurned, tokensToRewards);
    }
}
