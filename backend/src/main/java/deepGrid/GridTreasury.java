package deepGrid;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mint and burn authority for the GRID incentive token. Holding a reference to the treasury is
 * the capability required by every operation that creates or destroys GRID.
 */
public final class GridTreasury {
    private static final Logger LOG = LoggerFactory.getLogger(GridTreasury.class);

    private final Map<String, Long> balances = new HashMap<>();
    private long totalSupply;
    private long totalMinted;
    private long totalBurned;

    void mint(String holder, long amount) {
        Objects.requireNonNull(holder, "holder");
        WideMath.requireNonNegative(amount, "mint amount");
        if (amount == 0L) {
            return;
        }
        long newSupply = WideMath.add(totalSupply, amount);
        long newMinted = WideMath.add(totalMinted, amount);
        long newBalance = WideMath.add(balanceOf(holder), amount);
        totalSupply = newSupply;
        totalMinted = newMinted;
        balances.put(holder, newBalance);
        LOG.debug("Minted {} GRID to {}", amount, holder);
    }

    void burn(String holder, long amount) {
        Objects.requireNonNull(holder, "holder");
        WideMath.requireNonNegative(amount, "burn amount");
        if (amount == 0L) {
            return;
        }
        requireBalance(holder, amount);
        adjust(holder, -amount);
        totalSupply -= amount;
        totalBurned += amount;
        LOG.debug("Burned {} GRID from {}", amount, holder);
    }

    void transfer(String from, String to, long amount) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        WideMath.requireNonNegative(amount, "transfer amount");
        if (amount == 0L || from.equals(to)) {
            return;
        }
        requireBalance(from, amount);
        long credited = WideMath.add(balanceOf(to), amount);
        adjust(from, -amount);
        balances.put(to, credited);
    }

    void requireBalance(String holder, long amount) {
        long available = balanceOf(holder);
        if (available < amount) {
            throw new ProtocolException(ErrorCode.INSUFFICIENT_BALANCE,
                    "GRID balance of " + holder + " is " + available + ", needs " + amount);
        }
    }

    private void adjust(String holder, long delta) {
        balances.merge(holder, delta, (existing, change) -> {
            long updated = existing + change;
            return updated == 0L ? null : updated;
        });
    }

    public long balanceOf(String holder) {
        if (holder == null) {
            return 0L;
        }
        return balances.getOrDefault(holder, 0L);
    }

    public long getTotalSupply() {
        return totalSupply;
    }

    public long getTotalMinted() {
        return totalMinted;
    }

    public long getTotalBurned() {
        return totalBurned;
    }
}
