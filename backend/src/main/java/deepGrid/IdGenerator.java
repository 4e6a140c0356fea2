package deepGrid;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates monotonically increasing identifiers of the form {@code prefix-N}.
 */
public final class IdGenerator {
    private final String prefix;
    private final AtomicLong sequence;

    public IdGenerator(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.sequence = new AtomicLong(1L);
    }

    public String nextId() {
        long value = sequence.getAndIncrement();
        return prefix + "-" + value;
    }
}
