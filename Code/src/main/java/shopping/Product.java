package shopping;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An item on the shopping list. Immutable once created.
 *
 * <p>Priority ranks: 1 = high, 2 = medium, 3 = low. Anything that is not a positive integer
 * falls back to {@link #DEFAULT_PRIORITY} without complaint.
 */
public final class Product {
    public static final int DEFAULT_PRIORITY = 3;

    // Logical clock for tie-breaking, shared by every product in the process
    private static class Sequence {
        private static final AtomicLong counter = new AtomicLong(0);
        static long next() {
            return counter.getAndIncrement();
        }
    }

    private final String name;
    private final int priority;
    private final long createdAt;

    /** PRECONDITION: rawName CANNOT BE NULL **/
    public Product(final String rawName, final String rawPriority) {
        this(rawName, parsePriority(rawPriority));
    }

    /** PRECONDITION: rawName CANNOT BE NULL **/
    public Product(final String rawName, final int priority) {
        this.name = Objects.requireNonNull(rawName, "name").strip();
        this.priority = priority > 0 ? priority : DEFAULT_PRIORITY;
        this.createdAt = Sequence.next();
    }

    /**
     * Parses a priority rank, returning {@link #DEFAULT_PRIORITY} for {@code null}, blank,
     * non-integral or non-positive input.
     */
    public static int parsePriority(final String raw) {
        if (raw == null) return DEFAULT_PRIORITY;
        final String s = raw.strip();
        if (s.isEmpty()) return DEFAULT_PRIORITY;
        try {
            final int p = Integer.parseInt(s);
            return p > 0 ? p : DEFAULT_PRIORITY;
        } catch (NumberFormatException e) {
            return DEFAULT_PRIORITY;
        }
    }

    /** Normalized identity used by the registry: the lower-cased name. */
    public static String keyOf(final String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }

    public String name() {
        return name;
    }

    public int priority() {
        return priority;
    }

    public long createdAt() {
        return createdAt;
    }

    public String key() {
        return keyOf(name);
    }

    @Override
    public String toString() {
        return name + " (P" + priority + ")";
    }
}
