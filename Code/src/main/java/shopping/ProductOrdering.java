package shopping;

import java.util.Comparator;
import java.util.Locale;

/**
 * Orderings a shopping list can be sorted by. Both end on the creation sequence, so two
 * distinct products only compare equal when they are the same product.
 */
public enum ProductOrdering implements Comparator<Product> {
    /** lower-cased name, then priority, then creation order */
    BY_NAME("name") {
        @Override
        public int compare(final Product a, final Product b) {
            int c = a.key().compareTo(b.key());
            if (c != 0) return c;
            c = Integer.compare(a.priority(), b.priority());
            if (c != 0) return c;
            return Long.compare(a.createdAt(), b.createdAt());
        }
    },
    /** priority (1 first), then lower-cased name, then creation order */
    BY_PRIORITY("priority") {
        @Override
        public int compare(final Product a, final Product b) {
            int c = Integer.compare(a.priority(), b.priority());
            if (c != 0) return c;
            c = a.key().compareTo(b.key());
            if (c != 0) return c;
            return Long.compare(a.createdAt(), b.createdAt());
        }
    };

    private final String label;

    ProductOrdering(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts {@code name}, {@code priority} or the constant names, ignoring case.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ProductOrdering parse(final String raw) {
        if (raw != null) {
            final String s = raw.strip().toLowerCase(Locale.ROOT);
            for (ProductOrdering o : values()) {
                if (o.label.equals(s) || o.name().toLowerCase(Locale.ROOT).equals(s)) return o;
            }
        }
        throw new IllegalArgumentException("Unknown ordering: " + raw + " (expected name or priority)");
    }
}
