package shopping;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exact-key index of the products on the list, keyed by {@link Product#keyOf(String) normalized name}.
 * Source of truth for which products exist; the tree is rebuilt from {@link #values()}.
 */
public final class ProductRegistry {
    private final Map<String, Product> products = new HashMap<>();

    /** Registers product under key unless the key is taken. Returns false when it already exists. */
    public boolean put(final String key, final Product product) {
        return products.putIfAbsent(key, product) == null;
    }

    /** Returns the removed product, or null if nothing was registered under key. */
    public Product remove(final String key) {
        return products.remove(key);
    }

    public boolean has(final String key) {
        return products.containsKey(key);
    }

    public Optional<Product> get(final String key) {
        return Optional.ofNullable(products.get(key));
    }

    public Collection<Product> values() {
        return Collections.unmodifiableCollection(products.values());
    }

    public int size() {
        return products.size();
    }
}
