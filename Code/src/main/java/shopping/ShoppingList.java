package shopping;

import bst.BinarySearchTree;
import bst.Traversal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Application state of a shopping list: the registry of products, the tree view ordered by the
 * active {@link ProductOrdering}, and the ordering itself.
 *
 * <p>Every mutation updates registry and tree together; a rejected operation touches neither.
 * Single-threaded.
 */
public final class ShoppingList {
    private static final Logger log = LoggerFactory.getLogger(ShoppingList.class);

    private final ProductRegistry registry = new ProductRegistry();
    private ProductOrdering ordering;
    private BinarySearchTree<Product> tree;

    public ShoppingList() {
        this(ProductOrdering.BY_NAME);
    }

    public ShoppingList(final ProductOrdering ordering) {
        this.ordering = Objects.requireNonNull(ordering, "ordering");
        this.tree = new BinarySearchTree<>(ordering);
    }

    public AddResult addEntity(final String name, final int priority) {
        if (isBlank(name)) return AddResult.INVALID_NAME;
        return add(new Product(name, priority));
    }

    /** Adds a product; unparseable priority text falls back to {@link Product#DEFAULT_PRIORITY}. */
    public AddResult addEntity(final String name, final String priority) {
        if (isBlank(name)) return AddResult.INVALID_NAME;
        return add(new Product(name, priority));
    }

    private AddResult add(final Product product) {
        final String key = product.key();
        if (!registry.put(key, product)) {
            log.debug("Rejected add of {}: key '{}' already exists", product, key);
            return AddResult.ALREADY_EXISTS;
        }
        if (!tree.insert(product)) {
            // orderings end on the creation sequence, so a freshly registered product is never a tree duplicate
            registry.remove(key);
            return AddResult.ALREADY_EXISTS;
        }
        log.debug("Added {}", product);
        return AddResult.ADDED;
    }

    public SearchResult searchEntity(final String name) {
        if (isBlank(name)) return SearchResult.INVALID_NAME;
        return registry.has(Product.keyOf(name)) ? SearchResult.FOUND : SearchResult.NOT_FOUND;
    }

    public Optional<Product> find(final String name) {
        if (isBlank(name)) return Optional.empty();
        return registry.get(Product.keyOf(name));
    }

    public DeleteResult deleteEntity(final String name) {
        if (isBlank(name)) return DeleteResult.INVALID_NAME;
        final String key = Product.keyOf(name);
        final Optional<Product> product = registry.get(key);
        if (product.isEmpty()) {
            log.debug("Nothing to delete for '{}'", key);
            return DeleteResult.NOT_FOUND;
        }
        tree.delete(product.get());
        registry.remove(key);
        log.debug("Deleted {}", product.get());
        return DeleteResult.DELETED;
    }

    /** Switches to ordering and rebuilds the tree from the registry. */
    public void changeOrdering(final ProductOrdering ordering) {
        this.ordering = Objects.requireNonNull(ordering, "ordering");
        this.tree = BinarySearchTree.rebuild(ordering, registry.values());
        log.info("Rebuilt tree of {} products ordered by {}", registry.size(), ordering.label());
    }

    public List<Product> traverse(final Traversal traversal) {
        return tree.traverse(traversal);
    }

    public String dumpText() {
        return tree.toText();
    }

    public ProductOrdering ordering() {
        return ordering;
    }

    public int size() {
        return registry.size();
    }

    private static boolean isBlank(final String name) {
        return name == null || name.isBlank();
    }
}
