package bst;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Unbalanced binary search tree ordered by a swappable {@link Comparator}.
 * Two elements the comparator reports as equal are duplicates: only the first one is kept.
 * Not thread-safe.
 */
public class BinarySearchTree<E> {
    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    static final class Node<E> {
        E value;        // overwritten by the successor's value on two-child delete
        Node<E> left;
        Node<E> right;

        Node(final E value) {
            this.value = value;
        }
    }

    private Node<E> root;
    private Comparator<? super E> comparator;

    public BinarySearchTree(final Comparator<? super E> comparator) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    /**
     * Builds a fresh tree bound to {@code comparator} holding every element of {@code elements},
     * inserted in iteration order. The only safe way to change the ordering of a populated tree.
     */
    public static <E> BinarySearchTree<E> rebuild(final Comparator<? super E> comparator, final Iterable<? extends E> elements) {
        Objects.requireNonNull(elements, "elements");
        BinarySearchTree<E> tree = new BinarySearchTree<>(comparator);
        for (E e : elements) {
            tree.insert(e);
        }
        return tree;
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - insert   : boolean
// - contains : boolean
// - delete   : void
//--------------------------------------------------------------------------------

    /** PRECONDITION: value CANNOT BE NULL **/
    public final boolean insert(final E value) {
        if (value == null) throw new NullPointerException();
        if (root == null) {
            root = new Node<>(value);
            return true;
        }
        Node<E> current = root;
        while (true) {
            final int cmp = comparator.compare(value, current.value);
            if (cmp == 0) {
                return false; // equivalent element already in the tree, no duplicate allowed
            } else if (cmp < 0) {
                if (current.left == null) {
                    current.left = new Node<>(value);
                    return true;
                }
                current = current.left;
            } else {
                if (current.right == null) {
                    current.right = new Node<>(value);
                    return true;
                }
                current = current.right;
            }
        }
    }

    /** PRECONDITION: value CANNOT BE NULL **/
    public final boolean contains(final E value) {
        if (value == null) throw new NullPointerException();
        Node<E> current = root;
        while (current != null) {
            final int cmp = comparator.compare(value, current.value);
            if (cmp == 0) return true;
            current = (cmp < 0) ? current.left : current.right;
        }
        return false;
    }

    // Removes the node equal to value under the active comparator; absent values are ignored.
    /** PRECONDITION: value CANNOT BE NULL **/
    public final void delete(final E value) {
        if (value == null) throw new NullPointerException();
        root = delete(root, value);
    }

    /**
     * Replaces the active comparator. The existing shape is left untouched and may violate the
     * new ordering: callers must {@link #rebuild} before relying on insert, contains or delete again.
     */
    public void setComparator(final Comparator<? super E> comparator) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    public Comparator<? super E> comparator() {
        return comparator;
    }

//--------------------------------------------------------------------------------
// TRAVERSALS
//--------------------------------------------------------------------------------

    public List<E> traverse(final Traversal traversal) {
        switch (Objects.requireNonNull(traversal, "traversal")) {
            case IN_ORDER:   return inOrder();
            case PRE_ORDER:  return preOrder();
            case POST_ORDER: return postOrder();
            default:         throw new IllegalArgumentException("Unknown traversal: " + traversal);
        }
    }

    public List<E> inOrder() {
        List<E> out = new ArrayList<>();
        inOrder(root, out);
        return out;
    }

    public List<E> preOrder() {
        List<E> out = new ArrayList<>();
        preOrder(root, out);
        return out;
    }

    public List<E> postOrder() {
        List<E> out = new ArrayList<>();
        postOrder(root, out);
        return out;
    }

//--------------------------------------------------------------------------------
// PRIVATE METHODS
// - delete (recursive)
// - minNode
// - walks
//--------------------------------------------------------------------------------

    private Node<E> delete(final Node<E> node, final E value) {
        if (node == null) return null;
        final int cmp = comparator.compare(value, node.value);
        if (cmp < 0) {
            node.left = delete(node.left, value);
            return node;
        }
        if (cmp > 0) {
            node.right = delete(node.right, value);
            return node;
        }
        if (node.left == null) return node.right;   // leaf or right child only
        if (node.right == null) return node.left;   // left child only

        // two children: pull up the in-order successor, then remove it from the right subtree
        final Node<E> successor = minNode(node.right);
        node.value = successor.value;
        node.right = delete(node.right, successor.value);
        return node;
    }

    private static <E> Node<E> minNode(Node<E> node) {
        while (node.left != null) node = node.left;
        return node;
    }

    private static <E> void inOrder(final Node<E> node, final List<E> out) {
        if (node == null) return;
        inOrder(node.left, out);
        out.add(node.value);
        inOrder(node.right, out);
    }

    private static <E> void preOrder(final Node<E> node, final List<E> out) {
        if (node == null) return;
        out.add(node.value);
        preOrder(node.left, out);
        preOrder(node.right, out);
    }

    private static <E> void postOrder(final Node<E> node, final List<E> out) {
        if (node == null) return;
        postOrder(node.left, out);
        postOrder(node.right, out);
        out.add(node.value);
    }

    /**
     *
     * DEBUG CODE
     *
     */

    public String toText() {
        return toText(String::valueOf);
    }

    /**
     * Pre-order dump, one {@code "- label"} line per node, indented two spaces per level.
     * Empty tree gives the empty string.
     */
    public String toText(final Function<? super E, String> label) {
        Objects.requireNonNull(label, "label");
        StringBuilder sb = new StringBuilder();
        toText(root, "", label, sb);
        return sb.toString();
    }

    private static <E> void toText(final Node<E> node, final String indent, final Function<? super E, String> label, final StringBuilder sb) {
        if (node == null) return;
        if (sb.length() > 0) sb.append('\n');
        sb.append(indent).append("- ").append(label.apply(node.value));
        toText(node.left, indent + "  ", label, sb);
        toText(node.right, indent + "  ", label, sb);
    }

    public int size() {
        return size(root);
    }

    private static int size(final Node<?> n) {
        if (n == null) return 0;
        return 1 + size(n.left) + size(n.right);
    }

    public boolean isEmpty() {
        return root == null;
    }

    // edges on the longest root-to-leaf path, -1 for the empty tree
    public int height() {
        return height(root);
    }

    private static int height(final Node<?> n) {
        if (n == null) return -1;
        return 1 + Math.max(height(n.left), height(n.right));
    }
}
