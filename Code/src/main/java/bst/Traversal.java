package bst;

/**
 * Depth-first visiting orders supported by {@link BinarySearchTree#traverse(Traversal)}.
 */
public enum Traversal {
    /** left, node, right: ascending under the active comparator */
    IN_ORDER,
    /** node, left, right: root first */
    PRE_ORDER,
    /** left, right, node: children before parent */
    POST_ORDER
}
