package shopping;

/** Outcome of {@link ShoppingList#addEntity(String, String)}. */
public enum AddResult {
    ADDED,
    ALREADY_EXISTS,
    INVALID_NAME
}
