package shopping;

public enum SearchResult {
    FOUND,
    NOT_FOUND,
    INVALID_NAME
}
