package shopping;

public enum DeleteResult {
    DELETED,
    NOT_FOUND,
    INVALID_NAME
}
