package com.openrangelabs.donpetre.issuesync.fault;

import java.util.Objects;

/**
 * Where a fault was raised: the operation name and, for per-item faults, the item key
 */
public class ErrorContext {

    public static final String FETCH_PAGE = "fetch-page";
    public static final String APPLY_ITEM = "apply-item";
    public static final String IMPORT_SESSION = "import-session";

    private final String operation;
    private final String itemKey;
    private final String pageToken;

    private ErrorContext(String operation, String itemKey, String pageToken) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.itemKey = itemKey;
        this.pageToken = pageToken;
    }

    public static ErrorContext forPageFetch(String pageToken) {
        return new ErrorContext(FETCH_PAGE, null, pageToken);
    }

    public static ErrorContext forItem(String itemKey) {
        return new ErrorContext(APPLY_ITEM, itemKey, null);
    }

    public static ErrorContext forOperation(String operation) {
        return new ErrorContext(operation, null, null);
    }

    public String getOperation() { return operation; }
    public String getItemKey() { return itemKey; }
    public String getPageToken() { return pageToken; }

    public boolean isItemLevel() {
        return itemKey != null;
    }

    @Override
    public String toString() {
        return "ErrorContext{" +
                "operation='" + operation + '\'' +
                (itemKey != null ? ", itemKey='" + itemKey + '\'' : "") +
                (pageToken != null ? ", pageToken='" + pageToken + '\'' : "") +
                '}';
    }
}
