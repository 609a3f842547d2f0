package io.github.drompincen.ledgersync.runtime.ledger;

/** Stored field names of {@code tasks} documents used in partial updates. */
public final class LedgerFields {

    public static final String TITLE = "title";
    public static final String STATUS = "status";
    public static final String DUE_AT = "dueAt";
    public static final String UPDATED_AT = "updatedAt";
    public static final String SERVER_UPDATED_AT = "serverUpdatedAt";
    public static final String COMPLETED_AT = "completedAt";
    public static final String DELETE_AFTER = "deleteAfter";
    public static final String LINKED_DEVICE_ID = "linkedDeviceId";
    public static final String DEVICE_LIST_ID = "deviceListId";
    public static final String DEVICE_LIST_NAME = "deviceListName";
    public static final String DEVICE_MISSING_AT = "deviceMissingAt";
    public static final String HUMAN_REF = "humanRef";
    public static final String CATEGORY = "category";
    public static final String TAGS = "tags";
    public static final String PRIORITY = "priority";
    public static final String RECURRENCE = "recurrence";
    public static final String DUPLICATE_OF = "duplicateOf";
    public static final String DUPLICATE_KEY = "duplicateKey";

    private LedgerFields() {}
}
