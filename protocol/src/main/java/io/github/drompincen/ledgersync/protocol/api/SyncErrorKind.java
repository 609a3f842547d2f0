package io.github.drompincen.ledgersync.protocol.api;

public enum SyncErrorKind {
    NOT_AUTHENTICATED,
    PERMISSION_DENIED,
    TRANSIENT_IO,
    MISSING_INDEX,
    BATCH_COMMIT_FAILURE
}
