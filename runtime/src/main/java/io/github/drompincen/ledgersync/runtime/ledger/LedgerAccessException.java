package io.github.drompincen.ledgersync.runtime.ledger;

import io.github.drompincen.ledgersync.protocol.api.SyncErrorKind;

/** A ledger read or write failed; {@link #kind()} says how the caller should react. */
public class LedgerAccessException extends RuntimeException {

    private final SyncErrorKind kind;

    public LedgerAccessException(SyncErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public LedgerAccessException(SyncErrorKind kind, String message) {
        this(kind, message, null);
    }

    public SyncErrorKind kind() {
        return kind;
    }
}
