package io.github.drompincen.ledgersync.protocol.api;

public enum SyncMode {
    /** Only tasks whose server timestamp moved past the owner's watermark. */
    DELTA,
    /** Every task of the owner, paged. */
    FULL
}
