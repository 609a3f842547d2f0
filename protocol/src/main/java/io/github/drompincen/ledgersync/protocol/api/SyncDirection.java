package io.github.drompincen.ledgersync.protocol.api;

public enum SyncDirection {
    TO_DEVICE("toDevice"),
    TO_LEDGER("toLedger"),
    DIAGNOSTICS("diagnostics");

    private final String wireName;

    SyncDirection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
