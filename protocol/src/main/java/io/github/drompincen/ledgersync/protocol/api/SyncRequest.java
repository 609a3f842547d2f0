package io.github.drompincen.ledgersync.protocol.api;

public record SyncRequest(SyncMode mode, Boolean dryRun, String reason) {

    public static SyncRequest full(String reason) {
        return new SyncRequest(SyncMode.FULL, null, reason);
    }

    public static SyncRequest delta(String reason) {
        return new SyncRequest(SyncMode.DELTA, null, reason);
    }
}
