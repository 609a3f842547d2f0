package io.github.drompincen.ledgersync.protocol.api;

import java.time.Instant;

public record SyncStatusResponse(
        String ownerId,
        boolean running,
        Instant lastSyncAt,
        Instant lastFullSyncAt,
        Instant watermark,
        String lastSummary
) {}
