package io.github.drompincen.ledgersync.protocol.api;

import java.time.Instant;
import java.util.Map;

/** One per-record decision made during a pass; written to the sync log and the activity stream. */
public record SyncDecision(
        SyncDirection direction,
        SyncAction action,
        String taskId,
        String deviceItemId,
        Map<String, Object> metadata,
        boolean dryRun,
        Instant at
) {}
