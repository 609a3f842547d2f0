package io.github.drompincen.ledgersync.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of one reconciliation pass. A pass never throws; failures land in {@code errors}.
 *
 * @param rejected true when the pass did not run because another pass for the same owner was in flight
 * @param phaseMillis elapsed wall time per phase, in execution order
 */
public record SyncResult(
        String ownerId,
        SyncMode mode,
        boolean dryRun,
        boolean rejected,
        int created,
        int updated,
        int repaired,
        int duplicates,
        int removed,
        List<String> errors,
        Map<String, Long> phaseMillis,
        Instant startedAt,
        Instant finishedAt
) {
    public static SyncResult aborted(String ownerId, SyncMode mode, boolean dryRun, String error) {
        Instant now = Instant.now();
        return new SyncResult(ownerId, mode, dryRun, false, 0, 0, 0, 0, 0,
                List.of(error), Map.of(), now, now);
    }

    public static SyncResult rejected(String ownerId, SyncMode mode, boolean dryRun) {
        Instant now = Instant.now();
        return new SyncResult(ownerId, mode, dryRun, true, 0, 0, 0, 0, 0,
                List.of("Sync already running for owner " + ownerId), Map.of(), now, now);
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public String summaryLine() {
        return "created=" + created + " updated=" + updated + " repaired=" + repaired
                + " duplicates=" + duplicates + " removed=" + removed
                + " errors=" + (errors == null ? 0 : errors.size());
    }
}
