package io.github.drompincen.ledgersync.runtime.sync;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.protocol.api.SyncMode;
import io.github.drompincen.ledgersync.protocol.api.SyncResult;
import io.github.drompincen.ledgersync.runtime.context.ContextResolver;
import io.github.drompincen.ledgersync.runtime.device.DeviceItem;
import io.github.drompincen.ledgersync.runtime.identity.LedgerIndex;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerWriteBatch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Working state of one reconciliation pass. Confined to the thread running the pass. */
class ReconciliationPass {

    final String ownerId;
    final SyncMode mode;
    final boolean dryRun;
    /** Pass clock; every client-side timestamp written by the pass uses it. */
    final Instant now;
    final LedgerWriteBatch batch;

    List<LedgerTaskDocument> loaded = new ArrayList<>();
    List<DeviceItem> items = new ArrayList<>();
    final Set<String> deviceIds = new HashSet<>();
    LedgerIndex index;
    ContextResolver context;
    ThemeListMapping themes = ThemeListMapping.empty();

    final List<LinkedPair> pairs = new ArrayList<>();
    final List<DeviceItem> unresolved = new ArrayList<>();

    Instant watermark;
    boolean committed;

    int created;
    int updated;
    int repaired;
    int duplicates;
    int removed;
    final List<String> errors = new ArrayList<>();
    final Map<String, Long> phaseMillis = new LinkedHashMap<>();

    ReconciliationPass(String ownerId, SyncMode mode, boolean dryRun, Instant now, int batchSize) {
        this.ownerId = ownerId;
        this.mode = mode;
        this.dryRun = dryRun;
        this.now = now;
        this.batch = new LedgerWriteBatch(batchSize);
    }

    void trackDevice(String deviceId) {
        if (deviceId != null) deviceIds.add(deviceId.toLowerCase(Locale.ROOT));
    }

    boolean deviceExists(String deviceId) {
        return deviceId != null && deviceIds.contains(deviceId.toLowerCase(Locale.ROOT));
    }

    SyncResult toResult(Instant finishedAt) {
        return new SyncResult(ownerId, mode, dryRun, false, created, updated, repaired, duplicates, removed,
                List.copyOf(errors), new LinkedHashMap<>(phaseMillis), now, finishedAt);
    }
}
