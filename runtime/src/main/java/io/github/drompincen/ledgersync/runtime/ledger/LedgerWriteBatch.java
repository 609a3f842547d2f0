package io.github.drompincen.ledgersync.runtime.ledger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects mutations during a pass, one per task, and commits them in chunks.
 * A failed chunk stops the flush; chunks already committed stay committed.
 */
public class LedgerWriteBatch {

    public static final int MAX_BATCH = 400;

    private final Map<String, LedgerMutation> pending = new LinkedHashMap<>();
    private final int chunkSize;

    public LedgerWriteBatch(int chunkSize) {
        this.chunkSize = chunkSize <= 0 ? MAX_BATCH : Math.min(chunkSize, MAX_BATCH);
    }

    public LedgerWriteBatch() {
        this(MAX_BATCH);
    }

    public void add(LedgerMutation mutation) {
        if (mutation == null || mutation.isEmpty()) return;
        LedgerMutation existing = pending.get(mutation.taskId());
        if (existing == null) {
            pending.put(mutation.taskId(), mutation);
        } else {
            existing.merge(mutation);
        }
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    public List<LedgerMutation> pending() {
        return new ArrayList<>(pending.values());
    }

    /** Commits every pending mutation; returns the number committed before any failure. */
    public int flush(LedgerGateway gateway) {
        List<LedgerMutation> all = pending();
        int committed = 0;
        try {
            for (int from = 0; from < all.size(); from += chunkSize) {
                List<LedgerMutation> chunk = all.subList(from, Math.min(from + chunkSize, all.size()));
                gateway.commit(chunk);
                committed += chunk.size();
            }
        } finally {
            for (int i = 0; i < committed; i++) pending.remove(all.get(i).taskId());
        }
        return committed;
    }
}
