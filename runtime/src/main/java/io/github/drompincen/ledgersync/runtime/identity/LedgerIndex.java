package io.github.drompincen.ledgersync.runtime.identity;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pass-scoped lookup tables over the loaded ledger tasks. Every map except the id table holds
 * survivors only: the device id, human ref and hint keys of a task marked as a duplicate point
 * at the task it duplicates.
 */
public class LedgerIndex {

    private static final Comparator<LedgerTaskDocument> OLDEST_FIRST = Comparator
            .comparing((LedgerTaskDocument t) -> t.getCreatedAt() != null ? t.getCreatedAt() : Instant.MAX)
            .thenComparing(t -> t.getId() != null ? t.getId() : "");

    private final Map<String, LedgerTaskDocument> byId = new LinkedHashMap<>();
    private final Map<String, LedgerTaskDocument> byDeviceId = new HashMap<>();
    private final Map<String, LedgerTaskDocument> byHumanRef = new HashMap<>();
    private final Map<String, LedgerTaskDocument> bySourceRef = new HashMap<>();
    private final Map<String, LedgerTaskDocument> byAltDeviceId = new HashMap<>();
    private final Map<String, LedgerTaskDocument> byExternalId = new HashMap<>();
    private final Map<String, LedgerTaskDocument> byTitle = new HashMap<>();
    private final Set<String> retiredDeviceIds = new HashSet<>();
    private final boolean complete;

    public LedgerIndex(Collection<LedgerTaskDocument> tasks) {
        this(tasks, true);
    }

    /**
     * @param complete whether {@code tasks} are all the owner's tasks; a delta load is not, so
     *                 misses may still exist in the ledger
     */
    public LedgerIndex(Collection<LedgerTaskDocument> tasks, boolean complete) {
        this.complete = complete;
        tasks.forEach(this::add);
        tasks.forEach(this::aliasToSurvivor);
    }

    public boolean complete() {
        return complete;
    }

    /**
     * Adds a task found during the pass. A second copy of an indexed id is ignored: the indexed
     * instance carries this pass's in-memory changes.
     */
    public void register(LedgerTaskDocument task) {
        if (add(task)) aliasToSurvivor(task);
    }

    private boolean add(LedgerTaskDocument task) {
        if (task.getId() != null) {
            LedgerTaskDocument known = byId.putIfAbsent(task.getId(), task);
            if (known != null && known != task) return false;
        }
        if (task.markedDuplicate()) return true;
        putIfAbsent(byDeviceId, task.getLinkedDeviceId(), task);
        putIfAbsent(byHumanRef, task.getHumanRef(), task);
        putIfAbsent(bySourceRef, task.getSourceRef(), task);
        putIfAbsent(byAltDeviceId, task.getDeviceAltId(), task);
        putIfAbsent(byExternalId, task.getExternalId(), task);
        if (task.effectiveStatus().isOpen()) {
            String title = TitleNormalizer.normalize(task.getTitle());
            if (!title.isEmpty()) {
                byTitle.merge(title, task, (a, b) -> OLDEST_FIRST.compare(a, b) <= 0 ? a : b);
            }
        }
        return true;
    }

    private void aliasToSurvivor(LedgerTaskDocument task) {
        if (!task.markedDuplicate()) return;
        LedgerTaskDocument survivor = survivorOf(task);
        if (survivor == null) return;
        putIfAbsent(byDeviceId, task.getLinkedDeviceId(), survivor);
        putIfAbsent(byHumanRef, task.getHumanRef(), survivor);
        putIfAbsent(bySourceRef, task.getSourceRef(), survivor);
        putIfAbsent(byAltDeviceId, task.getDeviceAltId(), survivor);
        putIfAbsent(byExternalId, task.getExternalId(), survivor);
        if (task.getLinkedDeviceId() != null && !task.getLinkedDeviceId().isBlank()) {
            retiredDeviceIds.add(key(task.getLinkedDeviceId()));
        }
    }

    /** Follows duplicate markers to the indexed task that survived; null when it is not indexed. */
    public LedgerTaskDocument survivorOf(LedgerTaskDocument task) {
        LedgerTaskDocument current = task;
        Set<String> seen = new HashSet<>();
        while (current != null && current.markedDuplicate()) {
            if (!seen.add(current.getDuplicateOf())) return null;
            current = byId.get(current.getDuplicateOf());
        }
        return current;
    }

    /** Whether a task marked as a duplicate was linked to this device item. */
    public boolean linkedToDuplicate(String deviceId) {
        return deviceId != null && !deviceId.isBlank() && retiredDeviceIds.contains(key(deviceId));
    }

    /** Points {@code deviceId} at {@code task}, dropping the task's previous device mapping. */
    public void linkDevice(LedgerTaskDocument task, String deviceId) {
        unlinkDevice(task);
        task.setLinkedDeviceId(deviceId);
        if (deviceId != null && !deviceId.isBlank()) byDeviceId.put(key(deviceId), task);
    }

    public void unlinkDevice(LedgerTaskDocument task) {
        String previous = task.getLinkedDeviceId();
        if (previous != null && byDeviceId.get(key(previous)) == task) byDeviceId.remove(key(previous));
    }

    /** Drops the task from the open-title table once it is no longer open. */
    public void forgetTitle(LedgerTaskDocument task) {
        String title = TitleNormalizer.normalize(task.getTitle());
        if (byTitle.get(title) == task) byTitle.remove(title);
    }

    public LedgerTaskDocument byId(String id) {
        return id == null ? null : byId.get(id);
    }

    public LedgerTaskDocument byDeviceId(String deviceId) {
        return lookup(byDeviceId, deviceId);
    }

    public LedgerTaskDocument byHumanRef(String humanRef) {
        return lookup(byHumanRef, humanRef);
    }

    public LedgerTaskDocument bySourceRef(String sourceRef) {
        return lookup(bySourceRef, sourceRef);
    }

    public LedgerTaskDocument byAltDeviceId(String altDeviceId) {
        return lookup(byAltDeviceId, altDeviceId);
    }

    public LedgerTaskDocument byExternalId(String externalId) {
        return lookup(byExternalId, externalId);
    }

    public LedgerTaskDocument byNormalizedTitle(String normalizedTitle) {
        return normalizedTitle == null || normalizedTitle.isEmpty() ? null : byTitle.get(normalizedTitle);
    }

    public boolean humanRefTaken(String humanRef) {
        return byHumanRef(humanRef) != null;
    }

    /** Loaded tasks not marked as duplicates, in load order. */
    public List<LedgerTaskDocument> survivors() {
        List<LedgerTaskDocument> out = new ArrayList<>();
        for (LedgerTaskDocument task : byId.values()) {
            if (!task.markedDuplicate()) out.add(task);
        }
        return out;
    }

    private static void putIfAbsent(Map<String, LedgerTaskDocument> map, String raw, LedgerTaskDocument task) {
        if (raw == null || raw.isBlank()) return;
        map.putIfAbsent(key(raw), task);
    }

    private static LedgerTaskDocument lookup(Map<String, LedgerTaskDocument> map, String raw) {
        if (raw == null || raw.isBlank()) return null;
        return map.get(key(raw));
    }

    static String key(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
