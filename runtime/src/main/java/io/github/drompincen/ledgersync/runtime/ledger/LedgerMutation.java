package io.github.drompincen.ledgersync.runtime.ledger;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Partial update of one ledger task: fields to set, fields to remove and fields stamped
 * with the server clock at commit time. Untouched fields are left as stored.
 */
public class LedgerMutation {

    private final String taskId;
    private final Map<String, Object> sets = new LinkedHashMap<>();
    private final Set<String> unsets = new LinkedHashSet<>();
    private final Set<String> serverTimestamps = new LinkedHashSet<>();

    public LedgerMutation(String taskId) {
        this.taskId = taskId;
    }

    public LedgerMutation set(String field, Object value) {
        if (value == null) return unset(field);
        unsets.remove(field);
        sets.put(field, value);
        return this;
    }

    public LedgerMutation unset(String field) {
        sets.remove(field);
        unsets.add(field);
        return this;
    }

    public LedgerMutation stampServerTime(String field) {
        serverTimestamps.add(field);
        return this;
    }

    /** Marks the task as modified now, on both the producer and the server clock fields. */
    public LedgerMutation touch() {
        return stampServerTime(LedgerFields.UPDATED_AT).stampServerTime(LedgerFields.SERVER_UPDATED_AT);
    }

    /** Folds another mutation of the same task into this one; later values win. */
    public void merge(LedgerMutation other) {
        other.sets.forEach(this::set);
        other.unsets.forEach(this::unset);
        serverTimestamps.addAll(other.serverTimestamps);
    }

    public boolean isEmpty() {
        return sets.isEmpty() && unsets.isEmpty() && serverTimestamps.isEmpty();
    }

    public String taskId() { return taskId; }
    public Map<String, Object> sets() { return sets; }
    public Set<String> unsets() { return unsets; }
    public Set<String> serverTimestamps() { return serverTimestamps; }

    @Override
    public String toString() {
        return "LedgerMutation{" + taskId + " set=" + sets.keySet() + " unset=" + unsets + "}";
    }
}
