package io.github.drompincen.ledgersync.runtime.dedupe;

import java.util.List;

public record DedupePlan(int groups, List<DuplicateAssignment> assignments) {

    public int duplicates() {
        return assignments.size();
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }
}
