package io.github.drompincen.ledgersync.protocol.api;

import java.util.List;

public record DedupeReport(DedupeMode mode, int groups, int duplicates, List<String> errors) {

    public boolean succeeded() {
        return errors == null || errors.isEmpty();
    }
}
