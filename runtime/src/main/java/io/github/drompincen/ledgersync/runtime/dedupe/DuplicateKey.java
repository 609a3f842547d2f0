package io.github.drompincen.ledgersync.runtime.dedupe;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;

import java.util.function.Function;

/** Identity fields that must be unique among non-duplicate tasks, in the order they are checked. */
public enum DuplicateKey {
    LINKED_DEVICE_ID("linkedDeviceId", LedgerTaskDocument::getLinkedDeviceId),
    HUMAN_REF("humanRef", LedgerTaskDocument::getHumanRef),
    SOURCE_REF("sourceRef", LedgerTaskDocument::getSourceRef),
    DEVICE_ALT_ID("deviceAltId", LedgerTaskDocument::getDeviceAltId),
    EXTERNAL_ID("externalId", LedgerTaskDocument::getExternalId);

    private final String field;
    private final Function<LedgerTaskDocument, String> accessor;

    DuplicateKey(String field, Function<LedgerTaskDocument, String> accessor) {
        this.field = field;
        this.accessor = accessor;
    }

    public String field() {
        return field;
    }

    public String valueOf(LedgerTaskDocument task) {
        return accessor.apply(task);
    }
}
