package io.github.drompincen.ledgersync.runtime.sync;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.protocol.api.TaskStatus;

import java.util.Locale;

/** Ways a producer can mark a task as gone; each maps to the tag put on the device item. */
final class DeletionSignals {

    static final String DELETED_TAG = "deleted";
    static final String CONVERTED_TAG = "convertedtostory";

    private DeletionSignals() {}

    /** The device tag for a removed task, or null while the task is live. */
    static String tagFor(LedgerTaskDocument task) {
        if (task.getConvertedToStoryId() != null && !task.getConvertedToStoryId().isBlank()) return CONVERTED_TAG;
        if (task.effectiveStatus() == TaskStatus.DELETED) return DELETED_TAG;
        if (Boolean.TRUE.equals(task.getDeleted())) return DELETED_TAG;
        String directive = task.getSyncDirective();
        if (directive != null) {
            String d = directive.trim().toLowerCase(Locale.ROOT);
            if (d.equals("complete") || d.equals("delete")) return DELETED_TAG;
        }
        return null;
    }
}
