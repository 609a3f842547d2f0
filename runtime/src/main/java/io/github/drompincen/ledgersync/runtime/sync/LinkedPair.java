package io.github.drompincen.ledgersync.runtime.sync;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.runtime.context.TaskContext;
import io.github.drompincen.ledgersync.runtime.device.DeviceItem;
import io.github.drompincen.ledgersync.runtime.note.NoteMetadata;

import java.time.Instant;

/** A device item joined to its ledger task for the rest of a pass. */
class LinkedPair {

    DeviceItem item;
    final LedgerTaskDocument task;
    NoteMetadata note;
    /** Device-side modification time as read at the start of the pass, before any engine write. */
    final Instant deviceEffective;
    /** Created by this pass; nothing to reconcile yet. */
    final boolean fresh;
    TaskContext context;

    boolean deviceNewer;
    boolean deviceDirty;
    boolean ledgerChanged;
    boolean deviceChanged;

    LinkedPair(DeviceItem item, LedgerTaskDocument task, NoteMetadata note, Instant deviceEffective, boolean fresh) {
        this.item = item;
        this.task = task;
        this.note = note;
        this.deviceEffective = deviceEffective;
        this.fresh = fresh;
    }
}
