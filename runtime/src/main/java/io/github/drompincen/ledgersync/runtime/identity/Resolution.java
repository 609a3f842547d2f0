package io.github.drompincen.ledgersync.runtime.identity;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;

/** Which ledger task a device item belongs to, and how that was decided. */
public record Resolution(LedgerTaskDocument task, MatchKind kind) {

    public enum MatchKind {
        DEVICE_ID, HUMAN_REF, LEDGER_ID, HINT, TITLE, NONE,
        /** A ledger lookup failed; the item must not be treated as new in this pass. */
        LOOKUP_FAILED
    }

    public static Resolution none() {
        return new Resolution(null, MatchKind.NONE);
    }

    public static Resolution lookupFailed() {
        return new Resolution(null, MatchKind.LOOKUP_FAILED);
    }

    public boolean resolved() {
        return task != null;
    }
}
