package io.github.drompincen.ledgersync.runtime.dedupe;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;

/** {@code loser} shares {@code value} of {@code key} with {@code survivor}. */
public record DuplicateAssignment(LedgerTaskDocument loser, LedgerTaskDocument survivor, DuplicateKey key, String value) {}
