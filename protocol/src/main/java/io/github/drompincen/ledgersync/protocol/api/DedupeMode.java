package io.github.drompincen.ledgersync.protocol.api;

public enum DedupeMode {
    /** Mark losers as duplicates and schedule them for TTL removal. */
    SOFT,
    /** Delete loser documents outright. */
    HARD
}
