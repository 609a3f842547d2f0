package io.github.drompincen.ledgersync.protocol.api;

import java.util.Locale;

/**
 * Lifecycle state of a ledger task.
 *
 * <p>The ledger stores status either as an integer code or as a string. {@link #decode(Object)}
 * folds every known spelling into one of the three states; {@link #code()} is the canonical
 * value written back.
 */
public enum TaskStatus {
    OPEN(0),
    DONE(2),
    DELETED(-1);

    private final int code;

    TaskStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isDone() {
        return this == DONE;
    }

    public boolean isOpen() {
        return this == OPEN;
    }

    public static TaskStatus fromCode(int code) {
        if (code == 2) return DONE;
        if (code < 0) return DELETED;
        // 1 is "in progress" for some producers; still open from the device's point of view
        return OPEN;
    }

    /** Decodes a raw stored value. Unknown or missing values are {@link #OPEN}. */
    public static TaskStatus decode(Object raw) {
        if (raw == null) return OPEN;
        if (raw instanceof TaskStatus status) return status;
        if (raw instanceof Number number) return fromCode(number.intValue());
        if (raw instanceof Boolean done) return done ? DONE : OPEN;
        String text = raw.toString().trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "done":
            case "complete":
            case "completed":
            case "2":
                return DONE;
            case "deleted":
            case "-1":
                return DELETED;
            default:
                return OPEN;
        }
    }

    /** Value written into the device note's {@code status=} token. */
    public String noteValue() {
        return this == OPEN ? "open" : "complete";
    }
}
