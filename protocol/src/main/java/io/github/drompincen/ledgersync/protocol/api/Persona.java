package io.github.drompincen.ledgersync.protocol.api;

import java.util.Locale;

public enum Persona {
    PERSONAL, WORK, UNKNOWN;

    public static Persona parse(String raw) {
        if (raw == null) return UNKNOWN;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "work": return WORK;
            case "personal": return PERSONAL;
            default: return UNKNOWN;
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
