package io.github.drompincen.ledgersync.runtime.note;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded form of a device item's notes: the metadata key/value pairs and the
 * free-text lines the user wrote around the generated block.
 */
public record NoteMetadata(Map<String, String> meta, List<String> userLines) {

    public static NoteMetadata empty() {
        return new NoteMetadata(new LinkedHashMap<>(), new ArrayList<>());
    }

    public String get(String key) {
        String value = meta.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public boolean has(String key) {
        return get(key) != null;
    }

    public Map<String, String> copyMeta() {
        return new LinkedHashMap<>(meta);
    }
}
