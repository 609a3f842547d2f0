package io.github.drompincen.ledgersync.runtime.sync;

import io.github.drompincen.ledgersync.persistence.document.ThemeDocument;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Theme (category) name to device list name, both directions, case-insensitive. */
class ThemeListMapping {

    private final Map<String, String> listByTheme = new HashMap<>();
    private final Map<String, String> themeByList = new HashMap<>();

    ThemeListMapping(List<ThemeDocument> themes) {
        for (ThemeDocument theme : themes) {
            if (theme.getName() == null || theme.getName().isBlank()) continue;
            String list = theme.getDeviceListName() != null && !theme.getDeviceListName().isBlank()
                    ? theme.getDeviceListName() : theme.getName();
            listByTheme.putIfAbsent(key(theme.getName()), list);
            themeByList.putIfAbsent(key(list), theme.getName());
        }
    }

    static ThemeListMapping empty() {
        return new ThemeListMapping(List.of());
    }

    String listFor(String theme) {
        return theme == null ? null : listByTheme.get(key(theme));
    }

    String themeFor(String listName) {
        return listName == null ? null : themeByList.get(key(listName));
    }

    private static String key(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
