package io.github.drompincen.ledgersync.runtime.sync;

import java.util.List;
import java.util.Locale;

/** Infers whether an item is a household chore or routine from its list name and tags. */
final class ItemTypes {

    static final String CHORE = "chore";
    static final String ROUTINE = "routine";

    private ItemTypes() {}

    static String infer(String listName, List<String> tags) {
        String list = listName == null ? "" : listName.toLowerCase(Locale.ROOT);
        if (list.contains(CHORE)) return CHORE;
        if (list.contains(ROUTINE)) return ROUTINE;
        if (tags != null) {
            for (String tag : tags) {
                String t = tag.toLowerCase(Locale.ROOT);
                if (t.contains(CHORE)) return CHORE;
                if (t.contains(ROUTINE)) return ROUTINE;
            }
        }
        return null;
    }

    /** Recurring device items only become ledger tasks when they are chores or routines. */
    static boolean importableRecurring(String itemType) {
        return CHORE.equals(itemType) || ROUTINE.equals(itemType);
    }
}
