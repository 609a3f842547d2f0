package io.github.drompincen.ledgersync.runtime.triage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Fixed weighted keyword tables; matching is plain substring search on lower-cased text. */
public final class KeywordTriageScorer {

    public record Score(double work, double personal) {
        public double total() {
            return work + personal;
        }
    }

    private static final Map<String, Double> WORK = new LinkedHashMap<>();
    private static final Map<String, Double> PERSONAL = new LinkedHashMap<>();
    private static final Map<String, List<String>> CATEGORIES = new LinkedHashMap<>();

    static {
        WORK.put("jira", 1.4);
        WORK.put("ticket", 1.2);
        WORK.put("deploy", 1.3);
        WORK.put("production", 1.3);
        WORK.put("prod", 1.1);
        WORK.put("oncall", 1.3);
        WORK.put("pagerduty", 1.3);
        WORK.put("client", 1.2);
        WORK.put("customer", 1.1);
        WORK.put("meeting", 1.0);
        WORK.put("standup", 1.2);
        WORK.put("sprint", 1.2);
        WORK.put("story", 1.0);
        WORK.put("epic", 1.0);
        WORK.put("bug", 1.0);
        WORK.put("pr ", 1.2);
        WORK.put("pull request", 1.2);
        WORK.put("merge", 1.0);
        WORK.put("release", 1.0);
        WORK.put("okr", 1.1);
        WORK.put("quarter", 1.0);
        WORK.put("roadmap", 1.0);
        WORK.put("production issue", 1.5);
        WORK.put("work", 1.0);
        WORK.put("office", 1.0);
        WORK.put("shift", 1.0);
        WORK.put("invoice", 1.1);

        PERSONAL.put("wash", 1.2);
        PERSONAL.put("washing machine", 1.6);
        PERSONAL.put("laundry", 1.3);
        PERSONAL.put("grocer", 1.1);
        PERSONAL.put("shopping", 1.0);
        PERSONAL.put("gym", 1.1);
        PERSONAL.put("workout", 1.1);
        PERSONAL.put("dentist", 1.3);
        PERSONAL.put("doctor", 1.2);
        PERSONAL.put("appointment", 1.0);
        PERSONAL.put("kids", 1.2);
        PERSONAL.put("school", 1.0);
        PERSONAL.put("family", 1.0);
        PERSONAL.put("home", 1.0);
        PERSONAL.put("garden", 1.0);
        PERSONAL.put("rent", 1.0);
        PERSONAL.put("mortgage", 1.0);
        PERSONAL.put("car", 1.0);
        PERSONAL.put("oil change", 1.3);
        PERSONAL.put("pharmacy", 1.1);
        PERSONAL.put("vacation", 1.0);
        PERSONAL.put("travel", 1.0);
        PERSONAL.put("birthday", 1.0);
        PERSONAL.put("cook", 1.0);
        PERSONAL.put("meal", 1.0);

        CATEGORIES.put("Home", List.of("wash", "washing machine", "laundry"));
        CATEGORIES.put("Health", List.of("dentist", "doctor", "pharmacy", "health"));
        CATEGORIES.put("Fitness", List.of("gym", "workout", "run", "exercise"));
        CATEGORIES.put("Finance", List.of("rent", "mortgage", "invoice", "bill"));
        CATEGORIES.put("Car", List.of("car", "oil change", "tyre", "tire", "garage"));
        CATEGORIES.put("Travel", List.of("vacation", "trip", "flight", "travel"));
        CATEGORIES.put("Garden", List.of("garden", "yard", "lawn"));
        CATEGORIES.put("Shopping", List.of("grocer", "shopping"));
    }

    private KeywordTriageScorer() {}

    public static Score score(String text) {
        String haystack = text == null ? "" : text.toLowerCase(Locale.ROOT);
        return new Score(sum(WORK, haystack), sum(PERSONAL, haystack));
    }

    /** First category whose keywords appear in the text, or null. */
    public static String suggestCategory(String text) {
        if (text == null) return null;
        String haystack = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> category : CATEGORIES.entrySet()) {
            for (String keyword : category.getValue()) {
                if (haystack.contains(keyword)) return category.getKey();
            }
        }
        return null;
    }

    private static double sum(Map<String, Double> table, String haystack) {
        double total = 0;
        for (Map.Entry<String, Double> entry : table.entrySet()) {
            if (haystack.contains(entry.getKey())) total += entry.getValue();
        }
        return total;
    }
}
