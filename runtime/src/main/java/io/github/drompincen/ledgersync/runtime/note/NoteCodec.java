package io.github.drompincen.ledgersync.runtime.note;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the metadata block trailing a device item's notes.
 *
 * <pre>
 * user text
 *
 * -------
 * BOB: taskRef=TK-7QX2MA status=open due=2024-05-01T09:00:00Z synced=... list=Home
 * #sprint: Sprint 12
 * #task: TK-7QX2MA
 * #tags: chores, home
 * #list: Home
 * #listId: x-apple-reminder-list-7
 * https://ledger.example.app/task/TK-7QX2MA
 * </pre>
 *
 * Neither direction ever fails; malformed input degrades to plain user text.
 */
public class NoteCodec {

    public static final String SEPARATOR = "-------";
    public static final String HEADER_PREFIX = "BOB:";

    public static final String TASK_REF = "taskRef";
    public static final String STORY_REF = "storyRef";
    public static final String GOAL_REF = "goalRef";
    public static final String TASK_ID = "taskId";
    public static final String STATUS = "status";
    public static final String DUE = "due";
    public static final String SYNCED = "synced";
    public static final String LIST = "list";
    public static final String LIST_ID = "listId";
    public static final String SPRINT = "sprint";
    public static final String THEME = "theme";
    public static final String TAGS = "tags";

    static final List<String> HEADER_KEYS = List.of(TASK_REF, STORY_REF, GOAL_REF, STATUS, DUE, SYNCED, LIST);

    /** Extension line label to metadata key, in emission order. */
    private static final Map<String, String> EXTENSION_KEYS = new LinkedHashMap<>();
    static {
        EXTENSION_KEYS.put("sprint", SPRINT);
        EXTENSION_KEYS.put("theme", THEME);
        EXTENSION_KEYS.put("story", STORY_REF);
        EXTENSION_KEYS.put("task", TASK_REF);
        EXTENSION_KEYS.put("goal", GOAL_REF);
        EXTENSION_KEYS.put("tags", TAGS);
        EXTENSION_KEYS.put("list", LIST);
        EXTENSION_KEYS.put("listId", LIST_ID);
    }

    // values that may hold spaces or are device-local live in extension lines only
    private static final Set<String> NOT_IN_HEADER = Set.of(LIST_ID, SPRINT, THEME, TAGS);

    private static final Map<String, String> LINK_KEYS = Map.of(
            "task", TASK_REF, "story", STORY_REF, "goal", GOAL_REF, "sprint", SPRINT);

    private static final Pattern DEEP_LINK =
            Pattern.compile("^https?://\\S+?/(task|story|goal|sprint)/([^/\\s?#]+)/?$");
    private static final Pattern LEGACY_TOKEN =
            Pattern.compile("^(taskRef|storyRef|goalRef|taskId)\\s*:\\s*(\\S+)$");
    private static final Pattern EXTENSION_LINE = Pattern.compile("^#(\\w+):\\s*(.*)$");
    private static final Pattern PRIORITY_TAG = Pattern.compile("#P[1-5]");

    private final String deepLinkBase;

    public NoteCodec(String deepLinkBase) {
        String base = deepLinkBase == null ? "" : deepLinkBase.trim();
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        this.deepLinkBase = base;
    }

    public NoteMetadata decode(String notes) {
        if (notes == null || notes.isEmpty()) return NoteMetadata.empty();

        List<String> lines = Arrays.asList(notes.split("\\r?\\n", -1));
        Map<String, String> meta = new LinkedHashMap<>();

        int headerIdx = -1;
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).strip().startsWith(HEADER_PREFIX)) {
                headerIdx = i;
                break;
            }
        }
        if (headerIdx < 0) {
            List<String> userLines = new ArrayList<>(lines);
            absorbLegacyLinks(userLines, meta);
            return new NoteMetadata(meta, userLines);
        }

        int blockStart = headerIdx;
        if (headerIdx > 0 && lines.get(headerIdx - 1).strip().equals(SEPARATOR)) {
            blockStart--;
            if (blockStart > 0 && lines.get(blockStart - 1).isBlank()) blockStart--;
        }

        parseHeader(lines.get(headerIdx).strip().substring(HEADER_PREFIX.length()), meta);

        int end = headerIdx + 1;
        while (end < lines.size()) {
            String line = lines.get(end).strip();
            if (line.isEmpty()) {
                end++;
                continue;
            }
            if (!line.startsWith("#")) break;
            Matcher m = EXTENSION_LINE.matcher(line);
            if (m.matches()) {
                String label = m.group(1);
                String value = m.group(2).trim();
                String key = EXTENSION_KEYS.get(label);
                if (key != null && !value.isEmpty()) meta.put(key, value);
            }
            end++;
        }

        List<String> userLines = new ArrayList<>(lines.subList(0, blockStart));
        userLines.addAll(lines.subList(end, lines.size()));
        absorbLegacyLinks(userLines, meta);
        return new NoteMetadata(meta, userLines);
    }

    public String encode(Map<String, String> meta, List<String> userLines, boolean includeBlock) {
        List<String> out = new ArrayList<>(userLines == null ? List.of() : userLines);
        if (includeBlock) {
            if (!out.isEmpty()) out.add("");
            out.add(SEPARATOR);
            out.add(header(meta));
            for (Map.Entry<String, String> ext : EXTENSION_KEYS.entrySet()) {
                String value = value(meta, ext.getValue());
                if (value != null) out.add("#" + ext.getKey() + ": " + value);
            }
        }
        addLink(out, "task", value(meta, TASK_REF));
        addLink(out, "story", value(meta, STORY_REF));
        addLink(out, "goal", value(meta, GOAL_REF));
        addLink(out, "sprint", value(meta, SPRINT));
        return String.join("\n", out);
    }

    public String deepLink(String kind, String ref) {
        return deepLinkBase + "/" + kind + "/"
                + URLEncoder.encode(ref, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static List<String> splitTags(String raw) {
        List<String> tags = new ArrayList<>();
        if (raw == null) return tags;
        for (String part : raw.split(",")) {
            String tag = part.trim();
            if (!tag.isEmpty()) tags.add(tag);
        }
        return tags;
    }

    public static Map<String, String> withTags(Map<String, String> meta, List<String> tags) {
        Map<String, String> copy = new LinkedHashMap<>(meta);
        if (tags == null || tags.isEmpty()) {
            copy.remove(TAGS);
        } else {
            copy.put(TAGS, String.join(", ", tags));
        }
        return copy;
    }

    /**
     * Writes {@code #P<priority>} into the user lines. The first line holding a {@code #P1}..{@code #P5}
     * token gets that token replaced; otherwise the tag is appended as its own line.
     */
    public static List<String> withPriorityTag(List<String> userLines, Integer priority) {
        List<String> copy = new ArrayList<>(userLines);
        if (priority == null || priority < 1 || priority > 5) return copy;
        String tag = "#P" + priority;
        for (int i = 0; i < copy.size(); i++) {
            Matcher m = PRIORITY_TAG.matcher(copy.get(i));
            if (m.find()) {
                String line = copy.get(i);
                copy.set(i, line.substring(0, m.start()) + tag + line.substring(m.end()));
                return copy;
            }
        }
        copy.add(tag);
        return copy;
    }

    private String header(Map<String, String> meta) {
        StringBuilder header = new StringBuilder(HEADER_PREFIX);
        for (String key : HEADER_KEYS) {
            String value = value(meta, key);
            if (value != null) header.append(' ').append(key).append('=').append(value);
        }
        // keys written by other producers survive a rewrite
        Map<String, String> extras = new TreeMap<>();
        for (Map.Entry<String, String> e : meta.entrySet()) {
            String value = value(meta, e.getKey());
            if (value == null || HEADER_KEYS.contains(e.getKey()) || NOT_IN_HEADER.contains(e.getKey())) continue;
            if (value.chars().noneMatch(Character::isWhitespace)) extras.put(e.getKey(), value);
        }
        extras.forEach((k, v) -> header.append(' ').append(k).append('=').append(v));
        return header.toString();
    }

    private static void parseHeader(String tokens, Map<String, String> meta) {
        for (String token : tokens.trim().split("\\s+")) {
            int eq = token.indexOf('=');
            if (eq <= 0 || eq == token.length() - 1) continue;
            meta.put(token.substring(0, eq), token.substring(eq + 1));
        }
    }

    private static void absorbLegacyLinks(List<String> userLines, Map<String, String> meta) {
        Iterator<String> it = userLines.iterator();
        while (it.hasNext()) {
            String line = it.next().strip();
            Matcher link = DEEP_LINK.matcher(line);
            if (link.matches()) {
                meta.putIfAbsent(LINK_KEYS.get(link.group(1)), URLDecoder.decode(link.group(2), StandardCharsets.UTF_8));
                it.remove();
                continue;
            }
            Matcher token = LEGACY_TOKEN.matcher(line);
            if (token.matches()) {
                meta.putIfAbsent(token.group(1), token.group(2));
                it.remove();
            }
        }
    }

    private void addLink(List<String> out, String kind, String ref) {
        if (ref != null && !deepLinkBase.isEmpty()) out.add(deepLink(kind, ref));
    }

    private static String value(Map<String, String> meta, String key) {
        String value = meta.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
