package io.github.drompincen.ledgersync.runtime.identity;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of a title for matching. Every title comparison in the engine goes through
 * {@link #normalize(String)} so that "Café  ✔ milk", "cafe milk" and "CAFE​ MILK" collide.
 */
public final class TitleNormalizer {

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern INVISIBLE = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\uFE00-\\uFE0F]");
    private static final Pattern URL = Pattern.compile("(https?://|www\\.)\\S*");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TitleNormalizer() {}

    public static String normalize(String title) {
        if (title == null || title.isEmpty()) return "";
        String folded = Normalizer.normalize(title, Normalizer.Form.NFKD);
        folded = INVISIBLE.matcher(folded).replaceAll("");
        folded = MARKS.matcher(folded).replaceAll("");
        folded = folded.toLowerCase(Locale.ROOT);
        folded = URL.matcher(folded).replaceAll(" ");
        folded = NON_ALNUM.matcher(folded).replaceAll(" ");
        return folded.trim();
    }
}
