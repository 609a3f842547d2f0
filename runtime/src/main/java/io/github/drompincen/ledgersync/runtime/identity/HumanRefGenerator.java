package io.github.drompincen.ledgersync.runtime.identity;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.function.Predicate;

/** Generates {@code TK-XXXXXX} references from an alphabet without look-alike characters. */
@Component
public class HumanRefGenerator {

    public static final String PREFIX = "TK-";
    static final String ALPHABET = "23456789ABCDEFGHJKMNPQRSTUVWXYZ";
    private static final int LENGTH = 6;
    private static final int MAX_ATTEMPTS = 10;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        StringBuilder ref = new StringBuilder(PREFIX);
        for (int i = 0; i < LENGTH; i++) {
            ref.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return ref.toString();
    }

    /** A reference not rejected by {@code taken}; gives up on uniqueness after a few attempts. */
    public String next(Predicate<String> taken) {
        String candidate = next();
        for (int i = 1; i < MAX_ATTEMPTS && taken.test(candidate); i++) {
            candidate = next();
        }
        return candidate;
    }

    public static boolean looksLikeHumanRef(String ref) {
        return ref != null && ref.regionMatches(true, 0, PREFIX, 0, PREFIX.length());
    }
}
