package io.supervisedproxy.core.process;

import java.util.Locale;

/**
 * Decides whether one line of backend output announces that the backend's
 * listener is bound.
 */
@FunctionalInterface
public interface ReadinessPredicate {

    /** Phrase printed by the bundled backend once it listens. */
    String DEFAULT_PHRASE = "serving on port";

    boolean test(String line);

    /**
     * Case-insensitive substring match.
     *
     * @param phrase non-blank phrase to look for
     * @return a predicate matching any line that contains {@code phrase}
     */
    static ReadinessPredicate containsIgnoreCase(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new IllegalArgumentException("readiness phrase must not be blank");
        }
        String needle = phrase.toLowerCase(Locale.ROOT);
        return line -> line != null && line.toLowerCase(Locale.ROOT).contains(needle);
    }
}
