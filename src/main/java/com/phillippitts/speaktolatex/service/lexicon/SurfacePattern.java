package com.phillippitts.speaktolatex.service.lexicon;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Matcher for the surface forms of one token category.
 *
 * <p>Phrases passed to {@link #matches(String)} are already lowercased and single-space joined.
 * Implementations must match the whole phrase; partial matches do not count.
 */
public interface SurfacePattern {

    boolean matches(String phrase);

    static SurfacePattern phrases(Set<String> phrases) {
        return new Literal(phrases);
    }

    static SurfacePattern regex(String regex) {
        return new Regex(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    /** Exact lookup in a fixed set of phrases. */
    record Literal(Set<String> phrases) implements SurfacePattern {

        public Literal {
            Objects.requireNonNull(phrases, "phrases");
            phrases = Set.copyOf(phrases);
        }

        @Override
        public boolean matches(String phrase) {
            return phrases.contains(phrase);
        }
    }

    /** Full-match regular expression. */
    record Regex(Pattern pattern) implements SurfacePattern {

        public Regex {
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public boolean matches(String phrase) {
            return pattern.matcher(phrase).matches();
        }
    }
}
