package com.phillippitts.speaktolatex.service.lexicon;

import com.phillippitts.speaktolatex.domain.TokenKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Surface-form dictionary of the math language: which phrases belong to which token category,
 * and which canonical LaTeX fragment each surface form stands for.
 *
 * <p>Instances are immutable and safe to share between threads. Use {@link #standard()} for the
 * built-in vocabulary or {@link Builder} to assemble a custom one.
 */
public final class Lexicon {

    private final Map<TokenKind, List<SurfacePattern>> patterns;
    private final Map<String, String> canonicalValues;
    private final CategoryPriority priority;

    private Lexicon(Map<TokenKind, List<SurfacePattern>> patterns,
                    Map<String, String> canonicalValues,
                    CategoryPriority priority) {
        EnumMap<TokenKind, List<SurfacePattern>> copy = new EnumMap<>(TokenKind.class);
        patterns.forEach((kind, list) -> copy.put(kind, List.copyOf(list)));
        this.patterns = copy;
        this.canonicalValues = Map.copyOf(canonicalValues);
        this.priority = priority;
    }

    /**
     * Returns the built-in English math vocabulary with the standard category priority.
     *
     * @throws IllegalStateException if a pinned collision does not resolve to its expected winner
     */
    public static Lexicon standard() {
        Lexicon lexicon = LexiconTables.populate(new Builder()).build(CategoryPriority.standard());
        lexicon.verifyCollisions();
        return lexicon;
    }

    /**
     * Classifies a phrase into the highest-priority category whose patterns match it.
     *
     * @param phrase one or more words, any casing
     * @return matching category, or {@link TokenKind#UNKNOWN}
     */
    public TokenKind classify(String phrase) {
        return priority.winner(candidates(phrase));
    }

    /**
     * Returns every category whose patterns match the phrase, in priority order.
     */
    public List<TokenKind> candidatesInPriorityOrder(String phrase) {
        return priority.sort(candidates(phrase));
    }

    /**
     * Returns the canonical LaTeX for a surface form, or the surface form itself.
     *
     * <p>The exact surface is tried first so capitalised Greek letters keep their own symbol;
     * the lowercase form is tried next. A surface that maps to itself keeps its original casing,
     * so {@code E} stays {@code E}.
     */
    public String canonicalValue(String surface) {
        String exact = canonicalValues.get(surface);
        if (exact != null) {
            return exact;
        }
        String normalized = normalize(surface);
        String value = canonicalValues.get(normalized);
        if (value == null || value.equals(normalized)) {
            return surface.strip();
        }
        return value;
    }

    public List<SurfacePattern> patternsFor(TokenKind kind) {
        return patterns.getOrDefault(kind, List.of());
    }

    public CategoryPriority priority() {
        return priority;
    }

    private Set<TokenKind> candidates(String phrase) {
        String normalized = normalize(phrase);
        Set<TokenKind> matches = EnumSet.noneOf(TokenKind.class);
        for (Map.Entry<TokenKind, List<SurfacePattern>> entry : patterns.entrySet()) {
            for (SurfacePattern pattern : entry.getValue()) {
                if (pattern.matches(normalized)) {
                    matches.add(entry.getKey());
                    break;
                }
            }
        }
        return matches;
    }

    private void verifyCollisions() {
        priority.knownCollisions().forEach((surface, expected) -> {
            TokenKind actual = classify(surface);
            if (actual != expected) {
                throw new IllegalStateException(
                        "Surface '" + surface + "' resolves to " + actual + " but " + expected + " is expected");
            }
        });
    }

    static String normalize(String phrase) {
        return phrase.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Mutable collector of surface forms. Not thread-safe.
     */
    public static final class Builder {

        private final Map<TokenKind, Set<String>> phrases = new EnumMap<>(TokenKind.class);
        private final Map<TokenKind, List<SurfacePattern>> regexes = new EnumMap<>(TokenKind.class);
        private final Map<String, String> canonicalValues = new HashMap<>();

        /**
         * Registers phrases for a category, all standing for the same canonical LaTeX.
         *
         * @throws IllegalStateException if a surface was already registered with another value
         */
        public Builder phrases(TokenKind kind, String value, String... surfaces) {
            Objects.requireNonNull(value, "value");
            for (String surface : surfaces) {
                String key = normalize(surface);
                phrases.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(key);
                String previous = canonicalValues.putIfAbsent(key, value);
                if (previous != null && !previous.equals(value)) {
                    throw new IllegalStateException("Surface '" + surface + "' already maps to '" + previous
                            + "', cannot remap to '" + value + "'");
                }
            }
            return this;
        }

        /**
         * Makes phrases match a category without giving them a canonical value of their own.
         * Used for the losing side of a collision.
         */
        public Builder aliases(TokenKind kind, String... surfaces) {
            for (String surface : surfaces) {
                phrases.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(normalize(surface));
            }
            return this;
        }

        public Builder regex(TokenKind kind, String regex) {
            regexes.computeIfAbsent(kind, k -> new ArrayList<>()).add(SurfacePattern.regex(regex));
            return this;
        }

        /** Adds a case-sensitive canonical value that matches no category by itself. */
        public Builder canonical(String surface, String value) {
            canonicalValues.put(surface, value);
            return this;
        }

        public Lexicon build(CategoryPriority priority) {
            Objects.requireNonNull(priority, "priority");
            Map<TokenKind, List<SurfacePattern>> patterns = new EnumMap<>(TokenKind.class);
            phrases.forEach((kind, set) ->
                    patterns.computeIfAbsent(kind, k -> new ArrayList<>()).add(SurfacePattern.phrases(set)));
            regexes.forEach((kind, list) ->
                    patterns.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(list));
            return new Lexicon(patterns, canonicalValues, priority);
        }
    }
}
