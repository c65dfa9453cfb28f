package com.phillippitts.speaktolatex.domain;

import java.util.Objects;

/**
 * Immutable lexical unit produced by the tokenizer.
 *
 * @param kind     category the surface text was classified as
 * @param value    canonical LaTeX fragment, or the surface text when no mapping exists
 * @param original surface text as it appeared in the input (casing preserved)
 * @param position ordinal of the first input word the token consumed (not a character offset)
 */
public record Token(
        TokenKind kind,
        String value,
        String original,
        int position
) {

    /**
     * @throws NullPointerException if kind, value or original is null
     * @throws IllegalArgumentException if position is negative
     */
    public Token {
        Objects.requireNonNull(kind, "Token kind must not be null");
        Objects.requireNonNull(value, "Token value must not be null");
        Objects.requireNonNull(original, "Token original text must not be null");
        if (position < 0) {
            throw new IllegalArgumentException("Token position must be >= 0, got: " + position);
        }
    }
}
