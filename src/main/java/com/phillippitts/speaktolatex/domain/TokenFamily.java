package com.phillippitts.speaktolatex.domain;

/**
 * Coarse grouping of {@link TokenKind}s, mirroring the areas of mathematics the lexicon covers.
 */
public enum TokenFamily {
    STRUCTURAL,
    CALCULUS,
    SERIES,
    ALGEBRA,
    FUNCTION,
    LINEAR_ALGEBRA,
    SET_THEORY,
    LOGIC,
    COMPARISON,
    GEOMETRY,
    STATISTICS,
    CONSTANT,
    QUANTIFIER,
    PREDICATE,
    UNKNOWN
}
