package com.phillippitts.speaktolatex.domain;

/**
 * Closed set of token categories recognised by the lexicon.
 *
 * <p>The transducer dispatches on this enum with an exhaustive {@code switch} expression,
 * so adding a constant here fails compilation until every handler site covers it.
 */
public enum TokenKind {

    // Structural
    NUMBER(TokenFamily.STRUCTURAL),
    VARIABLE(TokenFamily.STRUCTURAL),
    OPERATOR(TokenFamily.STRUCTURAL),
    BRACKET(TokenFamily.STRUCTURAL),
    FROM(TokenFamily.STRUCTURAL),
    TO(TokenFamily.STRUCTURAL),
    OF(TokenFamily.STRUCTURAL),
    EQUALS(TokenFamily.STRUCTURAL),
    APPROACHES(TokenFamily.STRUCTURAL),
    AS(TokenFamily.STRUCTURAL),
    DIFFERENTIAL(TokenFamily.STRUCTURAL),
    WITH_RESPECT_TO(TokenFamily.STRUCTURAL),

    // Calculus
    INTEGRAL(TokenFamily.CALCULUS),
    DERIVATIVE(TokenFamily.CALCULUS),
    PARTIAL(TokenFamily.CALCULUS),
    LIMIT(TokenFamily.CALCULUS),

    // Series and sequences
    SUM(TokenFamily.SERIES),
    PRODUCT(TokenFamily.SERIES),
    SERIES(TokenFamily.SERIES),
    SEQUENCE(TokenFamily.SERIES),

    // Algebra
    FRACTION(TokenFamily.ALGEBRA),
    POWER(TokenFamily.ALGEBRA),
    ROOT(TokenFamily.ALGEBRA),
    FACTORIAL(TokenFamily.ALGEBRA),
    ABSOLUTE(TokenFamily.ALGEBRA),

    // Functions
    TRIG(TokenFamily.FUNCTION),
    INVERSE_TRIG(TokenFamily.FUNCTION),
    HYPERBOLIC(TokenFamily.FUNCTION),
    LOG(TokenFamily.FUNCTION),
    EXPONENTIAL(TokenFamily.FUNCTION),

    // Linear algebra
    MATRIX(TokenFamily.LINEAR_ALGEBRA),
    VECTOR(TokenFamily.LINEAR_ALGEBRA),
    DETERMINANT(TokenFamily.LINEAR_ALGEBRA),
    TRANSPOSE(TokenFamily.LINEAR_ALGEBRA),
    INVERSE(TokenFamily.LINEAR_ALGEBRA),
    DOT_PRODUCT(TokenFamily.LINEAR_ALGEBRA),
    CROSS_PRODUCT(TokenFamily.LINEAR_ALGEBRA),
    INNER_PRODUCT(TokenFamily.LINEAR_ALGEBRA),
    MAGNITUDE(TokenFamily.LINEAR_ALGEBRA),
    NORM(TokenFamily.LINEAR_ALGEBRA),

    // Set theory
    SET(TokenFamily.SET_THEORY),
    SUBSET(TokenFamily.SET_THEORY),
    UNION(TokenFamily.SET_THEORY),
    INTERSECTION(TokenFamily.SET_THEORY),
    ELEMENT(TokenFamily.SET_THEORY),

    // Logic
    AND(TokenFamily.LOGIC),
    OR(TokenFamily.LOGIC),
    NOT(TokenFamily.LOGIC),
    IMPLIES(TokenFamily.LOGIC),
    IFF(TokenFamily.LOGIC),
    THEREFORE(TokenFamily.LOGIC),
    BECAUSE(TokenFamily.LOGIC),
    QED(TokenFamily.LOGIC),

    // Comparisons
    LESS_THAN(TokenFamily.COMPARISON),
    GREATER_THAN(TokenFamily.COMPARISON),
    LESS_EQUAL(TokenFamily.COMPARISON),
    GREATER_EQUAL(TokenFamily.COMPARISON),
    NOT_EQUAL(TokenFamily.COMPARISON),
    APPROXIMATELY(TokenFamily.COMPARISON),

    // Geometry
    ANGLE(TokenFamily.GEOMETRY),
    PARALLEL(TokenFamily.GEOMETRY),
    PERPENDICULAR(TokenFamily.GEOMETRY),
    CONGRUENT(TokenFamily.GEOMETRY),
    SIMILAR(TokenFamily.GEOMETRY),

    // Statistics
    PROBABILITY(TokenFamily.STATISTICS),
    EXPECTED_VALUE(TokenFamily.STATISTICS),
    VARIANCE(TokenFamily.STATISTICS),
    STANDARD_DEVIATION(TokenFamily.STATISTICS),

    // Constants
    PI(TokenFamily.CONSTANT),
    E(TokenFamily.CONSTANT),
    INFINITY(TokenFamily.CONSTANT),

    // Quantifiers
    FOR_ALL(TokenFamily.QUANTIFIER),
    EXISTS(TokenFamily.QUANTIFIER),
    SUCH_THAT(TokenFamily.QUANTIFIER),

    // Natural-language predicates
    IS_POSITIVE(TokenFamily.PREDICATE),
    IS_NEGATIVE(TokenFamily.PREDICATE),
    IS_NONNEGATIVE(TokenFamily.PREDICATE),
    IS_ZERO(TokenFamily.PREDICATE),
    IS_EVEN(TokenFamily.PREDICATE),
    IS_ODD(TokenFamily.PREDICATE),
    IS_PRIME(TokenFamily.PREDICATE),
    IS_INTEGER(TokenFamily.PREDICATE),
    IS_NATURAL(TokenFamily.PREDICATE),
    IS_RATIONAL(TokenFamily.PREDICATE),
    IS_REAL(TokenFamily.PREDICATE),
    IS_COMPLEX(TokenFamily.PREDICATE),

    UNKNOWN(TokenFamily.UNKNOWN);

    private final TokenFamily family;

    TokenKind(TokenFamily family) {
        this.family = family;
    }

    public TokenFamily family() {
        return family;
    }

    /**
     * Returns whether tokens of this kind are operands: values that fill bounds, arguments,
     * exponents and denominators.
     *
     * @return true for numbers, variables and the {@link TokenFamily#CONSTANT} family
     */
    public boolean isOperand() {
        return this == NUMBER || this == VARIABLE || family() == TokenFamily.CONSTANT;
    }
}
