package com.phillippitts.speaktolatex.service.compiler;

/**
 * Kinds of open constructs tracked on the transducer's context stack.
 */
public enum ConstructKind {
    INTEGRAL,
    DERIVATIVE,
    PARTIAL,
    LIMIT,
    SUM,
    PRODUCT,
    FRACTION,
    SQRT,
    NROOT,
    FUNCTION,
    FUNCTION_WITH_PARENS,
    ABSOLUTE,
    VECTOR,
    MATRIX,
    PROBABILITY,
    EXPECTED_VALUE,
    MAGNITUDE,
    INNER_PRODUCT,
    SEQUENCE,
    GROUP,
    SQUARE_GROUP,
    EXPONENT;

    /** Whether this construct collects bounds (from/to, index, approach target). */
    public boolean isBounded() {
        return this == INTEGRAL || this == LIMIT || this == SUM || this == PRODUCT;
    }

    public boolean isDerivative() {
        return this == DERIVATIVE || this == PARTIAL;
    }

    /** Whether "of" after this construct starts its body rather than being dropped. */
    public boolean takesBodyAfterOf() {
        return switch (this) {
            case INTEGRAL, DERIVATIVE, PARTIAL, LIMIT, SUM, PRODUCT,
                    SQRT, NROOT, ABSOLUTE, MAGNITUDE, PROBABILITY, EXPECTED_VALUE, SEQUENCE, VECTOR -> true;
            case FRACTION, FUNCTION, FUNCTION_WITH_PARENS, MATRIX, INNER_PRODUCT, GROUP, SQUARE_GROUP,
                    EXPONENT -> false;
        };
    }
}
