package com.phillippitts.speaktolatex.service.compiler;

/**
 * What the transducer expects the next operand to be.
 */
public enum Mode {
    INITIAL,
    /** Collecting the from/to, index or approach target of a bounded construct. */
    EXPECTING_BOUNDS,
    /** After "of" or applied bounds: the body of an integral, sum, limit or enclosure. */
    EXPECTING_INTEGRAND,
    /** An integrand has started and the integral is waiting for its differential. */
    EXPECTING_DIFFERENTIAL,
    /** The next operand closes the innermost single-argument construct. */
    EXPECTING_ARGUMENT,
    /** The next operand becomes a fraction's denominator. */
    EXPECTING_DENOMINATOR,
    /** The next operand becomes an exponent. */
    EXPECTING_POWER,
    /** A derivative is waiting for the function it applies to. */
    EXPECTING_FUNCTION,
    COMPLETE
}
