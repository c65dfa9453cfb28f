package com.phillippitts.speaktolatex.service.compiler;

import java.util.Deque;

/**
 * Emits closing delimiters for constructs that are still open.
 *
 * <p>Used when a construct is closed by something other than its argument (a differential
 * closing everything above its integral, a closing bracket) and at end of input.
 */
public final class ConstructFinalizer {

    /**
     * Returns the text that closes a construct of the given kind; empty when the construct
     * has no closing delimiter.
     */
    public String closingFor(ConstructKind kind) {
        return switch (kind) {
            case FRACTION, SQRT, NROOT, VECTOR, EXPONENT -> "}";
            case ABSOLUTE -> "\\right|";
            case MATRIX -> "\\end{pmatrix}";
            case PROBABILITY, FUNCTION_WITH_PARENS, GROUP -> ")";
            case EXPECTED_VALUE, SQUARE_GROUP -> "]";
            case MAGNITUDE -> "\\|";
            case INNER_PRODUCT -> "\\rangle";
            case SEQUENCE -> "\\right\\}";
            case INTEGRAL, DERIVATIVE, PARTIAL, LIMIT, SUM, PRODUCT, FUNCTION -> "";
        };
    }

    /** Appends the closing delimiter of {@code context}, if it has one. */
    public void close(ConstructContext context, OutputBuffer buffer) {
        String closing = closingFor(context.kind());
        if (!closing.isEmpty()) {
            buffer.append(closing);
        }
    }

    /**
     * Pops and closes every open construct, innermost first. A bounded construct whose bounds
     * are complete but not yet written gets them written before it is closed.
     */
    public void closeAll(Deque<ConstructContext> contexts, OutputBuffer buffer, BoundsAccumulator bounds) {
        while (!contexts.isEmpty()) {
            ConstructContext context = contexts.pop();
            if (context.kind().isBounded() && bounds.isOwnedBy(context) && bounds.isComplete()) {
                bounds.applyTo(buffer);
            }
            close(context, buffer);
        }
    }
}
