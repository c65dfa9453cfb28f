package com.phillippitts.speaktolatex.service.compiler;

/**
 * Compiles natural-language mathematics into LaTeX.
 *
 * <p>Implementations must be total: any string, including null, empty or nonsensical input,
 * yields a LaTeX string and never an exception. Calls must be independent of each other so
 * one instance can serve concurrent requests.
 *
 * <p>Example:
 * <pre>{@code
 * compiler.compile("square root of x plus y");   // \sqrt{x + y}
 * }</pre>
 */
public interface LatexCompiler {

    /**
     * @param text spoken or typed math, may be null
     * @return LaTeX, empty for null or blank input
     */
    String compile(String text);
}
