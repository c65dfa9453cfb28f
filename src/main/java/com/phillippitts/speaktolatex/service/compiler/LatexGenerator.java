package com.phillippitts.speaktolatex.service.compiler;

/**
 * Concatenates the output buffer into the final LaTeX string. Adds no separators of its own.
 */
public final class LatexGenerator {

    public String generate(OutputBuffer buffer) {
        return String.join("", buffer.fragments());
    }
}
