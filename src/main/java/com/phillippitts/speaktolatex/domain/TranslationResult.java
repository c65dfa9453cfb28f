package com.phillippitts.speaktolatex.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of translating speech or typed text into LaTeX.
 *
 * <p>A failed translation still carries whatever speech text was recognised so clients can
 * show it; {@code latex} is empty in that case.
 *
 * @param speechText text that was (or would have been) compiled, after cleaning
 * @param latex      generated LaTeX, empty when the translation failed
 * @param success    whether LaTeX was produced
 * @param message    human-readable status
 * @param timestamp  when the translation finished
 */
public record TranslationResult(
        String speechText,
        String latex,
        boolean success,
        String message,
        Instant timestamp
) {

    public TranslationResult {
        Objects.requireNonNull(speechText, "Speech text must not be null");
        Objects.requireNonNull(latex, "LaTeX output must not be null");
        Objects.requireNonNull(message, "Message must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
    }

    public static TranslationResult success(String speechText, String latex, String message) {
        return new TranslationResult(speechText, latex, true, message, Instant.now());
    }

    public static TranslationResult failure(String speechText, String message) {
        return new TranslationResult(speechText, "", false, message, Instant.now());
    }
}
