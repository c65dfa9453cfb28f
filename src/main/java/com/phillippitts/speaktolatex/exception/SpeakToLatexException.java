package com.phillippitts.speaktolatex.exception;

/**
 * Base exception for speak-to-LaTeX errors.
 * Domain exceptions extend this class so the web layer can map them in one place.
 */
public class SpeakToLatexException extends RuntimeException {

    public SpeakToLatexException(String message) {
        super(message);
    }

    public SpeakToLatexException(String message, Throwable cause) {
        super(message, cause);
    }
}
