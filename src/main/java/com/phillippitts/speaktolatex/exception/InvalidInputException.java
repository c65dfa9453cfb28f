package com.phillippitts.speaktolatex.exception;

/**
 * Thrown when a text translation request carries no usable text.
 */
public class InvalidInputException extends SpeakToLatexException {

    public InvalidInputException(String message) {
        super(message);
    }
}
