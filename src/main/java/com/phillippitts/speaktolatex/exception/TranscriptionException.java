package com.phillippitts.speaktolatex.exception;

/**
 * Thrown when speech recognition cannot produce text: no engine is configured, the engine
 * crashed, or it returned nothing usable.
 */
public class TranscriptionException extends SpeakToLatexException {

    private final String engineName;

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
