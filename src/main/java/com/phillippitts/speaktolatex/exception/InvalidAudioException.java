package com.phillippitts.speaktolatex.exception;

/**
 * Thrown when an uploaded recording is missing, empty or larger than the configured limit.
 */
public class InvalidAudioException extends SpeakToLatexException {

    private final long audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Rejected audio upload: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(long audioSize, String reason) {
        super("Rejected audio upload of " + audioSize + " bytes: " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public long getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
