package com.phillippitts.speaktolatex.service.stt;

import com.phillippitts.speaktolatex.exception.TranscriptionException;

/**
 * Speech-to-text engine that turns a recorded clip into plain text.
 *
 * <p>The translation service looks the engine up lazily, so the application runs without
 * one; audio requests then fail with a {@link TranscriptionException}.
 *
 * <p>Implementations must be thread-safe.
 */
public interface SttEngine {

    /**
     * Transcribes an audio clip.
     *
     * @param audioData raw bytes of the uploaded recording, never empty
     * @return recognised text, possibly blank when nothing was said
     * @throws TranscriptionException if the engine fails
     */
    String transcribe(byte[] audioData);

    /**
     * @return short identifier used in logs and metrics tags
     */
    String getEngineName();

    boolean isHealthy();
}
