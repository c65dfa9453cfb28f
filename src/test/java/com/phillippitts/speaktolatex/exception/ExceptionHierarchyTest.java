package com.phillippitts.speaktolatex.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void speakToLatexExceptionShouldIncludeMessage() {
        SpeakToLatexException ex = new SpeakToLatexException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void speakToLatexExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        SpeakToLatexException ex = new SpeakToLatexException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void invalidAudioExceptionShouldIncludeSizeAndReason() {
        InvalidAudioException ex = new InvalidAudioException(20_000_000L, "too large");

        assertThat(ex.getMessage()).contains("20000000").contains("too large");
        assertThat(ex.getAudioSize()).isEqualTo(20_000_000L);
        assertThat(ex.getReason()).isEqualTo("too large");
    }

    @Test
    void invalidAudioExceptionWithoutSize() {
        InvalidAudioException ex = new InvalidAudioException("audio file is empty");

        assertThat(ex.getMessage()).contains("audio file is empty");
        assertThat(ex.getReason()).isEqualTo("audio file is empty");
    }

    @Test
    void transcriptionExceptionShouldIncludeEngineName() {
        RuntimeException cause = new RuntimeException("native crash");
        TranscriptionException ex = new TranscriptionException("Decoding failed", "recognizer", cause);

        assertThat(ex.getMessage()).contains("Decoding failed").contains("recognizer");
        assertThat(ex.getEngineName()).isEqualTo("recognizer");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allExceptionsShouldExtendBase() {
        assertThat(new InvalidInputException("x")).isInstanceOf(SpeakToLatexException.class);
        assertThat(new InvalidAudioException("x")).isInstanceOf(SpeakToLatexException.class);
        assertThat(new TranscriptionException("x", "e")).isInstanceOf(SpeakToLatexException.class);
        assertThat(new SpeakToLatexException("x")).isInstanceOf(RuntimeException.class);
    }
}
