package com.phillippitts.speaktolatex.service.translation;

import com.phillippitts.speaktolatex.config.properties.VoiceProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpeechTextCleanerTest {

    private final SpeechTextCleaner cleaner = new SpeechTextCleaner(new VoiceProperties());

    @Test
    void shouldStripTrailingPunctuation() {
        assertThat(cleaner.clean("x squared plus one.")).isEqualTo("x squared plus one");
        assertThat(cleaner.clean("what is x?!")).isEqualTo("what is x");
    }

    @Test
    void shouldTrimWhitespaceAroundPunctuation() {
        assertThat(cleaner.clean("  sine x .  ")).isEqualTo("sine x");
    }

    @Test
    void shouldKeepInnerPunctuation() {
        assertThat(cleaner.clean("a, b and c")).isEqualTo("a, b and c");
    }

    @Test
    void shouldReturnEmptyForNullOrPunctuationOnly() {
        assertThat(cleaner.clean(null)).isEmpty();
        assertThat(cleaner.clean(" ... ")).isEmpty();
    }

    @Test
    void shouldHonourConfiguredPunctuation() {
        SpeechTextCleaner custom = new SpeechTextCleaner(new VoiceProperties(null, "#", null));

        assertThat(custom.clean("x plus y.#")).isEqualTo("x plus y.");
    }
}
