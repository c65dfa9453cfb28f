package com.phillippitts.speaktolatex.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the speech and text translation endpoints.
 */
@Validated
@ConfigurationProperties(prefix = "latex.voice")
public class VoiceProperties {

    public static final long DEFAULT_MAX_AUDIO_BYTES = 10L * 1024 * 1024;
    public static final String DEFAULT_TRAILING_PUNCTUATION = ".,!?;:";
    public static final int DEFAULT_LOG_PREVIEW_CHARS = 80;

    /** Uploads larger than this are rejected before reaching the speech engine. */
    @Positive
    private final long maxAudioBytes;

    /** Characters stripped from the end of recognised speech before compiling. */
    @NotNull
    private final String trailingPunctuation;

    /** How much of the speech text is logged at INFO; 0 disables previews. */
    @Min(0)
    private final int logPreviewChars;

    @ConstructorBinding
    public VoiceProperties(Long maxAudioBytes, String trailingPunctuation, Integer logPreviewChars) {
        this.maxAudioBytes = maxAudioBytes == null ? DEFAULT_MAX_AUDIO_BYTES : maxAudioBytes;
        this.trailingPunctuation = trailingPunctuation == null ? DEFAULT_TRAILING_PUNCTUATION : trailingPunctuation;
        this.logPreviewChars = logPreviewChars == null ? DEFAULT_LOG_PREVIEW_CHARS : logPreviewChars;
    }

    public VoiceProperties() {
        this(null, null, null);
    }

    public long getMaxAudioBytes() {
        return maxAudioBytes;
    }

    public String getTrailingPunctuation() {
        return trailingPunctuation;
    }

    public int getLogPreviewChars() {
        return logPreviewChars;
    }
}
