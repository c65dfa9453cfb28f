package com.phillippitts.speaktolatex.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Typed properties for the math compiler.
 */
@Validated
@ConfigurationProperties(prefix = "latex.compiler")
public class CompilerProperties {

    public static final int DEFAULT_MAX_PHRASE_WORDS = 5;

    public static final List<String> DEFAULT_FILLER_WORDS =
            List.of("the", "a", "an", "is", "are", "was", "were", "defined");

    /**
     * Longest phrase window the tokenizer tries. The longest built-in phrase has five words;
     * a smaller value makes those phrases unreachable.
     */
    @Min(1)
    @Max(8)
    private final int maxPhraseWords;

    /** Unknown words dropped from the output instead of being emitted verbatim. */
    @NotNull
    private final List<String> fillerWords;

    @ConstructorBinding
    public CompilerProperties(Integer maxPhraseWords, List<String> fillerWords) {
        this.maxPhraseWords = maxPhraseWords == null ? DEFAULT_MAX_PHRASE_WORDS : maxPhraseWords;
        this.fillerWords = fillerWords == null ? DEFAULT_FILLER_WORDS : List.copyOf(fillerWords);
    }

    /**
     * Defaults for tests and programmatic wiring.
     */
    public CompilerProperties() {
        this(null, null);
    }

    public int getMaxPhraseWords() {
        return maxPhraseWords;
    }

    public List<String> getFillerWords() {
        return fillerWords;
    }

    public Set<String> fillerWordSet() {
        return new LinkedHashSet<>(fillerWords);
    }
}
