package com.phillippitts.speaktolatex.service.translation;

import com.phillippitts.speaktolatex.config.properties.VoiceProperties;
import org.springframework.stereotype.Component;

/**
 * Normalises recognised speech before it is compiled: trims whitespace and strips trailing
 * sentence punctuation that speech engines tend to add.
 */
@Component
public class SpeechTextCleaner {

    private final String trailingPunctuation;

    public SpeechTextCleaner(VoiceProperties props) {
        this.trailingPunctuation = props.getTrailingPunctuation();
    }

    /**
     * @return cleaned text, "" for null input
     */
    public String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.strip();
        int end = cleaned.length();
        while (end > 0 && trailingPunctuation.indexOf(cleaned.charAt(end - 1)) >= 0) {
            end--;
        }
        return cleaned.substring(0, end).strip();
    }
}
