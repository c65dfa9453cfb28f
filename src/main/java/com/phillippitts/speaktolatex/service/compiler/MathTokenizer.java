package com.phillippitts.speaktolatex.service.compiler;

import com.phillippitts.speaktolatex.domain.Token;
import com.phillippitts.speaktolatex.domain.TokenKind;
import com.phillippitts.speaktolatex.service.lexicon.Lexicon;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Splits natural-language math into {@link Token}s using greedy longest-phrase matching.
 *
 * <p>At each word the tokenizer first checks a small set of fixed idioms, then tries phrase
 * windows from {@code maxPhraseWords} down to a single word. The first window the lexicon
 * classifies wins and its words are consumed. A single word nothing matches becomes an
 * {@link TokenKind#UNKNOWN} token carrying the word itself.
 *
 * <p>Thread-safe: holds no per-call state.
 */
public final class MathTokenizer {

    private static final Logger LOG = LogManager.getLogger(MathTokenizer.class);

    private static final String[] E_POWER_IDIOM = {"e", "to", "the", "power", "of"};
    private static final String[] NEGATIVE_EXPONENTIAL_IDIOM = {"exponential", "of", "negative"};

    private final Lexicon lexicon;
    private final int maxPhraseWords;

    /**
     * @param lexicon        vocabulary used for classification
     * @param maxPhraseWords longest phrase window tried, at least 1
     */
    public MathTokenizer(Lexicon lexicon, int maxPhraseWords) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        if (maxPhraseWords < 1) {
            throw new IllegalArgumentException("maxPhraseWords must be >= 1, got: " + maxPhraseWords);
        }
        this.maxPhraseWords = maxPhraseWords;
    }

    /**
     * Tokenizes free text.
     *
     * @param text input, may be null or blank
     * @return tokens in input order, empty for null or blank input
     */
    public List<Token> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] words = text.strip().split("\\s+");
        String[] lower = new String[words.length];
        for (int i = 0; i < words.length; i++) {
            lower[i] = words[i].toLowerCase(Locale.ROOT);
        }

        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < words.length) {
            int consumed = matchIdiom(words, lower, i, tokens);
            if (consumed == 0) {
                consumed = matchPhrase(words, i, tokens);
            }
            i += consumed;
        }
        LOG.debug("Tokenized {} words into {} tokens", words.length, tokens.size());
        return tokens;
    }

    private int matchIdiom(String[] words, String[] lower, int start, List<Token> tokens) {
        // the exponent must follow, otherwise "e" stays Euler's number
        if (start + E_POWER_IDIOM.length < words.length && startsWith(lower, start, E_POWER_IDIOM)) {
            tokens.add(new Token(TokenKind.VARIABLE, words[start], words[start], start));
            tokens.add(new Token(TokenKind.POWER, "^", join(words, start + 1, 4), start));
            return E_POWER_IDIOM.length;
        }
        if (startsWith(lower, start, NEGATIVE_EXPONENTIAL_IDIOM)) {
            tokens.add(new Token(TokenKind.EXPONENTIAL, "\\exp", join(words, start, 2), start));
            tokens.add(new Token(TokenKind.BRACKET, "(", "(", start));
            tokens.add(new Token(TokenKind.OPERATOR, "-", words[start + 2], start));
            return NEGATIVE_EXPONENTIAL_IDIOM.length;
        }
        return 0;
    }

    private int matchPhrase(String[] words, int start, List<Token> tokens) {
        int longest = Math.min(maxPhraseWords, words.length - start);
        for (int length = longest; length >= 1; length--) {
            String phrase = join(words, start, length);
            TokenKind kind = lexicon.classify(phrase);
            if (kind != TokenKind.UNKNOWN) {
                tokens.add(new Token(kind, lexicon.canonicalValue(phrase), phrase, start));
                return length;
            }
        }
        String word = words[start];
        tokens.add(new Token(TokenKind.UNKNOWN, lexicon.canonicalValue(word), word, start));
        return 1;
    }

    private static boolean startsWith(String[] lower, int start, String[] idiom) {
        if (start + idiom.length > lower.length) {
            return false;
        }
        return Arrays.equals(lower, start, start + idiom.length, idiom, 0, idiom.length);
    }

    private static String join(String[] words, int start, int length) {
        return String.join(" ", Arrays.asList(words).subList(start, start + length));
    }
}
