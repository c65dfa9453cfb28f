package com.phillippitts.speaktolatex.service.compiler;

import com.phillippitts.speaktolatex.domain.Token;
import com.phillippitts.speaktolatex.domain.TokenKind;
import com.phillippitts.speaktolatex.service.lexicon.Lexicon;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class MathTokenizerTest {

    private static Lexicon lexicon;
    private static MathTokenizer tokenizer;

    @BeforeAll
    static void setUp() {
        lexicon = Lexicon.standard();
        tokenizer = new MathTokenizer(lexicon, 5);
    }

    @Test
    void shouldReturnNoTokensForNullOrBlank() {
        assertThat(tokenizer.tokenize(null)).isEmpty();
        assertThat(tokenizer.tokenize("  \t ")).isEmpty();
    }

    @Test
    void shouldPreferLongestPhrase() {
        List<Token> tokens = tokenizer.tokenize("x less than or equal to y");

        assertThat(tokens).extracting(Token::kind, Token::value, Token::original)
                .containsExactly(
                        tuple(TokenKind.VARIABLE, "x", "x"),
                        tuple(TokenKind.LESS_EQUAL, "\\leq", "less than or equal to"),
                        tuple(TokenKind.VARIABLE, "y", "y"));
    }

    @Test
    void shouldRecordWordPositions() {
        List<Token> tokens = tokenizer.tokenize("x less than y");

        assertThat(tokens).extracting(Token::position).containsExactly(0, 1, 3);
    }

    @Test
    void shouldSplitEToThePowerOfIntoBaseAndExponent() {
        List<Token> tokens = tokenizer.tokenize("e to the power of x");

        assertThat(tokens).extracting(Token::kind, Token::value)
                .containsExactly(
                        tuple(TokenKind.VARIABLE, "e"),
                        tuple(TokenKind.POWER, "^"),
                        tuple(TokenKind.VARIABLE, "x"));
    }

    @Test
    void shouldNotSplitEToThePowerOfWithoutExponent() {
        List<Token> tokens = tokenizer.tokenize("e to the power of");

        assertThat(tokens).extracting(Token::kind, Token::value)
                .containsExactly(
                        tuple(TokenKind.E, "e"),
                        tuple(TokenKind.POWER, "^"));
    }

    @Test
    void shouldExpandExponentialOfNegative() {
        List<Token> tokens = tokenizer.tokenize("exponential of negative x");

        assertThat(tokens).extracting(Token::kind, Token::value)
                .containsExactly(
                        tuple(TokenKind.EXPONENTIAL, "\\exp"),
                        tuple(TokenKind.BRACKET, "("),
                        tuple(TokenKind.OPERATOR, "-"),
                        tuple(TokenKind.VARIABLE, "x"));
    }

    @Test
    void shouldEmitUnknownForUnrecognisedWords() {
        List<Token> tokens = tokenizer.tokenize("banana plus 1");

        assertThat(tokens).extracting(Token::kind)
                .containsExactly(TokenKind.UNKNOWN, TokenKind.OPERATOR, TokenKind.NUMBER);
        assertThat(tokens.get(0).value()).isEqualTo("banana");
    }

    @Test
    void shouldKeepOriginalCasing() {
        List<Token> tokens = tokenizer.tokenize("A plus B");

        assertThat(tokens).extracting(Token::value).containsExactly("A", "+", "B");
    }

    @Test
    void shouldGiveSymbolAndWordTheSameValue() {
        assertThat(tokenizer.tokenize("∞").get(0).value())
                .isEqualTo(tokenizer.tokenize("infinity").get(0).value());
    }

    @Test
    void shouldReadCompoundNumerals() {
        List<Token> tokens = tokenizer.tokenize("twenty one plus forty-two");

        assertThat(tokens).extracting(Token::value).containsExactly("21", "+", "42");
    }

    @Test
    void shouldHonourPhraseWindow() {
        MathTokenizer narrow = new MathTokenizer(lexicon, 1);

        assertThat(narrow.tokenize("square root")).extracting(Token::kind)
                .containsExactly(TokenKind.UNKNOWN, TokenKind.ROOT);
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> new MathTokenizer(lexicon, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxPhraseWords");
    }
}
