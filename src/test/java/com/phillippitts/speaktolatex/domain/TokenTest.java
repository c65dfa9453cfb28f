package com.phillippitts.speaktolatex.domain;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenTest {

    @Test
    void shouldCreateValidToken() {
        Token token = new Token(TokenKind.TRIG, "\\sin", "sine", 2);

        assertThat(token.kind()).isEqualTo(TokenKind.TRIG);
        assertThat(token.value()).isEqualTo("\\sin");
        assertThat(token.original()).isEqualTo("sine");
        assertThat(token.position()).isEqualTo(2);
    }

    @Test
    void shouldRejectNullKind() {
        assertThatThrownBy(() -> new Token(null, "x", "x", 0))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("kind");
    }

    @Test
    void shouldRejectNullValue() {
        assertThatThrownBy(() -> new Token(TokenKind.VARIABLE, null, "x", 0))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("value");
    }

    @Test
    void shouldRejectNegativePosition() {
        assertThatThrownBy(() -> new Token(TokenKind.VARIABLE, "x", "x", -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("position");
    }

    @Test
    void operandsShouldBeNumbersVariablesAndConstants() {
        Set<TokenKind> operands = Arrays.stream(TokenKind.values())
                .filter(TokenKind::isOperand)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(TokenKind.class)));

        assertThat(operands).containsExactlyInAnyOrder(
                TokenKind.NUMBER, TokenKind.VARIABLE, TokenKind.PI, TokenKind.E, TokenKind.INFINITY);
    }

    @Test
    void shouldAssignEveryKindToAFamily() {
        for (TokenKind kind : TokenKind.values()) {
            assertThat(kind.family()).as(kind.name()).isNotNull();
        }
        assertThat(TokenKind.INTEGRAL.family()).isEqualTo(TokenFamily.CALCULUS);
        assertThat(TokenKind.UNION.family()).isEqualTo(TokenFamily.SET_THEORY);
        assertThat(TokenKind.IS_PRIME.family()).isEqualTo(TokenFamily.PREDICATE);
    }

    @Test
    void shouldUseEveryFamily() {
        Set<TokenFamily> used = Arrays.stream(TokenKind.values())
                .map(TokenKind::family)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(TokenFamily.class)));

        assertThat(used).containsExactlyInAnyOrder(TokenFamily.values());
    }

    @Test
    void onlyUnknownShouldBelongToUnknownFamily() {
        assertThat(Arrays.stream(TokenKind.values()).filter(k -> k.family() == TokenFamily.UNKNOWN))
                .containsExactly(TokenKind.UNKNOWN);
    }
}
