package com.phillippitts.speaktolatex.service.compiler;

import com.phillippitts.speaktolatex.config.properties.CompilerProperties;
import com.phillippitts.speaktolatex.service.lexicon.Lexicon;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class MathLatexCompilerTest {

    private static LatexCompiler compiler;

    @BeforeAll
    static void setUp() {
        CompilerProperties props = new CompilerProperties();
        compiler = new MathLatexCompiler(
                new MathTokenizer(Lexicon.standard(), props.getMaxPhraseWords()),
                props.fillerWordSet());
    }

    @Test
    void shouldCompileDefiniteIntegral() {
        assertThat(compiler.compile("the integral from zero to infinity of x squared dx"))
                .isEqualTo("\\int_{0}^{\\infty}x^2\\, dx");
    }

    @Test
    void shouldCompileIntegralWithComparison() {
        assertThat(compiler.compile("the integral from 0 to pi of sine x dx equals 2"))
                .isEqualTo("\\int_{0}^{\\pi}\\sin x\\, dx = 2");
    }

    @Test
    void shouldCompileIndefiniteIntegral() {
        assertThat(compiler.compile("integral of x squared dx")).isEqualTo("\\int x^2\\, dx");
    }

    @Test
    void shouldCompileDoubleIntegral() {
        assertThat(compiler.compile("double integral of f dx")).isEqualTo("\\iint f\\, dx");
    }

    @Test
    void shouldCompileDerivativeOfFunction() {
        assertThat(compiler.compile("derivative of sine x")).isEqualTo("\\frac{d}{dx}\\sin x");
    }

    @Test
    void shouldRewriteDerivativeVariableWithRespectTo() {
        assertThat(compiler.compile("the derivative of x squared with respect to t"))
                .isEqualTo("\\frac{d}{dt}x^2");
    }

    @Test
    void shouldCompilePartialDerivative() {
        assertThat(compiler.compile("partial derivative of f with respect to y"))
                .isEqualTo("\\frac{\\partial}{\\partial y}f");
    }

    @Test
    void shouldExtendSquareRootOverWholeExpression() {
        assertThat(compiler.compile("square root of x plus y")).isEqualTo("\\sqrt{x + y}");
    }

    @Test
    void shouldCompileCubeRoot() {
        assertThat(compiler.compile("cube root of 8")).isEqualTo("\\sqrt[3]{8}");
    }

    @Test
    void shouldCompileLimitWithFraction() {
        assertThat(compiler.compile("the limit as n approaches infinity of 1 over n equals 0"))
                .isEqualTo("\\lim_{n \\to \\infty}\\frac{1}{n} = 0");
    }

    @Test
    void shouldUseFunctionApplicationAsNumerator() {
        assertThat(compiler.compile("the limit as x approaches 0 of sine x over x"))
                .isEqualTo("\\lim_{x \\to 0}\\frac{\\sin x}{x}");
    }

    @Test
    void shouldTreatOperandBeforeApproachesAsLimitVariable() {
        assertThat(compiler.compile("limit x approaches 0 of x")).isEqualTo("\\lim_{x \\to 0}x");
    }

    @Test
    void shouldCompileSumWithIndexAndBounds() {
        assertThat(compiler.compile("sum from i equals 1 to n of i squared"))
                .isEqualTo("\\sum_{i=1}^{n}i^2");
    }

    @Test
    void shouldCompileSumWithoutBounds() {
        assertThat(compiler.compile("sum of i")).isEqualTo("\\sum i");
    }

    @Test
    void shouldNestBoundedConstructsSequentially() {
        assertThat(compiler.compile("sum from i equals 1 to n of the integral from 0 to 1 of x dx"))
                .isEqualTo("\\sum_{i=1}^{n}\\int_{0}^{1}x\\, dx");
    }

    @Test
    void shouldApplyPartialBoundsWhenAnotherBoundedConstructOpens() {
        String latex = compiler.compile("integral from 0 sum");
        assertThat(latex).startsWith("\\int_{0}");
        assertThat(latex).containsOnlyOnce("\\sum");
    }

    @Test
    void shouldBuildIndependentFractions() {
        assertThat(compiler.compile("a over b plus c over d"))
                .isEqualTo("\\frac{a}{b} + \\frac{c}{d}");
    }

    @Test
    void shouldLeaveEmptyDenominatorForTrailingOver() {
        assertThat(compiler.compile("x over")).isEqualTo("\\frac{x}{}");
    }

    @Test
    void shouldUseGroupAsDenominator() {
        assertThat(compiler.compile("x over ( y plus 1 )")).isEqualTo("\\frac{x}{(y + 1)}");
    }

    @Test
    void shouldBraceExplicitPower() {
        assertThat(compiler.compile("x to the power of 3")).isEqualTo("x^{3}");
    }

    @Test
    void shouldTreatEToThePowerOfAsBaseAndExponent() {
        assertThat(compiler.compile("e to the power of x")).isEqualTo("e^{x}");
    }

    @Test
    void shouldBraceBaseThatAlreadyHasSuperscript() {
        assertThat(compiler.compile("e to the power of negative x squared")).isEqualTo("{e^{-x}}^2");
        assertThat(compiler.compile("x squared to the power of three")).isEqualTo("{x^2}^{3}");
        assertThat(compiler.compile("A transpose inverse")).isEqualTo("{A^T}^{-1}");
    }

    @Test
    void shouldRaiseFractionWithoutExtraBraces() {
        assertThat(compiler.compile("x squared over y cubed")).isEqualTo("\\frac{x^2}{y}^3");
    }

    @Test
    void shouldKeepConstructAsExponent() {
        assertThat(compiler.compile("e to the power of sine x")).isEqualTo("e^{\\sin x}");
        assertThat(compiler.compile("e to the power of negative sine x plus 1")).isEqualTo("e^{-\\sin x} + 1");
        assertThat(compiler.compile("x to the power of square root of 2")).isEqualTo("x^{\\sqrt{2}}");
    }

    @Test
    void shouldTreatMinusAfterInfixOperatorAsSign() {
        assertThat(compiler.compile("x minus negative y")).isEqualTo("x - -y");
        assertThat(compiler.compile("x equals negative 2")).isEqualTo("x = -2");
    }

    @Test
    void shouldKeepTrailingEToThePowerOfAsConstant() {
        assertThat(compiler.compile("e to the power of")).isEqualTo("e");
    }

    @Test
    void shouldCompileExponentialOfNegative() {
        assertThat(compiler.compile("exponential of negative x")).isEqualTo("\\exp(-x)");
    }

    @Test
    void shouldParenthesiseFunctionArgumentAfterOf() {
        assertThat(compiler.compile("natural log of x")).isEqualTo("\\ln(x)");
    }

    @Test
    void shouldSeparateControlWordFromGreekArgument() {
        assertThat(compiler.compile("cosine of theta")).isEqualTo("\\cos \\theta");
    }

    @Test
    void shouldApplyFunctionToParenthesisedGroup() {
        assertThat(compiler.compile("sine ( x plus 1 )")).isEqualTo("\\sin(x + 1)");
    }

    @Test
    void shouldSquareParenthesisedGroup() {
        assertThat(compiler.compile("( a plus b ) squared")).isEqualTo("(a + b)^2");
    }

    @Test
    void shouldRaiseFunctionBeforeArgument() {
        assertThat(compiler.compile("sine squared x")).isEqualTo("\\sin^2 x");
    }

    @Test
    void shouldCompileInnerProductWithTwoArguments() {
        assertThat(compiler.compile("inner product of u and v")).isEqualTo("\\langle u, v\\rangle");
    }

    @Test
    void shouldCompilePredicates() {
        assertThat(compiler.compile("x is positive")).isEqualTo("x > 0");
    }

    @Test
    void shouldCompileQuantifierWithComparison() {
        assertThat(compiler.compile("for all x greater than 0")).isEqualTo("\\forall x > 0");
    }

    @Test
    void shouldCompileArithmetic() {
        assertThat(compiler.compile("x squared plus y squared equals z squared"))
                .isEqualTo("x^2 + y^2 = z^2");
    }

    @Test
    void shouldPreferLongestComparisonPhrase() {
        assertThat(compiler.compile("x less than or equal to y")).isEqualTo("x \\leq y");
    }

    @Test
    void shouldCompileAbsoluteValue() {
        assertThat(compiler.compile("absolute value of x")).isEqualTo("\\left|x\\right|");
        assertThat(compiler.compile("absolute value x")).isEqualTo("\\left|x\\right|");
    }

    @Test
    void shouldCompileProbability() {
        assertThat(compiler.compile("probability of A")).isEqualTo("P(A)");
    }

    @Test
    void shouldCompileFactorialAndSetOperators() {
        assertThat(compiler.compile("n factorial")).isEqualTo("n!");
        assertThat(compiler.compile("A union B")).isEqualTo("A \\cup B");
        assertThat(compiler.compile("empty set")).isEqualTo("\\emptyset");
    }

    @ParameterizedTest
    @CsvSource({
            "infinity, \\infty",
            "∞, \\infty",
            "pi, \\pi",
            "π, \\pi"
    })
    void shouldMapSymbolsAndTheirSpokenNamesToSameLatex(String input, String expected) {
        assertThat(compiler.compile(input)).isEqualTo(expected);
    }

    @Test
    void shouldAttachPostfixOperatorsOrEmitThemAlone() {
        assertThat(compiler.compile("A transpose")).isEqualTo("A^T");
        assertThat(compiler.compile("B inverse")).isEqualTo("B^{-1}");
        assertThat(compiler.compile("transpose")).isEqualTo("^T");
    }

    @Test
    void shouldDropStrayClosingBracket() {
        assertThat(compiler.compile("x )")).isEqualTo("x");
    }

    @Test
    void shouldReturnEmptyForNullOrBlank() {
        assertThat(compiler.compile(null)).isEmpty();
        assertThat(compiler.compile("")).isEmpty();
        assertThat(compiler.compile("   ")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "square root of x",
            "x over",
            "fraction",
            "absolute value of x plus",
            "probability of",
            "the integral from 0 to",
            "vector v",
            "matrix",
            "inner product of u",
            "sum from i equals",
            "sine ( x",
            "open paren x over y",
            "sequence",
            "expected value of x",
            "magnitude of v",
            "exponential of negative",
            "x to the power of",
            "cube root",
            "( ( x",
            "over over over"
    })
    void shouldBalanceDelimitersOfUnfinishedInput(String input) {
        String latex = compiler.compile(input);

        assertThat(count(latex, "\\left")).isEqualTo(count(latex, "\\right"));
        String unescaped = latex.replace("\\{", "").replace("\\}", "");
        assertThat(count(unescaped, "{")).isEqualTo(count(unescaped, "}"));
        assertThat(count(latex, "(")).isEqualTo(count(latex, ")"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "to to from of",
            ") ] )",
            "squared",
            "dx",
            "with respect to x",
            "approaches",
            "as",
            "equals",
            "transpose",
            "and and",
            "minus minus",
            "of the",
            "limit approaches",
            "sum sum",
            "x to the power of to the power of 2",
            "derivative with respect to x squared",
            "square root over x",
            "banana split with sprinkles"
    })
    void shouldNeverThrowOnNonsense(String input) {
        assertThatCode(() -> compiler.compile(input)).doesNotThrowAnyException();
    }

    @Test
    void shouldNotCarryStateBetweenCalls() {
        compiler.compile("square root of");
        assertThat(compiler.compile("x plus y")).isEqualTo("x + y");
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            n++;
            from += needle.length();
        }
        return n;
    }
}
