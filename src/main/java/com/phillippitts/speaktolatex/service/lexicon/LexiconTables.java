package com.phillippitts.speaktolatex.service.lexicon;

import java.util.List;

import static com.phillippitts.speaktolatex.domain.TokenKind.ABSOLUTE;
import static com.phillippitts.speaktolatex.domain.TokenKind.AND;
import static com.phillippitts.speaktolatex.domain.TokenKind.ANGLE;
import static com.phillippitts.speaktolatex.domain.TokenKind.APPROACHES;
import static com.phillippitts.speaktolatex.domain.TokenKind.APPROXIMATELY;
import static com.phillippitts.speaktolatex.domain.TokenKind.AS;
import static com.phillippitts.speaktolatex.domain.TokenKind.BECAUSE;
import static com.phillippitts.speaktolatex.domain.TokenKind.BRACKET;
import static com.phillippitts.speaktolatex.domain.TokenKind.CONGRUENT;
import static com.phillippitts.speaktolatex.domain.TokenKind.CROSS_PRODUCT;
import static com.phillippitts.speaktolatex.domain.TokenKind.DERIVATIVE;
import static com.phillippitts.speaktolatex.domain.TokenKind.DETERMINANT;
import static com.phillippitts.speaktolatex.domain.TokenKind.DIFFERENTIAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.DOT_PRODUCT;
import static com.phillippitts.speaktolatex.domain.TokenKind.E;
import static com.phillippitts.speaktolatex.domain.TokenKind.ELEMENT;
import static com.phillippitts.speaktolatex.domain.TokenKind.EQUALS;
import static com.phillippitts.speaktolatex.domain.TokenKind.EXISTS;
import static com.phillippitts.speaktolatex.domain.TokenKind.EXPECTED_VALUE;
import static com.phillippitts.speaktolatex.domain.TokenKind.EXPONENTIAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.FACTORIAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.FOR_ALL;
import static com.phillippitts.speaktolatex.domain.TokenKind.FRACTION;
import static com.phillippitts.speaktolatex.domain.TokenKind.FROM;
import static com.phillippitts.speaktolatex.domain.TokenKind.GREATER_EQUAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.GREATER_THAN;
import static com.phillippitts.speaktolatex.domain.TokenKind.HYPERBOLIC;
import static com.phillippitts.speaktolatex.domain.TokenKind.IFF;
import static com.phillippitts.speaktolatex.domain.TokenKind.IMPLIES;
import static com.phillippitts.speaktolatex.domain.TokenKind.INFINITY;
import static com.phillippitts.speaktolatex.domain.TokenKind.INNER_PRODUCT;
import static com.phillippitts.speaktolatex.domain.TokenKind.INTEGRAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.INTERSECTION;
import static com.phillippitts.speaktolatex.domain.TokenKind.INVERSE;
import static com.phillippitts.speaktolatex.domain.TokenKind.INVERSE_TRIG;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_COMPLEX;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_EVEN;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_INTEGER;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_NATURAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_NEGATIVE;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_NONNEGATIVE;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_ODD;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_POSITIVE;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_PRIME;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_RATIONAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_REAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.IS_ZERO;
import static com.phillippitts.speaktolatex.domain.TokenKind.LESS_EQUAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.LESS_THAN;
import static com.phillippitts.speaktolatex.domain.TokenKind.LIMIT;
import static com.phillippitts.speaktolatex.domain.TokenKind.LOG;
import static com.phillippitts.speaktolatex.domain.TokenKind.MAGNITUDE;
import static com.phillippitts.speaktolatex.domain.TokenKind.MATRIX;
import static com.phillippitts.speaktolatex.domain.TokenKind.NORM;
import static com.phillippitts.speaktolatex.domain.TokenKind.NOT;
import static com.phillippitts.speaktolatex.domain.TokenKind.NOT_EQUAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.NUMBER;
import static com.phillippitts.speaktolatex.domain.TokenKind.OF;
import static com.phillippitts.speaktolatex.domain.TokenKind.OPERATOR;
import static com.phillippitts.speaktolatex.domain.TokenKind.OR;
import static com.phillippitts.speaktolatex.domain.TokenKind.PARALLEL;
import static com.phillippitts.speaktolatex.domain.TokenKind.PARTIAL;
import static com.phillippitts.speaktolatex.domain.TokenKind.PERPENDICULAR;
import static com.phillippitts.speaktolatex.domain.TokenKind.PI;
import static com.phillippitts.speaktolatex.domain.TokenKind.POWER;
import static com.phillippitts.speaktolatex.domain.TokenKind.PROBABILITY;
import static com.phillippitts.speaktolatex.domain.TokenKind.PRODUCT;
import static com.phillippitts.speaktolatex.domain.TokenKind.QED;
import static com.phillippitts.speaktolatex.domain.TokenKind.ROOT;
import static com.phillippitts.speaktolatex.domain.TokenKind.SEQUENCE;
import static com.phillippitts.speaktolatex.domain.TokenKind.SERIES;
import static com.phillippitts.speaktolatex.domain.TokenKind.SET;
import static com.phillippitts.speaktolatex.domain.TokenKind.SIMILAR;
import static com.phillippitts.speaktolatex.domain.TokenKind.STANDARD_DEVIATION;
import static com.phillippitts.speaktolatex.domain.TokenKind.SUBSET;
import static com.phillippitts.speaktolatex.domain.TokenKind.SUCH_THAT;
import static com.phillippitts.speaktolatex.domain.TokenKind.SUM;
import static com.phillippitts.speaktolatex.domain.TokenKind.THEREFORE;
import static com.phillippitts.speaktolatex.domain.TokenKind.TO;
import static com.phillippitts.speaktolatex.domain.TokenKind.TRANSPOSE;
import static com.phillippitts.speaktolatex.domain.TokenKind.TRIG;
import static com.phillippitts.speaktolatex.domain.TokenKind.UNION;
import static com.phillippitts.speaktolatex.domain.TokenKind.VARIABLE;
import static com.phillippitts.speaktolatex.domain.TokenKind.VARIANCE;
import static com.phillippitts.speaktolatex.domain.TokenKind.VECTOR;
import static com.phillippitts.speaktolatex.domain.TokenKind.WITH_RESPECT_TO;

/**
 * Built-in English vocabulary for spoken mathematics.
 *
 * <p>Surfaces that two categories share are registered once with their winning category's value
 * and added to the losing category as an alias, see {@link CategoryPriority#knownCollisions()}.
 */
final class LexiconTables {

    private static final List<String> UNITS = List.of(
            "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine",
            "ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen",
            "seventeen", "eighteen", "nineteen");

    private static final List<String> TENS = List.of(
            "twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety");

    private static final List<String> GREEK = List.of(
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "iota", "kappa",
            "lambda", "mu", "nu", "xi", "rho", "sigma", "tau", "upsilon", "phi", "chi", "psi", "omega");

    private static final List<String> CAPITAL_GREEK = List.of(
            "Gamma", "Delta", "Theta", "Lambda", "Xi", "Sigma", "Upsilon", "Phi", "Psi", "Omega");

    private static final List<String> ORDINAL_POWERS = List.of(
            "second", "2", "third", "3", "fourth", "4", "fifth", "5", "sixth", "6",
            "seventh", "7", "eighth", "8", "ninth", "9", "tenth", "{10}", "nth", "n");

    private LexiconTables() {
    }

    static Lexicon.Builder populate(Lexicon.Builder b) {
        numbers(b);
        constantsAndVariables(b);
        calculus(b);
        algebra(b);
        functions(b);
        linearAlgebra(b);
        setsAndLogic(b);
        comparisonsAndGeometry(b);
        statistics(b);
        predicates(b);
        structural(b);
        return b;
    }

    private static void numbers(Lexicon.Builder b) {
        for (int i = 0; i < UNITS.size(); i++) {
            b.phrases(NUMBER, String.valueOf(i), UNITS.get(i));
        }
        for (int t = 0; t < TENS.size(); t++) {
            int base = (t + 2) * 10;
            String tens = TENS.get(t);
            b.phrases(NUMBER, String.valueOf(base), tens);
            for (int u = 1; u <= 9; u++) {
                String unit = UNITS.get(u);
                b.phrases(NUMBER, String.valueOf(base + u), tens + " " + unit, tens + "-" + unit);
            }
        }
        b.phrases(NUMBER, "100", "hundred", "one hundred", "a hundred")
                .phrases(NUMBER, "1000", "thousand", "one thousand")
                .phrases(NUMBER, "1000000", "million", "one million")
                .phrases(NUMBER, "1000000000", "billion", "one billion")
                .regex(NUMBER, "\\d+(?:\\.\\d+)?");
    }

    private static void constantsAndVariables(Lexicon.Builder b) {
        b.phrases(INFINITY, "\\infty", "infinity", "inf", "∞")
                .phrases(PI, "\\pi", "pi", "π")
                .phrases(E, "e", "e", "euler", "euler's number");

        for (String letter : GREEK) {
            if (!"sigma".equals(letter)) {
                b.phrases(VARIABLE, "\\" + letter, letter);
            }
        }
        b.phrases(VARIABLE, "\\sigma", "sigma")
                .aliases(VARIABLE, "pi")
                .regex(VARIABLE, "[a-z]");
        for (String letter : CAPITAL_GREEK) {
            b.canonical(letter, "\\" + letter);
        }
    }

    private static void calculus(Lexicon.Builder b) {
        b.phrases(INTEGRAL, "\\int", "integral", "integrate", "integration", "int")
                .phrases(INTEGRAL, "\\iint", "double integral")
                .phrases(INTEGRAL, "\\iiint", "triple integral")
                .phrases(DERIVATIVE, "\\frac{d}{dx}", "derivative", "differentiate", "diff",
                        "first derivative", "d/dx")
                .phrases(DERIVATIVE, "\\frac{d^2}{dx^2}", "second derivative")
                .phrases(DERIVATIVE, "\\frac{d^3}{dx^3}", "third derivative")
                .phrases(DERIVATIVE, "\\frac{d^n}{dx^n}", "nth derivative")
                .phrases(DERIVATIVE, "\\frac{dy}{dx}", "dy/dx")
                .phrases(PARTIAL, "\\frac{\\partial}{\\partial x}", "partial derivative", "partial", "∂")
                .phrases(LIMIT, "\\lim", "limit", "lim")
                .phrases(SUM, "\\sum", "sum", "summation", "infinite sum", "∑")
                .aliases(SUM, "sigma")
                .phrases(PRODUCT, "\\prod", "product", "infinite product", "∏")
                .aliases(PRODUCT, "multiplication")
                .phrases(SERIES, "\\sum", "series", "power series")
                .phrases(SERIES, "\\sum_{n=0}^{\\infty}", "taylor series", "maclaurin series")
                .phrases(SERIES, "\\sum_{n=-\\infty}^{\\infty}", "fourier series")
                .phrases(SEQUENCE, "\\left\\{", "sequence", "arithmetic sequence", "geometric sequence");
    }

    private static void algebra(Lexicon.Builder b) {
        b.phrases(FRACTION, "\\frac", "over", "divided by", "fraction", "ratio", "/")
                .phrases(OPERATOR, "+", "plus", "add", "addition", "+")
                .phrases(OPERATOR, "-", "minus", "subtract", "subtraction", "negative", "-")
                .phrases(OPERATOR, "\\cdot", "times", "multiply", "multiplication", "multiplied by", "*")
                .phrases(OPERATOR, "\\times", "×")
                .phrases(OPERATOR, "\\div", "division", "÷")
                .phrases(OPERATOR, "\\pm", "plus or minus", "±")
                .aliases(OPERATOR, "divided by")
                .phrases(POWER, "^", "power", "exponent", "to the power of", "to the power",
                        "raised to", "raised to the", "raised to the power of", "^")
                .phrases(POWER, "^2", "squared")
                .phrases(POWER, "^3", "cubed");
        for (int i = 0; i < ORDINAL_POWERS.size(); i += 2) {
            b.phrases(POWER, "^" + ORDINAL_POWERS.get(i + 1), "to the " + ORDINAL_POWERS.get(i) + " power");
        }
        b.phrases(ROOT, "\\sqrt", "square root", "root", "sqrt", "radical", "√")
                .phrases(ROOT, "\\sqrt[3]", "cube root", "∛")
                .phrases(ROOT, "\\sqrt[4]", "fourth root")
                .phrases(ROOT, "\\sqrt[n]", "nth root")
                .phrases(FACTORIAL, "!", "factorial", "!")
                .phrases(ABSOLUTE, "\\left|", "absolute value", "absolute", "abs", "modulus");
    }

    private static void functions(Lexicon.Builder b) {
        b.phrases(TRIG, "\\sin", "sin", "sine")
                .phrases(TRIG, "\\cos", "cos", "cosine")
                .phrases(TRIG, "\\tan", "tan", "tangent")
                .phrases(TRIG, "\\sec", "sec", "secant")
                .phrases(TRIG, "\\csc", "csc", "cosecant")
                .phrases(TRIG, "\\cot", "cot", "cotangent")
                .phrases(INVERSE_TRIG, "\\arcsin", "arcsin", "asin", "arc sine", "inverse sine")
                .phrases(INVERSE_TRIG, "\\arccos", "arccos", "acos", "arc cosine", "inverse cosine")
                .phrases(INVERSE_TRIG, "\\arctan", "arctan", "atan", "arc tangent", "inverse tangent")
                .phrases(INVERSE_TRIG, "\\operatorname{arcsec}", "arcsec", "asec", "inverse secant")
                .phrases(INVERSE_TRIG, "\\operatorname{arccsc}", "arccsc", "acsc", "inverse cosecant")
                .phrases(INVERSE_TRIG, "\\operatorname{arccot}", "arccot", "acot", "inverse cotangent")
                .phrases(HYPERBOLIC, "\\sinh", "sinh", "hyperbolic sine")
                .phrases(HYPERBOLIC, "\\cosh", "cosh", "hyperbolic cosine")
                .phrases(HYPERBOLIC, "\\tanh", "tanh", "hyperbolic tangent")
                .phrases(HYPERBOLIC, "\\operatorname{sech}", "sech", "hyperbolic secant")
                .phrases(HYPERBOLIC, "\\operatorname{csch}", "csch", "hyperbolic cosecant")
                .phrases(HYPERBOLIC, "\\coth", "coth", "hyperbolic cotangent")
                .phrases(LOG, "\\ln", "ln", "natural log", "natural logarithm")
                .phrases(LOG, "\\log", "log", "logarithm", "common log")
                .phrases(LOG, "\\log_2", "binary log")
                .phrases(EXPONENTIAL, "\\exp", "exp", "exponential", "exponential of", "e to the power");
    }

    private static void linearAlgebra(Lexicon.Builder b) {
        b.phrases(MATRIX, "\\begin{pmatrix}", "matrix", "matrices")
                .phrases(VECTOR, "\\vec", "vector", "vectors")
                .phrases(DETERMINANT, "\\det", "determinant", "det")
                .phrases(TRANSPOSE, "^T", "transpose", "transposed")
                .phrases(INVERSE, "^{-1}", "inverse", "inverted")
                .phrases(DOT_PRODUCT, "\\cdot", "dot product", "dot", "·")
                .phrases(CROSS_PRODUCT, "\\times", "cross product", "cross")
                .phrases(INNER_PRODUCT, "\\langle", "inner product")
                .phrases(MAGNITUDE, "\\|", "magnitude")
                .phrases(NORM, "\\|", "norm");
    }

    private static void setsAndLogic(Lexicon.Builder b) {
        b.phrases(SET, "", "set", "sets")
                .phrases(SET, "\\emptyset", "empty set", "null set", "∅")
                .aliases(SET, "subset")
                .phrases(SUBSET, "\\subset", "subset", "subset of", "proper subset of", "⊂")
                .phrases(SUBSET, "\\subseteq", "⊆")
                .phrases(SUBSET, "\\supset", "superset", "superset of", "⊃")
                .phrases(UNION, "\\cup", "union", "∪")
                .phrases(INTERSECTION, "\\cap", "intersection", "intersect", "∩")
                .phrases(ELEMENT, "\\in", "in", "element of", "is an element of", "is in", "belongs to", "∈")
                .phrases(ELEMENT, "\\notin", "not in", "not an element of", "is not in", "∉")
                .phrases(AND, "\\land", "and", "logical and", "∧")
                .phrases(OR, "\\lor", "or", "logical or", "∨")
                .phrases(NOT, "\\neg", "not", "logical not", "¬")
                .phrases(IMPLIES, "\\rightarrow", "implies", "implies that", "→")
                .phrases(IFF, "\\leftrightarrow", "if and only if", "iff", "↔")
                .phrases(THEREFORE, "\\therefore", "therefore", "thus", "hence", "∴")
                .phrases(BECAUSE, "\\because", "because", "since", "∵")
                .phrases(QED, "\\blacksquare", "qed", "q.e.d.", "end of proof", "∎");
    }

    private static void comparisonsAndGeometry(Lexicon.Builder b) {
        b.phrases(LESS_THAN, "<", "less than", "is less than", "<")
                .phrases(GREATER_THAN, ">", "greater than", "is greater than", ">")
                .phrases(LESS_EQUAL, "\\leq", "less than or equal to", "less than or equal",
                        "at most", "≤", "<=")
                .phrases(GREATER_EQUAL, "\\geq", "greater than or equal to", "greater than or equal",
                        "at least", "≥", ">=")
                .phrases(NOT_EQUAL, "\\neq", "not equal to", "not equal", "does not equal",
                        "is not equal to", "≠", "!=")
                .phrases(APPROXIMATELY, "\\approx", "approximately", "approximately equal to",
                        "approximately equals", "roughly", "≈", "~")
                .phrases(ANGLE, "\\angle", "angle", "∠")
                .phrases(PARALLEL, "\\parallel", "parallel", "parallel to", "is parallel to", "∥")
                .phrases(PERPENDICULAR, "\\perp", "perpendicular", "perpendicular to",
                        "is perpendicular to", "⊥")
                .phrases(CONGRUENT, "\\cong", "congruent", "congruent to", "is congruent to", "≅")
                .phrases(SIMILAR, "\\sim", "similar", "similar to", "is similar to", "∼");
    }

    private static void statistics(Lexicon.Builder b) {
        b.phrases(PROBABILITY, "P", "probability")
                .phrases(EXPECTED_VALUE, "E", "expected value", "expectation")
                .phrases(VARIANCE, "\\mathrm{Var}", "variance", "var")
                .phrases(STANDARD_DEVIATION, "\\sigma", "standard deviation", "std dev", "σ");
    }

    private static void predicates(Lexicon.Builder b) {
        b.phrases(IS_POSITIVE, "> 0", "is positive", "is a positive number", "is strictly positive")
                .phrases(IS_NEGATIVE, "< 0", "is negative", "is a negative number")
                .phrases(IS_NONNEGATIVE, "\\geq 0", "is nonnegative", "is non-negative", "is non negative")
                .phrases(IS_ZERO, "= 0", "is zero")
                .phrases(IS_EVEN, "\\in 2\\mathbb{Z}", "is even", "is an even number")
                .phrases(IS_ODD, "\\in 2\\mathbb{Z}+1", "is odd", "is an odd number")
                .phrases(IS_PRIME, "\\in \\mathbb{P}", "is prime", "is a prime", "is a prime number")
                .phrases(IS_INTEGER, "\\in \\mathbb{Z}", "is an integer", "is integer")
                .phrases(IS_NATURAL, "\\in \\mathbb{N}", "is a natural number", "is natural")
                .phrases(IS_RATIONAL, "\\in \\mathbb{Q}", "is rational", "is a rational number")
                .phrases(IS_REAL, "\\in \\mathbb{R}", "is real", "is a real number")
                .phrases(IS_COMPLEX, "\\in \\mathbb{C}", "is complex", "is a complex number");
    }

    private static void structural(Lexicon.Builder b) {
        b.phrases(FROM, "from", "from")
                .phrases(TO, "to", "to")
                .phrases(OF, "of", "of")
                .phrases(AS, "as", "as")
                .phrases(EQUALS, "=", "equals", "equal", "equal to", "is equal to", "=")
                .phrases(APPROACHES, "\\to", "approaches", "approaching", "tends to", "goes to")
                .phrases(WITH_RESPECT_TO, "with respect to", "with respect to", "wrt")
                .phrases(SUCH_THAT, ":", "such that", "so that", "where", ":")
                .phrases(FOR_ALL, "\\forall", "for all", "for every", "for each", "∀")
                .phrases(EXISTS, "\\exists", "there exists", "there exist", "there is", "exists", "∃")
                .phrases(DIFFERENTIAL, "d\\theta", "d theta", "dθ")
                .phrases(DIFFERENTIAL, "d\\phi", "d phi", "dφ")
                .regex(DIFFERENTIAL, "d[a-z]")
                .regex(DIFFERENTIAL, "∂[a-z]")
                .phrases(BRACKET, "(", "(", "open paren", "open parenthesis", "left parenthesis")
                .phrases(BRACKET, ")", ")", "close paren", "close parenthesis", "right parenthesis")
                .phrases(BRACKET, "[", "[", "open bracket", "left bracket")
                .phrases(BRACKET, "]", "]", "close bracket", "right bracket")
                .phrases(BRACKET, "\\{", "{", "open brace")
                .phrases(BRACKET, "\\}", "}", "close brace");
    }
}
