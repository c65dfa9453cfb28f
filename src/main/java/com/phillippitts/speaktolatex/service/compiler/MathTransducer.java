package com.phillippitts.speaktolatex.service.compiler;

import com.phillippitts.speaktolatex.domain.Token;
import com.phillippitts.speaktolatex.domain.TokenKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Single-pass state machine that turns a token stream into LaTeX fragments.
 *
 * <p>State is a {@link Mode}, a stack of open {@link ConstructContext}s, the pending
 * {@link BoundsAccumulator} and the {@link OutputBuffer}. Every token kind maps to exactly one
 * handler through an exhaustive switch. Operands are routed by mode: into bounds, into an
 * exponent, into a denominator, into the argument of the innermost construct, or straight into
 * the output.
 *
 * <p>One instance compiles one input. Not thread-safe.
 */
public final class MathTransducer {

    private static final Logger LOG = LogManager.getLogger(MathTransducer.class);

    private static final Set<String> PARENTHESIZED_FUNCTIONS = Set.of("\\exp", "\\ln", "\\log");

    @FunctionalInterface
    private interface TokenHandler {
        void handle(Token token);
    }

    private final Set<String> fillerWords;
    private final OutputBuffer buffer = new OutputBuffer();
    private final Deque<ConstructContext> contexts = new ArrayDeque<>();
    private final BoundsAccumulator bounds = new BoundsAccumulator();
    private final ConstructFinalizer finalizer = new ConstructFinalizer();

    private Mode mode = Mode.INITIAL;
    private Mode modeBeforePower = Mode.INITIAL;
    private String pendingSign = "";
    private ConstructContext respectTarget;
    private boolean finished;

    /**
     * @param fillerWords unknown words dropped silently, compared case-insensitively
     */
    public MathTransducer(Set<String> fillerWords) {
        Set<String> normalized = new HashSet<>();
        for (String word : fillerWords) {
            normalized.add(word.strip().toLowerCase(Locale.ROOT));
        }
        this.fillerWords = Set.copyOf(normalized);
    }

    /**
     * Feeds one token.
     *
     * @throws IllegalStateException if {@link #finish()} was already called
     */
    public void accept(Token token) {
        if (finished) {
            throw new IllegalStateException("Transducer already finished");
        }
        if (mode == Mode.EXPECTING_BOUNDS && !takesPartInBounds(token)) {
            abandonBounds();
        }
        handlerFor(token.kind()).handle(token);
        LOG.trace("{} '{}' -> mode {}, {} open", token.kind(), token.original(), mode, contexts.size());
    }

    /**
     * Closes every open construct and returns the finished output. Idempotent.
     */
    public OutputBuffer finish() {
        if (!finished) {
            if (!pendingSign.isEmpty()) {
                buffer.append(pendingSign);
                pendingSign = "";
            }
            finalizer.closeAll(contexts, buffer, bounds);
            bounds.clear();
            respectTarget = null;
            mode = Mode.COMPLETE;
            finished = true;
        }
        return buffer;
    }

    public Mode mode() {
        return mode;
    }

    public int openConstructs() {
        return contexts.size();
    }

    public OutputBuffer output() {
        return buffer;
    }

    private TokenHandler handlerFor(TokenKind kind) {
        return switch (kind) {
            case NUMBER, VARIABLE, INFINITY, PI, E -> this::onOperand;
            case OPERATOR -> this::onOperator;
            case BRACKET -> this::onBracket;
            case FROM -> this::onFrom;
            case TO -> this::onTo;
            case OF -> this::onOf;
            case EQUALS -> this::onEquals;
            case APPROACHES -> this::onApproaches;
            case AS -> this::onAs;
            case DIFFERENTIAL -> this::onDifferential;
            case WITH_RESPECT_TO -> this::onWithRespectTo;
            case INTEGRAL -> t -> openBounded(ConstructKind.INTEGRAL, t.value(), Mode.INITIAL);
            case LIMIT -> t -> openBounded(ConstructKind.LIMIT, "\\lim", Mode.INITIAL);
            case SUM -> t -> openBounded(ConstructKind.SUM, "\\sum", Mode.EXPECTING_BOUNDS);
            case PRODUCT -> t -> openBounded(ConstructKind.PRODUCT, "\\prod", Mode.EXPECTING_BOUNDS);
            case DERIVATIVE -> t -> open(ConstructKind.DERIVATIVE, t.value(), Mode.EXPECTING_FUNCTION);
            case PARTIAL -> t -> open(ConstructKind.PARTIAL, t.value(), Mode.EXPECTING_FUNCTION);
            case SERIES -> t -> buffer.append(t.value());
            case SEQUENCE -> t -> open(ConstructKind.SEQUENCE, "\\left\\{", Mode.EXPECTING_ARGUMENT);
            case FRACTION -> this::onFraction;
            case POWER -> this::onPower;
            case ROOT -> this::onRoot;
            case FACTORIAL -> t -> appendPostfix("!");
            case TRANSPOSE -> t -> appendPostfix("^T");
            case INVERSE -> t -> appendPostfix("^{-1}");
            case ABSOLUTE -> t -> open(ConstructKind.ABSOLUTE, "\\left|", Mode.EXPECTING_ARGUMENT);
            case TRIG, INVERSE_TRIG, HYPERBOLIC, LOG, EXPONENTIAL, DETERMINANT ->
                    t -> open(ConstructKind.FUNCTION, t.value(), Mode.EXPECTING_ARGUMENT);
            case MATRIX -> t -> open(ConstructKind.MATRIX, "\\begin{pmatrix}", Mode.INITIAL);
            case VECTOR -> t -> open(ConstructKind.VECTOR, "\\vec{", Mode.EXPECTING_ARGUMENT);
            case MAGNITUDE, NORM -> t -> open(ConstructKind.MAGNITUDE, "\\|", Mode.EXPECTING_ARGUMENT);
            case INNER_PRODUCT -> t -> open(ConstructKind.INNER_PRODUCT, "\\langle ", Mode.EXPECTING_ARGUMENT);
            case PROBABILITY -> t -> open(ConstructKind.PROBABILITY, "P(", Mode.EXPECTING_ARGUMENT);
            case EXPECTED_VALUE -> t -> open(ConstructKind.EXPECTED_VALUE, "E[", Mode.EXPECTING_ARGUMENT);
            case VARIANCE -> t -> open(ConstructKind.FUNCTION_WITH_PARENS, "\\mathrm{Var}(", Mode.EXPECTING_ARGUMENT);
            case STANDARD_DEVIATION -> t -> acceptOperand("\\sigma", false);
            case SET -> this::onSet;
            case AND -> this::onAnd;
            case DOT_PRODUCT, CROSS_PRODUCT, SUBSET, UNION, INTERSECTION, ELEMENT, OR, IMPLIES, IFF,
                    LESS_THAN, GREATER_THAN, LESS_EQUAL, GREATER_EQUAL, NOT_EQUAL, APPROXIMATELY,
                    PARALLEL, PERPENDICULAR, CONGRUENT, SIMILAR, SUCH_THAT -> this::appendInfix;
            case NOT, FOR_ALL, EXISTS, ANGLE, THEREFORE, BECAUSE -> this::appendPrefix;
            case QED, IS_POSITIVE, IS_NEGATIVE, IS_NONNEGATIVE, IS_ZERO, IS_EVEN, IS_ODD, IS_PRIME,
                    IS_INTEGER, IS_NATURAL, IS_RATIONAL, IS_REAL, IS_COMPLEX -> this::appendTrailing;
            case UNKNOWN -> this::onUnknown;
        };
    }

    // ---- operands -------------------------------------------------------------------------

    private void onOperand(Token token) {
        String value = pendingSign + token.value();
        pendingSign = "";
        if (respectTarget != null && token.kind() == TokenKind.VARIABLE) {
            rewriteDerivativeVariable(value);
            return;
        }
        acceptOperand(value, true);
    }

    private void acceptOperand(String value, boolean boundEligible) {
        switch (mode) {
            case EXPECTING_BOUNDS -> {
                if (boundEligible && bounds.offer(value)) {
                    if (bounds.isComplete()) {
                        applyBounds();
                    }
                    return;
                }
                abandonBounds();
                appendBodyOperand(value);
            }
            case EXPECTING_POWER -> {
                String base = buffer.isEmpty() ? "" : buffer.removeLast();
                buffer.append(superscriptBase(base) + "^{" + value + "}");
                mode = modeBeforePower;
            }
            case EXPECTING_DENOMINATOR, EXPECTING_ARGUMENT -> closeInnermost(value);
            case INITIAL, EXPECTING_INTEGRAND, EXPECTING_DIFFERENTIAL, EXPECTING_FUNCTION, COMPLETE ->
                    appendBodyOperand(value);
        }
    }

    private void appendBodyOperand(String value) {
        buffer.appendOperand(value);
        ConstructContext top = contexts.peek();
        if (mode == Mode.EXPECTING_INTEGRAND && top != null && top.kind() == ConstructKind.INTEGRAL) {
            mode = Mode.EXPECTING_DIFFERENTIAL;
        }
    }

    /**
     * Closes the innermost single-argument construct with {@code value} as its argument and
     * collapses its fragments into one.
     */
    private void closeInnermost(String value) {
        ConstructContext top = contexts.peek();
        if (top == null) {
            buffer.appendOperand(value);
            mode = Mode.INITIAL;
            return;
        }
        if (top.kind() == ConstructKind.INNER_PRODUCT && top.argumentsReceived() == 0) {
            buffer.append(value + ", ");
            top.receiveArgument();
            return;
        }
        Optional<String> closed = argumentText(top, value);
        if (closed.isEmpty()) {
            appendBodyOperand(value);
            mode = Mode.INITIAL;
            return;
        }
        buffer.append(closed.get());
        buffer.collapseFrom(top.anchor());
        contexts.pop();
        mode = Mode.INITIAL;
        closeFinishedExponents();
    }

    private Optional<String> argumentText(ConstructContext context, String value) {
        return switch (context.kind()) {
            case FRACTION, SQRT, NROOT, VECTOR -> Optional.of(value + "}");
            case FUNCTION -> Optional.of(PARENTHESIZED_FUNCTIONS.contains(buffer.get(context.anchor()))
                    ? "(" + value + ")"
                    : " " + value);
            case FUNCTION_WITH_PARENS, PROBABILITY -> Optional.of(value + ")");
            case MAGNITUDE -> Optional.of(value + "\\|");
            case ABSOLUTE -> Optional.of(value + "\\right|");
            case EXPECTED_VALUE -> Optional.of(value + "]");
            case SEQUENCE -> Optional.of(value + "\\right\\}");
            case INNER_PRODUCT -> Optional.of(value + "\\rangle");
            case INTEGRAL, DERIVATIVE, PARTIAL, LIMIT, SUM, PRODUCT, MATRIX, GROUP, SQUARE_GROUP, EXPONENT ->
                    Optional.empty();
        };
    }

    private void onOperator(Token token) {
        String value = token.value();
        if ("-".equals(value) && (expectsOperand() || followsInfixOperator())) {
            pendingSign = pendingSign.isEmpty() ? "-" : "";
            return;
        }
        buffer.append(" " + value + " ");
    }

    private boolean expectsOperand() {
        if (buffer.isEmpty()) {
            return true;
        }
        String last = buffer.lastOrEmpty();
        if (last.endsWith("(") || last.endsWith("[") || last.endsWith("{")) {
            return true;
        }
        return mode == Mode.EXPECTING_BOUNDS || mode == Mode.EXPECTING_POWER
                || mode == Mode.EXPECTING_DENOMINATOR || mode == Mode.EXPECTING_ARGUMENT;
    }

    /** A fragment like {@code " + "} or {@code " = "}; unknown words are excluded. */
    private boolean followsInfixOperator() {
        String last = buffer.lastOrEmpty();
        if (!last.endsWith(" ") || last.isBlank()) {
            return false;
        }
        return !last.strip().chars().allMatch(Character::isLetter);
    }

    // ---- bounds ---------------------------------------------------------------------------

    private boolean takesPartInBounds(Token token) {
        if (token.kind().isOperand()) {
            return true;
        }
        return switch (token.kind()) {
            case FROM, TO, AS, APPROACHES, OF -> true;
            case EQUALS -> topIs(k -> k == ConstructKind.SUM || k == ConstructKind.PRODUCT);
            case OPERATOR -> "-".equals(token.value());
            case UNKNOWN -> isFiller(token);
            default -> false;
        };
    }

    private void applyBounds() {
        bounds.applyTo(buffer);
        mode = Mode.EXPECTING_INTEGRAND;
    }

    /**
     * Leaves bounds collection early: whatever limits were collected are written, a lone index
     * variable is emitted as an ordinary operand.
     */
    private void abandonBounds() {
        if (bounds.hasLimits()) {
            bounds.applyTo(buffer);
        } else if (bounds.isPending()) {
            String variable = bounds.variable();
            bounds.clear();
            buffer.appendOperand(variable);
        } else {
            bounds.clear();
        }
        mode = Mode.EXPECTING_INTEGRAND;
    }

    private void onFrom(Token token) {
        ConstructContext top = contexts.peek();
        if (top != null && top.kind() == ConstructKind.INTEGRAL && !top.boundsApplied()) {
            if (!bounds.isOwnedBy(top)) {
                bounds.reset(top);
            }
            bounds.markLowerReady();
            mode = Mode.EXPECTING_BOUNDS;
        }
    }

    private void onTo(Token token) {
        if (mode != Mode.EXPECTING_BOUNDS) {
            return;
        }
        if (topIs(k -> k == ConstructKind.LIMIT)) {
            bounds.markApproaching();
        } else {
            bounds.markUpperReady();
        }
    }

    private void onEquals(Token token) {
        if (mode == Mode.EXPECTING_BOUNDS) {
            bounds.markEqualsReady();
            return;
        }
        buffer.append(" = ");
    }

    private void onAs(Token token) {
        ConstructContext top = contexts.peek();
        if (top != null && top.kind() == ConstructKind.LIMIT && !top.boundsApplied()) {
            bounds.reset(top);
            mode = Mode.EXPECTING_BOUNDS;
        }
    }

    private void onApproaches(Token token) {
        ConstructContext top = contexts.peek();
        if (top == null || top.kind() != ConstructKind.LIMIT || top.boundsApplied()) {
            buffer.append(" " + token.value() + " ");
            return;
        }
        if (!bounds.isOwnedBy(top)) {
            bounds.reset(top);
        }
        if (bounds.variable() == null && buffer.lastIndex() > top.anchor()) {
            bounds.setVariable(buffer.removeLast().strip());
        }
        bounds.markApproaching();
        mode = Mode.EXPECTING_BOUNDS;
    }

    private void onOf(Token token) {
        ConstructContext top = contexts.peek();
        if (top == null) {
            return;
        }
        if (top.kind().isBounded() && bounds.isOwnedBy(top)) {
            bounds.applyTo(buffer);
        }
        if (top.kind().takesBodyAfterOf()) {
            mode = Mode.EXPECTING_INTEGRAND;
        }
    }

    // ---- constructs -----------------------------------------------------------------------

    private ConstructContext open(ConstructKind kind, String fragment, Mode nextMode) {
        if (mode == Mode.EXPECTING_POWER) {
            openExponent();
        }
        if (!pendingSign.isEmpty()) {
            buffer.append(pendingSign);
            pendingSign = "";
        }
        ConstructContext context = new ConstructContext(kind, buffer.append(fragment));
        contexts.push(context);
        mode = nextMode;
        return context;
    }

    private void openBounded(ConstructKind kind, String fragment, Mode nextMode) {
        // one accumulator: bounds still pending from an outer construct are written now
        if (bounds.isPending()) {
            bounds.applyTo(buffer);
        }
        bounds.reset(open(kind, fragment, nextMode));
    }

    private void onFraction(Token token) {
        String numerator = "";
        ConstructContext top = contexts.peek();
        if (!buffer.isEmpty() && (top == null || buffer.lastIndex() != top.anchor())) {
            numerator = buffer.removeLast().strip();
        }
        open(ConstructKind.FRACTION, "\\frac{" + numerator + "}{", Mode.EXPECTING_DENOMINATOR);
    }

    private void onPower(Token token) {
        if ("^".equals(token.value())) {
            if (mode != Mode.EXPECTING_POWER) {
                modeBeforePower = mode;
            }
            mode = Mode.EXPECTING_POWER;
            return;
        }
        appendPostfix(token.value());
    }

    /**
     * Starts a braced exponent on the last fragment when the exponent is a construct rather
     * than a single operand. It is closed as soon as that construct closes.
     */
    private void openExponent() {
        String base = buffer.isEmpty() ? "" : buffer.removeLast();
        int anchor = buffer.append(superscriptBase(base) + "^{");
        contexts.push(new ConstructContext(ConstructKind.EXPONENT, anchor, modeBeforePower));
    }

    private void closeFinishedExponents() {
        while (topIs(k -> k == ConstructKind.EXPONENT)) {
            ConstructContext exponent = contexts.pop();
            finalizer.close(exponent, buffer);
            buffer.collapseFrom(exponent.anchor());
            mode = exponent.resumeMode();
        }
    }

    private void onRoot(Token token) {
        ConstructKind kind = "\\sqrt".equals(token.value()) ? ConstructKind.SQRT : ConstructKind.NROOT;
        open(kind, token.value() + "{", Mode.EXPECTING_ARGUMENT);
    }

    private void appendPostfix(String suffix) {
        if (buffer.isEmpty()) {
            buffer.append(suffix);
        } else if (suffix.startsWith("^")) {
            buffer.append(superscriptBase(buffer.removeLast()) + suffix);
        } else {
            buffer.appendToLast(suffix);
        }
    }

    /** Braces a base that already ends in a superscript, {@code x^2} becomes {@code {x^2}}. */
    static String superscriptBase(String base) {
        if (!endsWithSuperscript(base)) {
            return base;
        }
        String body = base.stripLeading();
        return base.substring(0, base.length() - body.length()) + "{" + body + "}";
    }

    static boolean endsWithSuperscript(String text) {
        int end = text.length() - 1;
        if (end < 1 || text.endsWith("\\}")) {
            return false;
        }
        if (text.charAt(end) != '}') {
            return text.charAt(end - 1) == '^';
        }
        int depth = 0;
        for (int i = end; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '}') {
                depth++;
            } else if (c == '{' && --depth == 0) {
                return i > 0 && text.charAt(i - 1) == '^';
            }
        }
        return false;
    }

    private void onDifferential(Token token) {
        String value = token.value();
        if (value.startsWith("∂")) {
            value = "\\partial " + value.substring(1);
        }
        ConstructContext integral = nearest(k -> k == ConstructKind.INTEGRAL);
        if (integral != null) {
            while (contexts.peek() != integral) {
                popAndClose();
            }
            if (bounds.isOwnedBy(integral)) {
                bounds.applyTo(buffer);
            }
            contexts.pop();
        }
        buffer.append("\\, " + value);
        mode = Mode.COMPLETE;
    }

    private void onWithRespectTo(Token token) {
        respectTarget = nearest(ConstructKind::isDerivative);
    }

    private void rewriteDerivativeVariable(String variable) {
        ConstructContext target = respectTarget;
        respectTarget = null;
        if (!contexts.contains(target)) {
            acceptOperand(variable, true);
            return;
        }
        String fragment = buffer.get(target.anchor());
        String rewritten = target.kind() == ConstructKind.PARTIAL
                ? fragment.replace("\\partial x}", "\\partial " + variable + "}")
                : fragment.replace("{dx", "{d" + variable);
        buffer.set(target.anchor(), rewritten);
    }

    private void onBracket(Token token) {
        switch (token.value()) {
            case "(" -> openParenthesis();
            case "[" -> openGroup(ConstructKind.SQUARE_GROUP, "[");
            case ")" -> closeGroup(ConstructKind.GROUP, ")");
            case "]" -> closeGroup(ConstructKind.SQUARE_GROUP, "]");
            default -> buffer.append(token.value());
        }
    }

    private void openParenthesis() {
        ConstructContext top = contexts.peek();
        if (top != null && top.kind() == ConstructKind.FUNCTION && mode == Mode.EXPECTING_ARGUMENT) {
            // the parenthesised group becomes the function's argument
            contexts.pop();
            mode = Mode.INITIAL;
        }
        openGroup(ConstructKind.GROUP, "(");
    }

    private void openGroup(ConstructKind kind, String opening) {
        ConstructContext group = new ConstructContext(kind, buffer.append(opening), mode);
        contexts.push(group);
        mode = Mode.INITIAL;
    }

    /**
     * Closes the nearest group of the given kind, closing anything opened inside it first, and
     * feeds the whole group back as a single operand. A closer with no matching group is dropped.
     */
    private void closeGroup(ConstructKind kind, String closing) {
        ConstructContext group = nearest(k -> k == kind);
        if (group == null) {
            LOG.debug("Dropping unmatched '{}'", closing);
            return;
        }
        while (contexts.peek() != group) {
            popAndClose();
        }
        contexts.pop();
        if (!pendingSign.isEmpty()) {
            buffer.append(pendingSign);
            pendingSign = "";
        }
        buffer.append(closing);
        buffer.collapseFrom(group.anchor());
        String text = buffer.removeLast();
        mode = group.resumeMode();
        acceptOperand(text, false);
        closeFinishedExponents();
    }

    private void popAndClose() {
        ConstructContext context = contexts.pop();
        if (context.kind().isBounded() && bounds.isOwnedBy(context)) {
            bounds.applyTo(buffer);
        }
        finalizer.close(context, buffer);
    }

    // ---- symbols --------------------------------------------------------------------------

    private void onSet(Token token) {
        if (!token.value().isEmpty()) {
            acceptOperand(token.value(), false);
        }
    }

    private void onAnd(Token token) {
        ConstructContext top = contexts.peek();
        if (mode == Mode.EXPECTING_ARGUMENT && top != null
                && top.kind() == ConstructKind.INNER_PRODUCT && top.argumentsReceived() == 1) {
            return;
        }
        appendInfix(token);
    }

    private void appendInfix(Token token) {
        buffer.append(" " + token.value() + " ");
    }

    private void appendPrefix(Token token) {
        buffer.append((buffer.isEmpty() ? "" : " ") + token.value() + " ");
    }

    private void appendTrailing(Token token) {
        buffer.append(" " + token.value());
    }

    private void onUnknown(Token token) {
        if (isFiller(token)) {
            return;
        }
        buffer.append(" " + token.value() + " ");
    }

    private boolean isFiller(Token token) {
        return fillerWords.contains(token.original().toLowerCase(Locale.ROOT));
    }

    private boolean topIs(Predicate<ConstructKind> predicate) {
        ConstructContext top = contexts.peek();
        return top != null && predicate.test(top.kind());
    }

    private ConstructContext nearest(Predicate<ConstructKind> predicate) {
        for (ConstructContext context : contexts) {
            if (predicate.test(context.kind())) {
                return context;
            }
        }
        return null;
    }
}
