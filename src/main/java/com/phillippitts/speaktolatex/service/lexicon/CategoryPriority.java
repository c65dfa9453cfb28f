package com.phillippitts.speaktolatex.service.lexicon;

import com.phillippitts.speaktolatex.domain.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

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
import static com.phillippitts.speaktolatex.domain.TokenKind.UNKNOWN;
import static com.phillippitts.speaktolatex.domain.TokenKind.VARIABLE;
import static com.phillippitts.speaktolatex.domain.TokenKind.VARIANCE;
import static com.phillippitts.speaktolatex.domain.TokenKind.VECTOR;
import static com.phillippitts.speaktolatex.domain.TokenKind.WITH_RESPECT_TO;

/**
 * Explicit order in which token categories are tried when a phrase matches more than one.
 *
 * <p>The first category in {@link #order()} whose patterns match wins. The order is a single
 * reviewed list rather than an accident of map iteration, and {@link #knownCollisions()} pins
 * the surfaces whose winner callers rely on.
 */
public final class CategoryPriority {

    private static final List<TokenKind> STANDARD_ORDER = List.of(
            // predicates swallow "is", so they go before anything that could see it
            IS_POSITIVE, IS_NEGATIVE, IS_NONNEGATIVE, IS_ZERO, IS_EVEN, IS_ODD,
            IS_PRIME, IS_INTEGER, IS_NATURAL, IS_RATIONAL, IS_REAL, IS_COMPLEX,
            INTEGRAL, DERIVATIVE, PARTIAL, LIMIT,
            // "divided by" is a fraction, "multiplication" is an operator
            FRACTION, OPERATOR,
            SUM, PRODUCT, SERIES, SEQUENCE,
            POWER, ROOT, FACTORIAL, ABSOLUTE,
            TRIG, INVERSE_TRIG, HYPERBOLIC, LOG, EXPONENTIAL,
            MATRIX, VECTOR, DETERMINANT, TRANSPOSE, INVERSE,
            DOT_PRODUCT, CROSS_PRODUCT, INNER_PRODUCT, MAGNITUDE, NORM,
            SUBSET, SET, UNION, INTERSECTION, ELEMENT,
            AND, OR, NOT, IMPLIES, IFF, THEREFORE, BECAUSE, QED,
            LESS_THAN, GREATER_THAN, LESS_EQUAL, GREATER_EQUAL, NOT_EQUAL, APPROXIMATELY,
            ANGLE, PARALLEL, PERPENDICULAR, CONGRUENT, SIMILAR,
            PROBABILITY, EXPECTED_VALUE, VARIANCE, STANDARD_DEVIATION,
            INFINITY, PI, E,
            FOR_ALL, EXISTS, SUCH_THAT,
            FROM, TO, OF, EQUALS, APPROACHES, AS, WITH_RESPECT_TO, DIFFERENTIAL, BRACKET,
            VARIABLE, NUMBER
    );

    private static final Map<String, TokenKind> STANDARD_COLLISIONS = standardCollisions();

    private final List<TokenKind> order;
    private final Map<String, TokenKind> knownCollisions;

    /**
     * @param order           every category except {@link TokenKind#UNKNOWN}, each exactly once
     * @param knownCollisions surfaces matched by several categories, mapped to the expected winner
     * @throws IllegalArgumentException if the order repeats, omits or includes UNKNOWN
     */
    public CategoryPriority(List<TokenKind> order, Map<String, TokenKind> knownCollisions) {
        EnumSet<TokenKind> seen = EnumSet.noneOf(TokenKind.class);
        for (TokenKind kind : order) {
            if (kind == UNKNOWN) {
                throw new IllegalArgumentException("UNKNOWN is the fallback and cannot be prioritised");
            }
            if (!seen.add(kind)) {
                throw new IllegalArgumentException("Category listed twice in priority order: " + kind);
            }
        }
        Set<TokenKind> missing = EnumSet.complementOf(seen);
        missing.remove(UNKNOWN);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Categories missing from priority order: " + missing);
        }
        this.order = List.copyOf(order);
        this.knownCollisions = Map.copyOf(knownCollisions);
    }

    public static CategoryPriority standard() {
        return new CategoryPriority(STANDARD_ORDER, STANDARD_COLLISIONS);
    }

    public List<TokenKind> order() {
        return order;
    }

    public Map<String, TokenKind> knownCollisions() {
        return knownCollisions;
    }

    /**
     * Picks the highest-priority category among the given candidates.
     *
     * @return the winner, or {@link TokenKind#UNKNOWN} when there are no candidates
     */
    public TokenKind winner(Set<TokenKind> candidates) {
        for (TokenKind kind : order) {
            if (candidates.contains(kind)) {
                return kind;
            }
        }
        return UNKNOWN;
    }

    /**
     * Returns the given kinds sorted by priority, highest first.
     */
    public List<TokenKind> sort(Set<TokenKind> kinds) {
        List<TokenKind> sorted = new ArrayList<>(kinds.size());
        for (TokenKind kind : order) {
            if (kinds.contains(kind)) {
                sorted.add(kind);
            }
        }
        return sorted;
    }

    private static Map<String, TokenKind> standardCollisions() {
        Map<String, TokenKind> collisions = new LinkedHashMap<>();
        collisions.put("e", E);
        collisions.put("pi", PI);
        collisions.put("sigma", SUM);
        collisions.put("divided by", FRACTION);
        collisions.put("multiplication", OPERATOR);
        collisions.put("subset", SUBSET);
        return collisions;
    }
}
