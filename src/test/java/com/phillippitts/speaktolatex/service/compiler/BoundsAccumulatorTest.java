package com.phillippitts.speaktolatex.service.compiler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BoundsAccumulatorTest {

    private OutputBuffer buffer;
    private BoundsAccumulator bounds;

    @BeforeEach
    void setUp() {
        buffer = new OutputBuffer();
        bounds = new BoundsAccumulator();
    }

    @Test
    void shouldWriteIntegralLimits() {
        ConstructContext integral = open(ConstructKind.INTEGRAL, "\\int");
        bounds.markLowerReady();
        assertThat(bounds.offer("0")).isTrue();
        bounds.markUpperReady();
        assertThat(bounds.offer("1")).isTrue();

        assertThat(bounds.isComplete()).isTrue();
        assertThat(bounds.applyTo(buffer)).isTrue();
        assertThat(buffer.get(integral.anchor())).isEqualTo("\\int_{0}^{1}");
        assertThat(integral.boundsApplied()).isTrue();
    }

    @Test
    void shouldRefuseOperandWithNoSlotReady() {
        open(ConstructKind.INTEGRAL, "\\int");

        assertThat(bounds.offer("x")).isFalse();
        assertThat(bounds.isPending()).isFalse();
    }

    @Test
    void shouldWriteIndexedBounds() {
        open(ConstructKind.SUM, "\\sum");
        bounds.offer("k");
        bounds.markEqualsReady();
        bounds.offer("1");
        bounds.markUpperReady();
        bounds.offer("n");

        bounds.applyTo(buffer);

        assertThat(buffer.get(0)).isEqualTo("\\sum_{k=1}^{n}");
    }

    @Test
    void shouldWriteIndexWithoutLowerBound() {
        open(ConstructKind.PRODUCT, "\\prod");
        bounds.offer("j");
        bounds.markUpperReady();
        bounds.offer("m");

        assertThat(bounds.isComplete()).isFalse();
        bounds.applyTo(buffer);

        assertThat(buffer.get(0)).isEqualTo("\\prod_{j}^{m}");
    }

    @Test
    void shouldWriteLimitTarget() {
        open(ConstructKind.LIMIT, "\\lim");
        bounds.offer("n");
        bounds.markApproaching();
        bounds.offer("\\infty");

        assertThat(bounds.isComplete()).isTrue();
        bounds.applyTo(buffer);

        assertThat(buffer.get(0)).isEqualTo("\\lim_{n \\to \\infty}");
    }

    @Test
    void shouldDefaultLimitVariable() {
        open(ConstructKind.LIMIT, "\\lim");
        bounds.markApproaching();
        bounds.offer("0");

        bounds.applyTo(buffer);

        assertThat(buffer.get(0)).isEqualTo("\\lim_{x \\to 0}");
    }

    @Test
    void shouldApplyAtMostOnce() {
        ConstructContext integral = open(ConstructKind.INTEGRAL, "\\int");
        bounds.markLowerReady();
        bounds.offer("0");
        bounds.applyTo(buffer);

        bounds.reset(integral);
        bounds.markLowerReady();

        assertThat(bounds.offer("5")).isFalse();
        assertThat(bounds.applyTo(buffer)).isFalse();
        assertThat(buffer.get(0)).isEqualTo("\\int_{0}");
    }

    @Test
    void applyWithNothingPendingShouldReleaseOwner() {
        ConstructContext sum = open(ConstructKind.SUM, "\\sum");

        assertThat(bounds.applyTo(buffer)).isFalse();
        assertThat(bounds.isOwnedBy(sum)).isFalse();
        assertThat(buffer.get(0)).isEqualTo("\\sum");
    }

    private ConstructContext open(ConstructKind kind, String fragment) {
        ConstructContext context = new ConstructContext(kind, buffer.append(fragment));
        bounds.reset(context);
        return context;
    }
}
