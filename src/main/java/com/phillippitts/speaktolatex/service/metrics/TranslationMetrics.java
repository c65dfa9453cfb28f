package com.phillippitts.speaktolatex.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for translations.
 *
 * <p>Every meter is tagged with {@code source}: {@code text} for typed input, {@code audio} for
 * uploaded recordings.
 */
@Component
public class TranslationMetrics {

    public static final String SOURCE_TEXT = "text";
    public static final String SOURCE_AUDIO = "audio";

    private static final String METRIC_PREFIX = "speaktolatex.translation";

    private final MeterRegistry registry;

    public TranslationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String source, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to turn input into LaTeX")
                .tag("source", source)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String source) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of translations that produced LaTeX")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * @param reason short failure category (no_speech, transcription, no_engine)
     */
    public void incrementFailure(String source, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of translations that produced no LaTeX")
                .tag("source", source)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
