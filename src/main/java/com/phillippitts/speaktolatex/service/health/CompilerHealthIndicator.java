package com.phillippitts.speaktolatex.service.health;

import com.phillippitts.speaktolatex.service.compiler.LatexCompiler;
import com.phillippitts.speaktolatex.service.stt.SttEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the translation pipeline.
 *
 * <ul>
 *   <li>UP: the compiler produces the expected LaTeX for a probe sentence and the speech
 *       engine, if one is configured, is healthy</li>
 *   <li>DEGRADED: the compiler works but the configured speech engine is unhealthy</li>
 *   <li>DOWN: the probe compilation is wrong or throws</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class CompilerHealthIndicator implements HealthIndicator {

    static final String PROBE_INPUT = "integral of x squared dx";
    static final String PROBE_EXPECTED = "\\int x^2\\, dx";

    private final LatexCompiler compiler;
    private final ObjectProvider<SttEngine> sttEngine;

    public CompilerHealthIndicator(LatexCompiler compiler, ObjectProvider<SttEngine> sttEngine) {
        this.compiler = compiler;
        this.sttEngine = sttEngine;
    }

    @Override
    public Health health() {
        String output;
        try {
            output = compiler.compile(PROBE_INPUT);
        } catch (RuntimeException e) {
            return Health.down(e).withDetail("probe", PROBE_INPUT).build();
        }

        SttEngine engine = sttEngine.getIfAvailable();
        String engineStatus = engine == null ? "not configured"
                : engine.getEngineName() + (engine.isHealthy() ? ": ready" : ": unhealthy");

        Health.Builder builder = new Health.Builder();
        if (!PROBE_EXPECTED.equals(output)) {
            builder.down();
        } else if (engine != null && !engine.isHealthy()) {
            builder.status("DEGRADED");
        } else {
            builder.up();
        }
        return builder
                .withDetail("probe", PROBE_INPUT)
                .withDetail("output", output)
                .withDetail("speechEngine", engineStatus)
                .build();
    }
}
