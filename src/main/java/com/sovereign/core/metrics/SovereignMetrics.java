package com.sovereign.core.metrics;

import com.sovereign.core.gateway.Decision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for deployment runs.
 */
@Service
public class SovereignMetrics {

    private final MeterRegistry registry;

    public SovereignMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String status) {
        Counter.builder("sovereign.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("sovereign.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts a task reaching a terminal state.
     *
     * @param state terminal state name, e.g. {@code completed}
     */
    public void recordTaskTerminal(String state) {
        Counter.builder("sovereign.tasks.total")
                .tag("state", state.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records one gateway decision, plus one warning count per advisory warning.
     */
    public void recordValidation(Decision decision) {
        Counter.builder("sovereign.validations.total")
                .tag("verdict", decision.verdict().name().toLowerCase(Locale.ROOT))
                .tag("category", decision.category() == null ? "none" : decision.category().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        if (decision.hasWarnings()) {
            Counter.builder("sovereign.validation.warnings")
                    .description("Advisory warnings raised by the validation gateway")
                    .register(registry)
                    .increment(decision.warnings().size());
        }
    }
}
