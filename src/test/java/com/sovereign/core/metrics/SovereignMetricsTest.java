package com.sovereign.core.metrics;

import com.sovereign.core.context.ExecutionContext;
import com.sovereign.core.context.ExecutionMode;
import com.sovereign.core.events.EventBus;
import com.sovereign.core.events.EventTypes;
import com.sovereign.core.gateway.Decision;
import com.sovereign.core.gateway.RejectionCategory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SovereignMetricsTest {

    private SimpleMeterRegistry registry;
    private SovereignMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SovereignMetrics(registry);
    }

    @Test
    @DisplayName("recordRunResult counts by status")
    void recordRunResult() {
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("COMPLETED");
        metrics.recordRunResult("CANCELLED");

        assertEquals(2.0, registry.find("sovereign.runs.total").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("sovereign.runs.total").tag("status", "CANCELLED").counter().count());
    }

    @Test
    @DisplayName("recordPhaseDuration creates a timer per phase")
    void recordPhaseDuration() {
        metrics.recordPhaseDuration("repo_prep", 150);
        metrics.recordPhaseDuration("commit", 40);

        var timer = registry.find("sovereign.phase.duration").tag("phase", "repo_prep").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNotNull(registry.find("sovereign.phase.duration").tag("phase", "commit").timer());
    }

    @Test
    @DisplayName("recordValidation tags verdict and category and counts warnings")
    void recordValidation() {
        metrics.recordValidation(Decision.allowed());
        metrics.recordValidation(Decision.allowed(List.of("a", "b")));
        metrics.recordValidation(Decision.rejected(RejectionCategory.SELF_PRESERVATION, "no"));

        assertEquals(2.0, registry.find("sovereign.validations.total")
                .tag("verdict", "allowed").tag("category", "none").counter().count());
        assertEquals(1.0, registry.find("sovereign.validations.total")
                .tag("verdict", "rejected").tag("category", "self_preservation").counter().count());
        assertEquals(2.0, registry.find("sovereign.validation.warnings").counter().count());
    }

    @Test
    @DisplayName("the task customizer counts terminal task events")
    void taskCustomizer() {
        var bus = new EventBus();
        new TaskMetricsCustomizer(metrics).customize(bus);
        var context = ExecutionContext.root("deploy_x", ExecutionMode.ARCHITECT, Map.of()).deriveChild("git_init");

        bus.emit(EventTypes.TASK_START, Map.of(), context);
        bus.emit(EventTypes.TASK_COMPLETE, Map.of(), context);
        bus.emit(EventTypes.TASK_CANCELLED, Map.of(), context);
        bus.emit(EventTypes.TASK_ERROR, Map.of(), context);
        bus.emit(EventTypes.TASK_ERROR, Map.of(), context);

        assertEquals(1.0, registry.find("sovereign.tasks.total").tag("state", "completed").counter().count());
        assertEquals(1.0, registry.find("sovereign.tasks.total").tag("state", "cancelled").counter().count());
        assertEquals(2.0, registry.find("sovereign.tasks.total").tag("state", "failed").counter().count());
    }
}
