package com.sovereign.core.metrics;

import com.sovereign.core.events.EventBus;
import com.sovereign.core.events.EventBusCustomizer;
import com.sovereign.core.events.EventTypes;
import org.springframework.stereotype.Component;

/**
 * Feeds task terminal states from every run's event bus into {@link SovereignMetrics}.
 */
@Component
public class TaskMetricsCustomizer implements EventBusCustomizer {

    private final SovereignMetrics metrics;

    public TaskMetricsCustomizer(SovereignMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void customize(EventBus eventBus) {
        eventBus.subscribe(EventTypes.TASK_COMPLETE, (event, context) -> metrics.recordTaskTerminal("completed"));
        eventBus.subscribe(EventTypes.TASK_CANCELLED, (event, context) -> metrics.recordTaskTerminal("cancelled"));
        eventBus.subscribe(EventTypes.TASK_ERROR, (event, context) -> metrics.recordTaskTerminal("failed"));
    }
}
