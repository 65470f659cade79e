package com.sovereign.core.planner;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sovereign.planner")
public class PlannerProperties {

    /** Pause of the simulated subtask handler. */
    private long simulatedWorkMillis = 1000;

    public long getSimulatedWorkMillis() { return simulatedWorkMillis; }
    public void setSimulatedWorkMillis(long simulatedWorkMillis) { this.simulatedWorkMillis = simulatedWorkMillis; }
}
