package com.sovereign.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sovereign.events")
public class EventProperties {

    /** When true a failing subscriber aborts the emitting code instead of being logged. */
    private boolean propagateSubscriberFailures = false;

    /** JSON-lines file the event log of every run is written to; unset disables the export. */
    private String logPath;

    public boolean isPropagateSubscriberFailures() { return propagateSubscriberFailures; }
    public void setPropagateSubscriberFailures(boolean propagateSubscriberFailures) {
        this.propagateSubscriberFailures = propagateSubscriberFailures;
    }
    public String getLogPath() { return logPath; }
    public void setLogPath(String logPath) { this.logPath = logPath; }
}
