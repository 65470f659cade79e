package com.sovereign.core.planner;

import com.sovereign.core.context.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Handler used when no real tool integration is registered: waits for a
 * configurable pause and reports the subtask as done.
 */
public class SimulatedSubtaskHandler implements SubtaskHandler {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSubtaskHandler.class);

    private final Duration pause;

    public SimulatedSubtaskHandler(Duration pause) {
        this.pause = pause;
    }

    @Override
    public String handle(Subtask subtask, ExecutionContext context) throws InterruptedException {
        log.info("{} working on '{}' [span: {}]", subtask.mode().displayName(), subtask.name(), context.spanId());
        if (!pause.isZero()) {
            Thread.sleep(pause.toMillis());
        }
        return "Completed " + subtask.name();
    }
}
