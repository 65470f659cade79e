package com.sovereign.core.events;

/**
 * Callback applied to every run's {@link EventBus} before the first event is
 * emitted, so subscribers registered here see the whole run.
 */
@FunctionalInterface
public interface EventBusCustomizer {

    void customize(EventBus eventBus);
}
