package com.sovereign.core.events;

import com.sovereign.core.context.ExecutionContext;

/**
 * Handler registered on the {@link EventBus}. Invoked synchronously from
 * {@link EventBus#emit}, so the emitting task waits for it.
 */
@FunctionalInterface
public interface EventSubscriber {

    void onEvent(SovereignEvent event, ExecutionContext context);
}
