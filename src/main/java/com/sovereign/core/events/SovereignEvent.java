package com.sovereign.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event recorded on the {@link EventBus} during a run.
 *
 * @param type      event type (e.g. "scope.enter", "task.complete", "action.validated")
 * @param timestamp when the event was emitted
 * @param traceId   trace of the emitting context
 * @param spanId    span of the emitting context
 * @param payload   arbitrary key-value data associated with the event; values may be null
 */
public record SovereignEvent(
    String type,
    Instant timestamp,
    String traceId,
    String spanId,
    Map<String, Object> payload
) implements Serializable {

    public SovereignEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
