package com.sovereign.core.events;

import com.sovereign.core.context.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only event log plus subscriber registry for one run.
 * <p>
 * {@link #emit} appends under a lock, then notifies the subscribers of the
 * event type (registration order) followed by the global subscribers, outside
 * the lock and on the emitting thread. The append order is the only ordering
 * guarantee; events of one span keep the order in which their code emitted them.
 * <p>
 * By default a failing subscriber is logged and skipped so that it cannot
 * change the emitter's control flow. With {@code propagateSubscriberFailures}
 * a subscriber failure reaches the emitter and the remaining subscribers are
 * skipped; the event stays recorded either way.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Object appendLock = new Object();
    private final List<SovereignEvent> eventLog = new ArrayList<>();

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<EventSubscriber>> typeSubscribers =
            new ConcurrentHashMap<>();

    /** Subscribers that receive every event. */
    private final CopyOnWriteArrayList<EventSubscriber> globalSubscribers = new CopyOnWriteArrayList<>();

    private final boolean propagateSubscriberFailures;

    public EventBus() {
        this(false);
    }

    public EventBus(boolean propagateSubscriberFailures) {
        this.propagateSubscriberFailures = propagateSubscriberFailures;
    }

    /**
     * Records an event tagged with {@code context} and hands it to subscribers.
     * Returns once every subscriber has processed it.
     *
     * @param type    event type
     * @param payload event data, may be empty
     * @param context context of the emitting code
     * @return the recorded event
     */
    public SovereignEvent emit(String type, Map<String, Object> payload, ExecutionContext context) {
        var event = new SovereignEvent(type, Instant.now(), context.traceId(), context.spanId(), payload);
        synchronized (appendLock) {
            eventLog.add(event);
        }
        log.info("EVENT: {} [span: {}]", type, context.spanId());

        List<EventSubscriber> subscribers = typeSubscribers.get(type);
        if (subscribers != null) {
            for (EventSubscriber subscriber : subscribers) {
                deliver(subscriber, event, context);
            }
        }
        for (EventSubscriber subscriber : globalSubscribers) {
            deliver(subscriber, event, context);
        }
        return event;
    }

    /**
     * Registers a subscriber for one event type.
     */
    public void subscribe(String type, EventSubscriber subscriber) {
        typeSubscribers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        log.debug("Subscribed to {}", type);
    }

    /**
     * Registers a subscriber for every event type.
     */
    public void subscribeAll(EventSubscriber subscriber) {
        globalSubscribers.add(subscriber);
        log.debug("Subscribed to all events (global)");
    }

    /**
     * Snapshot of the event log in append order.
     */
    public List<SovereignEvent> events() {
        synchronized (appendLock) {
            return List.copyOf(eventLog);
        }
    }

    /**
     * Snapshot of the events whose span is {@code spanId} or one of its descendants.
     */
    public List<SovereignEvent> eventsUnder(String spanId) {
        var prefix = spanId + ".";
        return events().stream()
                .filter(e -> e.spanId().equals(spanId) || e.spanId().startsWith(prefix))
                .toList();
    }

    public int size() {
        synchronized (appendLock) {
            return eventLog.size();
        }
    }

    private void deliver(EventSubscriber subscriber, SovereignEvent event, ExecutionContext context) {
        try {
            subscriber.onEvent(event, context);
        } catch (RuntimeException e) {
            if (propagateSubscriberFailures) {
                throw e;
            }
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type(), e.getMessage(), e);
        }
    }
}
