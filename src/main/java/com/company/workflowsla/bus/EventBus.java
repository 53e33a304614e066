package com.company.workflowsla.bus;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publish/subscribe bus.
 *
 * <p>Every publish is forwarded to the single active {@link EventBackend} first, then
 * delivered to in-process subscribers. Backend failures and handler failures are logged
 * and isolated: neither reaches the publisher, and one failing handler does not stop the
 * remaining ones.
 *
 * <p>One instance exists per process; it is built in
 * {@link com.company.workflowsla.config.EventBusConfig} and injected into its users.
 */
@Slf4j
public class EventBus {

    private final EventBackend backend;
    private final MeterRegistry meterRegistry;

    // topic -> handlers in subscription order
    private final ConcurrentMap<String, CopyOnWriteArrayList<EventHandler>> subscribers =
            new ConcurrentHashMap<>();

    public EventBus(EventBackend backend, MeterRegistry meterRegistry) {
        this.backend = backend != null ? backend : new NoOpEventBackend();
        this.meterRegistry = meterRegistry;
    }

    public boolean publish(Event event) {
        return publish(event, null);
    }

    /**
     * Publish an event to the backend and notify subscribers.
     *
     * @param topics topics to notify; {@code null} or empty notifies every subscriber
     * @return {@code true} if the backend accepted the event
     */
    public boolean publish(Event event, List<String> topics) {
        boolean delivered = true;

        try {
            backend.publish(event, topics);
        } catch (Exception e) {
            delivered = false;
            log.error("Error publishing event {} to backend {}",
                    event.getType(), backend.getClass().getSimpleName(), e);
            meterRegistry.counter("event_bus.backend.failures", "type", event.getType()).increment();
        }

        for (EventHandler handler : resolveHandlers(topics)) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.error("Subscriber {} failed to handle event {}", handler, event.getType(), e);
                meterRegistry.counter("event_bus.handler.failures", "type", event.getType()).increment();
            }
        }

        return delivered;
    }

    /**
     * Subscribe a handler to a topic. Subscribing the same handler twice has no effect.
     */
    public void subscribe(String topic, EventHandler handler) {
        subscribers.compute(topic, (key, handlers) -> {
            CopyOnWriteArrayList<EventHandler> list = handlers != null ? handlers : new CopyOnWriteArrayList<>();
            if (list.addIfAbsent(handler)) {
                log.debug("Subscribed {} to topic: {}", handler, topic);
            }
            return list;
        });
    }

    public void unsubscribe(String topic, EventHandler handler) {
        subscribers.computeIfPresent(topic, (key, handlers) -> {
            if (handlers.remove(handler)) {
                log.debug("Unsubscribed {} from topic: {}", handler, topic);
            }
            return handlers.isEmpty() ? null : handlers;
        });
    }

    public int getSubscriberCount(String topic) {
        List<EventHandler> handlers = subscribers.get(topic);
        return handlers != null ? handlers.size() : 0;
    }

    /**
     * Each handler is notified at most once per publish, even when it is subscribed to
     * several of the targeted topics.
     */
    private Collection<EventHandler> resolveHandlers(List<String> topics) {
        Set<EventHandler> handlers = new LinkedHashSet<>();

        if (topics == null || topics.isEmpty()) {
            subscribers.values().forEach(handlers::addAll);
        } else {
            for (String topic : topics) {
                List<EventHandler> topicHandlers = subscribers.get(topic);
                if (topicHandlers != null) {
                    handlers.addAll(topicHandlers);
                }
            }
        }

        return handlers;
    }
}
