package com.company.workflowsla.bus;

import java.util.List;

/**
 * Delivery backend behind the {@link EventBus}. Exactly one backend is active per process.
 */
public interface EventBackend {

    /**
     * @param topics topics the event is published to, or {@code null} for the default topic
     */
    void publish(Event event, List<String> topics);
}
