package com.company.workflowsla.bus;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class NoOpEventBackend implements EventBackend {

    @Override
    public void publish(Event event, List<String> topics) {
        log.debug("[NoOp] Event published: {} to topics: {}", event.getType(), describe(topics));
        log.debug("Event data: {}", event.getData());
    }

    static String describe(List<String> topics) {
        return topics == null || topics.isEmpty() ? "default" : String.join(", ", topics);
    }
}
