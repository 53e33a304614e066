package com.company.workflowsla.bus;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records published events in publish order. Used for verification and tests.
 */
public class InMemoryEventBackend implements EventBackend {

    private final List<RecordedEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(Event event, List<String> topics) {
        events.add(new RecordedEvent(event, topics != null ? List.copyOf(topics) : List.of()));
    }

    public List<Event> getEvents() {
        List<Event> result = new ArrayList<>(events.size());
        for (RecordedEvent recorded : events) {
            result.add(recorded.getEvent());
        }
        return result;
    }

    public List<Event> getEvents(String eventType) {
        if (eventType == null) {
            return getEvents();
        }
        List<Event> result = new ArrayList<>();
        for (RecordedEvent recorded : events) {
            if (eventType.equals(recorded.getEvent().getType())) {
                result.add(recorded.getEvent());
            }
        }
        return result;
    }

    public List<RecordedEvent> getRecordedEvents() {
        return List.copyOf(events);
    }

    public void clear() {
        events.clear();
    }

    @Getter
    @AllArgsConstructor
    public static class RecordedEvent {
        private final Event event;
        private final List<String> topics;
    }
}
