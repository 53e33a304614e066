package com.company.workflowsla.bus;

/**
 * Closed set of delivery backends selectable at startup via {@code workflow.event-bus.backend}.
 */
public enum EventBusBackendType {
    NOOP("Logs at debug level only"),
    LOGGING("Writes every event to the application log"),
    IN_MEMORY("Records events in memory for verification"),
    REDIS("Publishes events to Redis pub/sub channels");

    private final String description;

    EventBusBackendType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static EventBusBackendType fromString(String type) {
        if (type == null) {
            return NOOP;
        }
        try {
            return EventBusBackendType.valueOf(type.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return NOOP;
        }
    }
}
