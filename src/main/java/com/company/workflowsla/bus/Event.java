package com.company.workflowsla.bus;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Domain event carried by the {@link EventBus}.
 * Metadata always holds an ISO-8601 {@code timestamp}, injected at construction if absent.
 */
@Getter
@ToString
public class Event {

    public static final String TIMESTAMP_KEY = "timestamp";

    private final String type;
    private final Map<String, Object> data;
    private final Map<String, Object> metadata;

    public Event(String type, Map<String, Object> data) {
        this(type, data, null);
    }

    public Event(String type, Map<String, Object> data, Map<String, Object> metadata) {
        this.type = Objects.requireNonNull(type, "Event type is required");
        this.data = data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
                : Collections.emptyMap();

        Map<String, Object> meta = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        meta.putIfAbsent(TIMESTAMP_KEY, Instant.now().toString());
        this.metadata = Collections.unmodifiableMap(meta);
    }

    public String getTimestamp() {
        return String.valueOf(metadata.get(TIMESTAMP_KEY));
    }
}
