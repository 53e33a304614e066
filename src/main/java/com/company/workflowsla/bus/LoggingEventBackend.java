package com.company.workflowsla.bus;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;

import java.util.List;

/**
 * Writes every event synchronously to the application log at a configurable level.
 */
@Slf4j
public class LoggingEventBackend implements EventBackend {

    private final Level level;

    public LoggingEventBackend(String level) {
        this.level = parseLevel(level);
    }

    @Override
    public void publish(Event event, List<String> topics) {
        log.atLevel(level).log("Event: {} | Topics: {} | Data: {} | Metadata: {}",
                event.getType(), NoOpEventBackend.describe(topics), event.getData(), event.getMetadata());
    }

    public Level getLevel() {
        return level;
    }

    private static Level parseLevel(String level) {
        if (level == null) {
            return Level.INFO;
        }
        try {
            return Level.valueOf(level.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }
}
