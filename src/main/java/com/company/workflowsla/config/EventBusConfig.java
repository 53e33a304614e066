package com.company.workflowsla.config;

import com.company.workflowsla.bus.EventBackend;
import com.company.workflowsla.bus.EventBus;
import com.company.workflowsla.bus.EventBusBackendType;
import com.company.workflowsla.bus.InMemoryEventBackend;
import com.company.workflowsla.bus.LoggingEventBackend;
import com.company.workflowsla.bus.NoOpEventBackend;
import com.company.workflowsla.bus.RedisEventBackend;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Selects the single event bus backend at startup from {@code workflow.event-bus.backend}
 * and builds the process-wide {@link EventBus}.
 */
@Configuration
@Slf4j
public class EventBusConfig {

    @Bean
    @Primary
    public EventBackend eventBackend(
            @Value("${workflow.event-bus.backend:NOOP}") String backend,
            @Value("${workflow.event-bus.logging.level:INFO}") String loggingLevel,
            ObjectProvider<RedisEventBackend> redisBackend) {

        EventBusBackendType type = EventBusBackendType.fromString(backend);
        log.info("Event bus backend: {} ({})", type, type.getDescription());

        switch (type) {
            case LOGGING:
                return new LoggingEventBackend(loggingLevel);
            case IN_MEMORY:
                return new InMemoryEventBackend();
            case REDIS:
                RedisEventBackend redis = redisBackend.getIfAvailable();
                if (redis == null) {
                    throw new IllegalStateException("Redis event backend selected but not available");
                }
                return redis;
            default:
                return new NoOpEventBackend();
        }
    }

    @Bean
    public EventBus eventBus(EventBackend eventBackend, MeterRegistry meterRegistry) {
        return new EventBus(eventBackend, meterRegistry);
    }
}
