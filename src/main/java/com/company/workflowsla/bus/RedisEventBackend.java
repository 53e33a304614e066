package com.company.workflowsla.bus;

import com.company.workflowsla.exception.BackendUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Production transport: one Redis pub/sub message per topic, channel
 * {@code <prefix><topic>}. Without topics the event type is used as the channel.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "workflow.event-bus.backend", havingValue = "REDIS")
public class RedisEventBackend implements EventBackend {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channelPrefix;

    public RedisEventBackend(StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             @Value("${workflow.event-bus.redis.channel-prefix:workflow:events:}") String channelPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channelPrefix = channelPrefix;
    }

    @Override
    @Retry(name = "eventBusRedis", fallbackMethod = "publishFallback")
    @CircuitBreaker(name = "eventBusRedis")
    public void publish(Event event, List<String> topics) {
        String payload = serialize(event, topics);
        List<String> channels = topics == null || topics.isEmpty() ? List.of(event.getType()) : topics;

        for (String topic : channels) {
            Long receivers = redisTemplate.convertAndSend(channelPrefix + topic, payload);
            log.debug("Published {} to {}{}: {} receivers", event.getType(), channelPrefix, topic, receivers);
        }
    }

    /**
     * Reached once retries are exhausted or the circuit is open.
     */
    private void publishFallback(Event event, List<String> topics, Throwable cause) {
        throw new BackendUnavailableException("redis", event.getType(), cause);
    }

    private String serialize(Event event, List<String> topics) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", event.getType());
        envelope.put("topics", topics != null ? topics : List.of());
        envelope.put("data", event.getData());
        envelope.put("metadata", event.getMetadata());
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException("redis", event.getType(), e);
        }
    }
}
