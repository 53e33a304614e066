package com.company.workflowsla.service;

import com.company.workflowsla.domain.enums.LatencyClass;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "workflow.actions")
@Validated
@Getter
@Setter
public class ActionCatalogProperties {

    /**
     * Action type -> metadata.
     */
    private Map<String, ActionDefinition> definitions = new LinkedHashMap<>();

    @NotNull
    private Map<LatencyClass, Duration> defaultTimeouts = defaultTimeouts();

    @Getter
    @Setter
    public static class ActionDefinition {
        private boolean idempotent = false;
        private LatencyClass latencyClass = LatencyClass.STANDARD;
    }

    private static Map<LatencyClass, Duration> defaultTimeouts() {
        Map<LatencyClass, Duration> timeouts = new EnumMap<>(LatencyClass.class);
        timeouts.put(LatencyClass.FAST, Duration.ofMinutes(15));
        timeouts.put(LatencyClass.STANDARD, Duration.ofHours(1));
        timeouts.put(LatencyClass.SLOW, Duration.ofHours(24));
        return timeouts;
    }
}
