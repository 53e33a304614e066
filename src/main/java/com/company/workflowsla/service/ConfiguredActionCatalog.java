package com.company.workflowsla.service;

import com.company.workflowsla.domain.ActionMetadata;
import com.company.workflowsla.domain.enums.LatencyClass;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Catalog backed by {@code workflow.actions.*} configuration.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConfiguredActionCatalog implements ActionCatalog {

    private static final Duration FALLBACK_TIMEOUT = Duration.ofHours(1);

    private final ActionCatalogProperties properties;

    @Override
    public Optional<ActionMetadata> find(String actionType) {
        if (actionType == null) {
            return Optional.empty();
        }
        ActionCatalogProperties.ActionDefinition definition = properties.getDefinitions().get(actionType);
        if (definition == null) {
            return Optional.empty();
        }
        return Optional.of(ActionMetadata.builder()
                .actionType(actionType)
                .idempotent(definition.isIdempotent())
                .latencyClass(definition.getLatencyClass() != null
                        ? definition.getLatencyClass() : LatencyClass.STANDARD)
                .build());
    }

    @Override
    public Duration defaultApprovalTimeout(String actionType) {
        LatencyClass latencyClass = find(actionType)
                .map(ActionMetadata::getLatencyClass)
                .orElseGet(() -> {
                    log.debug("Action type {} not in catalog, using standard timeout", actionType);
                    return LatencyClass.STANDARD;
                });

        Duration timeout = properties.getDefaultTimeouts().get(latencyClass);
        return timeout != null ? timeout : FALLBACK_TIMEOUT;
    }
}
