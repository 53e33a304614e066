package com.company.workflowsla.service;

import com.company.workflowsla.domain.ActionMetadata;

import java.time.Duration;
import java.util.Optional;

/**
 * Read-only action metadata supplied by the workflow executor's catalog.
 */
public interface ActionCatalog {

    Optional<ActionMetadata> find(String actionType);

    /**
     * Default approval timeout for an action, derived from its latency class.
     * Unknown actions get the standard timeout.
     */
    Duration defaultApprovalTimeout(String actionType);
}
