package com.company.workflowsla.domain.enums;

/**
 * Expected latency of a catalog action; selects the default approval timeout.
 */
public enum LatencyClass {
    FAST,
    STANDARD,
    SLOW
}
