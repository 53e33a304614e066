package com.company.workflowsla.event;

import com.company.workflowsla.domain.SlaBreach;
import com.company.workflowsla.domain.SlaDefinition;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Spring application event raised when a breach row is inserted. Its alert goes out only
 * once the inserting transaction has committed.
 */
@Getter
@AllArgsConstructor
public class SlaBreachRecordedEvent {
    private final SlaBreach breach;
    private final SlaDefinition definition;
}
