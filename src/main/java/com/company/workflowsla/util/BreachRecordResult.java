package com.company.workflowsla.util;

import com.company.workflowsla.domain.SlaBreach;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class BreachRecordResult {
    private SlaBreach breach;
    private boolean created;
    // Alert handed over for delivery after commit
    private boolean alertQueued;
}
