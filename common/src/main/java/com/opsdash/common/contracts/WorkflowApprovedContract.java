package com.opsdash.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Contract for workflow.approved events.
 *
 * Published once the final step of a workflow instance is approved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowApprovedContract {
    private String workflowInstanceId;
    private String workflowId;
    private String requestType;
    private String requesterId;
    private Instant completedAt;
}
