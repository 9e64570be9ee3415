package com.opsdash.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Contract for workflow.rejected events.
 *
 * Published when any step rejects the workflow instance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRejectedContract {
    private String workflowInstanceId;
    private String workflowId;
    private String requestType;
    private String requesterId;
    private String rejectedBy;
    private String reason;
    private Instant rejectedAt;
}
