package com.opsdash.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contract for workflow.approval.requested events.
 *
 * Published by the approval workflow when an instance reaches a new approver.
 * Steps form a single linear chain: currentStep counts from 1 up to totalSteps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowApprovalRequestedContract {
    private String workflowInstanceId;
    private String workflowId;
    private String requestType;
    private String approverId;
    private String initiatorId;
    private String initiatorName;  // may be null when the profile lookup failed
    private int currentStep;
    private int totalSteps;
}
