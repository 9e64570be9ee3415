package com.opsdash.realtimeservice.subscriber;

import com.opsdash.common.contracts.ProjectUpdatedContract;
import com.opsdash.common.contracts.WorkflowApprovalRequestedContract;
import com.opsdash.common.contracts.WorkflowApprovedContract;
import com.opsdash.common.contracts.WorkflowRejectedContract;
import com.opsdash.common.result.Result;
import com.opsdash.realtimeservice.config.AmqpConfig;
import com.opsdash.realtimeservice.dto.NotificationDraft;
import com.opsdash.realtimeservice.dto.NotificationDto;
import com.opsdash.realtimeservice.service.NotificationDrafts;
import com.opsdash.realtimeservice.service.NotificationInboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitHandler;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Turns approval workflow and project events into inbox notifications.
 *
 * One queue carries every event type; @RabbitHandler methods dispatch on the payload type.
 * Failed inserts are logged and the message is acknowledged: the workflow has already
 * moved on and a redelivery would not change the outcome of a validation error.
 */
@Component
@RabbitListener(queues = AmqpConfig.Q_WORKFLOW_EVENTS)
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventSubscriber {

    private final NotificationInboxService notificationInboxService;

    @RabbitHandler
    public void handleApprovalRequested(WorkflowApprovalRequestedContract contract) {
        log.info("Received workflow.approval.requested: workflowInstanceId={}, approverId={}, step={}/{}",
                contract.getWorkflowInstanceId(), contract.getApproverId(),
                contract.getCurrentStep(), contract.getTotalSteps());

        store(NotificationDrafts.workflowApprovalRequested(contract), "workflow.approval.requested",
                contract.getWorkflowInstanceId());
    }

    @RabbitHandler
    public void handleWorkflowApproved(WorkflowApprovedContract contract) {
        log.info("Received workflow.approved: workflowInstanceId={}, requesterId={}",
                contract.getWorkflowInstanceId(), contract.getRequesterId());

        store(NotificationDrafts.workflowApproved(contract), "workflow.approved", contract.getWorkflowInstanceId());
    }

    @RabbitHandler
    public void handleWorkflowRejected(WorkflowRejectedContract contract) {
        log.info("Received workflow.rejected: workflowInstanceId={}, requesterId={}, rejectedBy={}",
                contract.getWorkflowInstanceId(), contract.getRequesterId(), contract.getRejectedBy());

        store(NotificationDrafts.workflowRejected(contract), "workflow.rejected", contract.getWorkflowInstanceId());
    }

    /**
     * Notifies every listed project member.
     */
    @RabbitHandler
    public void handleProjectUpdated(ProjectUpdatedContract contract) {
        log.info("Received project.updated: projectId={}, updateType={}, recipients={}",
                contract.getProjectId(), contract.getUpdateType(),
                contract.getRecipientIds() != null ? contract.getRecipientIds().size() : 0);

        if (contract.getRecipientIds() == null || contract.getRecipientIds().isEmpty()) {
            log.warn("project.updated without recipients, nothing to notify: projectId={}", contract.getProjectId());
            return;
        }

        NotificationDraft draft = NotificationDrafts.projectUpdated(contract);
        for (String recipientId : contract.getRecipientIds()) {
            store(draft.forRecipient(recipientId), "project.updated", contract.getProjectId());
        }
    }

    private void store(NotificationDraft draft, String eventName, String entityId) {
        Result<NotificationDto> result = notificationInboxService.create(draft);
        if (result.isOk()) {
            log.info("{} notification stored: entityId={}, recipientId={}, notificationId={}",
                    eventName, entityId, draft.getRecipientId(), result.getData().getId());
        } else {
            log.error("Failed to store {} notification: entityId={}, recipientId={}, error={}",
                    eventName, entityId, draft.getRecipientId(), result.getError().getMessage());
        }
    }
}
