package com.opsdash.realtimeservice.service;

import com.opsdash.common.contracts.ProjectUpdateType;
import com.opsdash.common.contracts.ProjectUpdatedContract;
import com.opsdash.common.contracts.WorkflowApprovalRequestedContract;
import com.opsdash.common.contracts.WorkflowApprovedContract;
import com.opsdash.common.contracts.WorkflowRejectedContract;
import com.opsdash.realtimeservice.dto.NotificationDraft;
import com.opsdash.realtimeservice.dto.RelatedEntity;
import com.opsdash.realtimeservice.model.Notification;
import com.opsdash.realtimeservice.model.NotificationPriority;
import com.opsdash.realtimeservice.model.NotificationType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds notification drafts for domain events. No I/O; the caller stores the result
 * through {@link NotificationInboxService#create(NotificationDraft)}. Titles and messages
 * built from event text are shortened to the column limits; the full values stay in the
 * related entity metadata.
 */
public final class NotificationDrafts {

    public static final String WORKFLOW_INSTANCE = "workflow_instance";
    public static final String PROJECT = "project";
    public static final String SYSTEM_ANNOUNCEMENT = "system_announcement";

    private static final String UNKNOWN_USER = "Unknown User";
    private static final String ELLIPSIS = "...";

    private NotificationDrafts() {
    }

    /**
     * Approver-facing request for the current step of a linear approval chain.
     */
    public static NotificationDraft workflowApprovalRequested(WorkflowApprovalRequestedContract event) {
        String requestType = event.getRequestType();
        String initiator = event.getInitiatorName() != null ? event.getInitiatorName() : UNKNOWN_USER;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("workflow_id", event.getWorkflowId());
        metadata.put("request_type", requestType);
        metadata.put("current_step", event.getCurrentStep());
        metadata.put("total_steps", event.getTotalSteps());

        return NotificationDraft.builder()
                .recipientId(event.getApproverId())
                .type(NotificationType.WORKFLOW)
                .priority(NotificationPriority.HIGH)
                .title(title("Approval Required: " + requestType))
                .message(message("You have a pending " + requestType + " approval from " + initiator
                        + ". Step " + event.getCurrentStep() + " of " + event.getTotalSteps() + "."))
                .relatedEntity(related(WORKFLOW_INSTANCE, event.getWorkflowInstanceId(), metadata))
                .build();
    }

    public static NotificationDraft workflowApproved(WorkflowApprovedContract event) {
        String requestType = event.getRequestType();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("workflow_id", event.getWorkflowId());
        metadata.put("request_type", requestType);
        metadata.put("completed_at", iso(event.getCompletedAt()));

        return NotificationDraft.builder()
                .recipientId(event.getRequesterId())
                .type(NotificationType.SUCCESS)
                .priority(NotificationPriority.MEDIUM)
                .title(title("Workflow Approved: " + requestType))
                .message(message("Your " + requestType + " request has been approved and is ready for implementation."))
                .relatedEntity(related(WORKFLOW_INSTANCE, event.getWorkflowInstanceId(), metadata))
                .build();
    }

    public static NotificationDraft workflowRejected(WorkflowRejectedContract event) {
        String requestType = event.getRequestType();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("workflow_id", event.getWorkflowId());
        metadata.put("request_type", requestType);
        metadata.put("rejection_reason", event.getReason());
        metadata.put("rejected_at", iso(event.getRejectedAt()));

        return NotificationDraft.builder()
                .recipientId(event.getRequesterId())
                .type(NotificationType.ERROR)
                .priority(NotificationPriority.HIGH)
                .title(title("Workflow Rejected: " + requestType))
                .message(message("Your " + requestType + " request has been rejected. Reason: " + event.getReason()))
                .relatedEntity(related(WORKFLOW_INSTANCE, event.getWorkflowInstanceId(), metadata))
                .build();
    }

    /**
     * Project change for one member. The recipient is filled in per member by the caller.
     */
    public static NotificationDraft projectUpdated(ProjectUpdatedContract event) {
        String name = event.getName();
        ProjectUpdateType updateType = event.getUpdateType() != null ? event.getUpdateType() : ProjectUpdateType.OTHER;

        String message = switch (updateType) {
            case PROGRESS -> "Project \"" + name + "\" progress updated to " + event.getProgress() + "%";
            case BUDGET -> "Project \"" + name + "\" budget has been updated";
            case STATUS -> "Project \"" + name + "\" status changed to " + event.getStatus();
            case OTHER -> "Project \"" + name + "\" has been updated";
        };

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("project_name", name);
        metadata.put("update_type", updateType.name().toLowerCase(Locale.ROOT));
        metadata.put("updated_at", iso(event.getUpdatedAt()));

        return NotificationDraft.builder()
                .type(NotificationType.INFO)
                .priority(NotificationPriority.MEDIUM)
                .title(title("Project Update: " + name))
                .message(message(message))
                .relatedEntity(related(PROJECT, event.getProjectId(), metadata))
                .build();
    }

    /**
     * Announcement addressed to every active user; the recipient stays empty until fan-out.
     */
    public static NotificationDraft systemAnnouncement(String title, String message, NotificationPriority priority) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("announcement_type", "system");

        return NotificationDraft.builder()
                .type(NotificationType.ANNOUNCEMENT)
                .priority(priority != null ? priority : NotificationPriority.MEDIUM)
                .title(title)
                .message(message)
                .relatedEntity(related(SYSTEM_ANNOUNCEMENT, null, metadata))
                .build();
    }

    private static RelatedEntity related(String type, String id, Map<String, Object> metadata) {
        return RelatedEntity.builder()
                .entityType(type)
                .entityId(id)
                .metadata(Collections.unmodifiableMap(metadata))
                .build();
    }

    private static String title(String title) {
        return shorten(title, Notification.MAX_TITLE_LENGTH);
    }

    private static String message(String message) {
        return shorten(message, Notification.MAX_MESSAGE_LENGTH);
    }

    private static String shorten(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
