package com.opsdash.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Contract for project.updated events.
 *
 * Published by the project tracker on progress, budget or status changes.
 * recipientIds lists the project members who should be notified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectUpdatedContract {
    private String projectId;
    private String name;
    private ProjectUpdateType updateType;
    private Integer progress;   // percent, set for PROGRESS updates
    private String status;      // set for STATUS updates
    private Instant updatedAt;
    private List<String> recipientIds;
}
