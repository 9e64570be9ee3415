package com.opsdash.realtimeservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Business record a notification points at, e.g. a workflow instance or a project.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedEntity {
    private String entityType;
    private String entityId;
    private Map<String, Object> metadata;
}
