package com.opsdash.realtimeservice.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.realtimeservice.dto.RelatedEntity;
import com.opsdash.realtimeservice.model.Notification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mapstruct.Named;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts between the flattened related-entity columns of {@link Notification} and
 * {@link RelatedEntity}. Metadata is stored as a JSON object in a TEXT column.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelatedEntityConverter {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Named("toRelatedEntity")
    public RelatedEntity toRelatedEntity(Notification notification) {
        if (notification.getRelatedEntityType() == null && notification.getRelatedEntityId() == null) {
            return null;
        }
        return RelatedEntity.builder()
                .entityType(notification.getRelatedEntityType())
                .entityId(notification.getRelatedEntityId())
                .metadata(readMetadata(notification.getMetadata()))
                .build();
    }

    public Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable notification metadata, ignoring: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    public String writeMetadata(Map<String, Object> metadata) throws JsonProcessingException {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        return objectMapper.writeValueAsString(metadata);
    }
}
