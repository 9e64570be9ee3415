package com.opsdash.realtimeservice.mapper;

import com.opsdash.realtimeservice.dto.NotificationDto;
import com.opsdash.realtimeservice.model.Notification;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        uses = RelatedEntityConverter.class,
        unmappedTargetPolicy = ReportingPolicy.IGNORE
)
public interface NotificationMapper {

    /**
     * Converts the entity to its DTO, folding the related-entity columns into one object.
     */
    @Mapping(target = "relatedEntity", source = "notification", qualifiedByName = "toRelatedEntity")
    NotificationDto toDto(Notification notification);
}
