package com.livestockmart.marketplace.mapper;

import com.livestockmart.marketplace.dto.NotificationDto;
import com.livestockmart.marketplace.model.Notification;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface NotificationMapper {

    @Mapping(target = "color", expression = "java(notification.getSeverity() != null ? notification.getSeverity().getColor() : null)")
    NotificationDto toDto(Notification notification);
}
