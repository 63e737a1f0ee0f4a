package com.drawdownwatch.monitor.infrastructure.db.alert.mapper;

import com.drawdownwatch.monitor.domain.alert.Alert;
import com.drawdownwatch.monitor.infrastructure.db.alert.AlertEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface AlertEntityMapper {

    AlertEntity toEntity(Alert alert);

    Alert toDomain(AlertEntity entity);
}
