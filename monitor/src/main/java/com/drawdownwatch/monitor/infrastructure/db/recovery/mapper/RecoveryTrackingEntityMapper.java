package com.drawdownwatch.monitor.infrastructure.db.recovery.mapper;

import com.drawdownwatch.monitor.domain.recovery.RecoveryTrackingState;
import com.drawdownwatch.monitor.infrastructure.db.recovery.RecoveryTrackingEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface RecoveryTrackingEntityMapper {

    @Mapping(target = "updatedAt", ignore = true)
    RecoveryTrackingEntity toEntity(RecoveryTrackingState state);

    RecoveryTrackingState toDomain(RecoveryTrackingEntity entity);
}
