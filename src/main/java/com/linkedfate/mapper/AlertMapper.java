package com.linkedfate.mapper;

import com.linkedfate.domain.model.Alert;
import com.linkedfate.domain.payload.AlertPayload;
import com.linkedfate.entity.AlertEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Alert domain model and AlertEntity.
 *
 * <p>The payload is a typed {@link AlertPayload} in the domain and a JSON string in the
 * entity. {@code levelRank} is derived from the level's ordinal on the way in.
 */
@Mapper
public interface AlertMapper {

    @Mapping(source = "alertId", target = "id")
    @Mapping(source = "payload", target = "payload", qualifiedByName = "payloadToJson")
    @Mapping(target = "levelRank", expression = "java(alert.getAlertLevel().ordinal())")
    AlertEntity toEntity(Alert alert);

    @Mapping(source = "id", target = "alertId")
    @Mapping(source = "payload", target = "payload", qualifiedByName = "jsonToPayload")
    Alert toDomain(AlertEntity entity);

    List<Alert> toDomainList(List<AlertEntity> entities);

    List<AlertEntity> toEntityList(List<Alert> alerts);

    @Named("payloadToJson")
    default String payloadToJson(AlertPayload payload) {
        return JsonHelper.toJson(payload);
    }

    @Named("jsonToPayload")
    default AlertPayload jsonToPayload(String json) {
        return JsonHelper.fromJson(json, AlertPayload.class);
    }
}
