package com.linkedfate.mapper;

import com.linkedfate.domain.model.Anomaly;
import com.linkedfate.entity.AnomalyEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface AnomalyMapper {

    AnomalyEntity toEntity(Anomaly anomaly);

    Anomaly toDomain(AnomalyEntity entity);

    List<Anomaly> toDomainList(List<AnomalyEntity> entities);
}
