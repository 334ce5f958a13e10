package com.linkedfate.mapper;

import com.linkedfate.domain.model.Observation;
import com.linkedfate.entity.ObservationEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface ObservationMapper {

    Observation toDomain(ObservationEntity entity);

    List<Observation> toDomainList(List<ObservationEntity> entities);

    @Mapping(target = "ingestedAt", ignore = true)
    ObservationEntity toEntity(Observation observation);
}
