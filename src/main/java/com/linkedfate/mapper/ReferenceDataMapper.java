package com.linkedfate.mapper;

import com.linkedfate.domain.model.Indicator;
import com.linkedfate.domain.model.Region;
import com.linkedfate.domain.model.Station;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.RegionEntity;
import com.linkedfate.entity.StationEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** Read-only mappings for the indicator, station and region lookup tables. */
@Mapper
public interface ReferenceDataMapper {

    Indicator toDomain(IndicatorEntity entity);

    Station toDomain(StationEntity entity);

    Region toDomain(RegionEntity entity);

    List<Indicator> toIndicators(List<IndicatorEntity> entities);

    List<Station> toStations(List<StationEntity> entities);
}
