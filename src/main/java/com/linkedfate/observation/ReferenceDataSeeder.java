package com.linkedfate.observation;

import com.linkedfate.correlation.LinkedFateRuleTable;
import com.linkedfate.correlation.SignalSnapshotReader;
import com.linkedfate.entity.IndicatorEntity;
import com.linkedfate.entity.RegionEntity;
import com.linkedfate.entity.StationEntity;
import com.linkedfate.evaluator.GridRiskEvaluator;
import com.linkedfate.evaluator.PortRiskEvaluator;
import com.linkedfate.evaluator.WaterRiskEvaluator;
import com.linkedfate.repository.jpa.IndicatorJpaRepository;
import com.linkedfate.repository.jpa.RegionJpaRepository;
import com.linkedfate.repository.jpa.StationJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Registers the indicators, stations and region the engine reads by code, if missing.
 * Existing rows are left untouched, so ingestors may rename or extend them.
 *
 * <p>Station conventions: equity stations use the ticker as external id, sentiment buckets
 * use the domain code (GRID, WATR, FLOW), forecast locations use a {@code FCST-} prefix.
 */
@Component
@ConditionalOnProperty(prefix = "linkedfate.reference", name = "seed-enabled", havingValue = "true", matchIfMissing = true)
public class ReferenceDataSeeder implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataSeeder.class);

    private static final String REGION = "US-TX";

    private final IndicatorJpaRepository indicatorJpaRepository;
    private final StationJpaRepository stationJpaRepository;
    private final RegionJpaRepository regionJpaRepository;

    public ReferenceDataSeeder(
            IndicatorJpaRepository indicatorJpaRepository,
            StationJpaRepository stationJpaRepository,
            RegionJpaRepository regionJpaRepository) {
        this.indicatorJpaRepository = indicatorJpaRepository;
        this.stationJpaRepository = stationJpaRepository;
        this.regionJpaRepository = regionJpaRepository;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        seed();
    }

    public int seed() {
        int created = 0;
        Long regionId = regionJpaRepository
                .findByCode(REGION)
                .orElseGet(() -> regionJpaRepository.save(RegionEntity.builder()
                        .code(REGION)
                        .name("Texas")
                        .regionType("state")
                        .build()))
                .getId();

        created += indicator(GridRiskEvaluator.DEMAND, "ERCOT System Demand", "energy", "MW", "GRID");
        created += indicator(GridRiskEvaluator.GENERATION, "ERCOT Net Generation", "energy", "MW", "GRID");
        created += indicator(WaterRiskEvaluator.GW_LEVEL, "Groundwater Level", "water", "ft", "WATR");
        created += indicator(PortRiskEvaluator.WAITING, "Vessels Waiting", "logistics", "count", "FLOW");
        created += indicator(PortRiskEvaluator.DWELL, "Vessel Dwell Time", "logistics", "hours", "FLOW");
        created += indicator(SignalSnapshotReader.EQUITY_CHANGE_PCT, "Equity Daily Change", "market", "%", "MRKT");
        created += indicator(SignalSnapshotReader.NEWS_SENTIMENT, "News Sentiment", "news", "score", "NEWS");
        created += indicator(LinkedFateRuleTable.FORECAST_MAX_TEMP, "Forecast High (48h)", "weather", "F", "WTHR");
        created += indicator(LinkedFateRuleTable.FORECAST_MIN_TEMP, "Forecast Low (48h)", "weather", "F", "WTHR");
        created += indicator(LinkedFateRuleTable.FORECAST_STORM_ALERT, "Storm Alert Level", "weather", "level", "WTHR");

        created += station("ERCOT", "ERCOT System", "grid_zone", regionId);
        created += station("HOU", "Port of Houston", "port", regionId);
        created += station("VST", "Vistra Corp", "equity", null);
        created += station("NRG", "NRG Energy", "equity", null);
        created += station("TXN", "Texas Instruments", "equity", null);
        created += station("GRID", "Grid news", "sentiment", regionId);
        created += station("WATR", "Water news", "sentiment", regionId);
        created += station("FLOW", "Port news", "sentiment", regionId);
        created += station("FCST-HOU", "Houston", "forecast_point", regionId);
        created += station("FCST-DAL", "Dallas", "forecast_point", regionId);
        created += station("FCST-AUS", "Austin", "forecast_point", regionId);

        if (created > 0) {
            log.info("Reference data seeded: {} rows created", created);
        }
        return created;
    }

    private int indicator(String code, String name, String category, String unit, String functionCode) {
        if (indicatorJpaRepository.findByCode(code).isPresent()) {
            return 0;
        }
        indicatorJpaRepository.save(IndicatorEntity.builder()
                .code(code)
                .name(name)
                .category(category)
                .unit(unit)
                .functionCode(functionCode)
                .build());
        return 1;
    }

    private int station(String externalId, String name, String stationType, Long regionId) {
        if (stationJpaRepository.findByExternalId(externalId).isPresent()) {
            return 0;
        }
        stationJpaRepository.save(StationEntity.builder()
                .externalId(externalId)
                .name(name)
                .stationType(stationType)
                .regionId(regionId)
                .build());
        return 1;
    }
}
