package com.company.radar.service.ingestion;

import com.company.radar.config.RadarProperties;
import com.company.radar.domain.enums.IngestionMode;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.repository.DailyMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Chooses between a backfill and a single-day incremental fetch. A property is
 * caught up only when every source holds a full analysis window of distinct
 * dates ending at the last complete day.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionWindowPlanner {

    private final DailyMetricRepository metricRepository;
    private final RadarProperties properties;

    public IngestionWindow plan(UUID propertyId, LocalDate today) {
        RadarProperties.Ingestion ingestion = properties.getIngestion();
        LocalDate end = today.minusDays(ingestion.getLagDays());
        LocalDate checkFrom = end.minusDays(ingestion.getAnalysisWindowDays() - 1L);

        for (MetricSource source : MetricSource.values()) {
            int dates = metricRepository.countDistinctDates(source, propertyId, checkFrom, end);
            if (dates < ingestion.getAnalysisWindowDays()) {
                log.debug("Property {} has {}/{} dates for {}, backfilling",
                        propertyId, dates, ingestion.getAnalysisWindowDays(), source);
                return new IngestionWindow(IngestionMode.BACKFILL,
                        today.minusDays(ingestion.getBackfillDays()), end);
            }
        }

        return new IngestionWindow(IngestionMode.INCREMENTAL, end, end);
    }
}
