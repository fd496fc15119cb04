package com.company.radar.service.analysis;

import com.company.radar.config.RadarProperties;
import com.company.radar.domain.DailyMetric;
import com.company.radar.domain.Property;
import com.company.radar.domain.enums.ChangeClass;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.repository.DailyMetricRepository;
import com.company.radar.util.MetricUtils;
import com.company.radar.util.WindowAggregate;
import com.company.radar.util.WindowSplit;
import com.company.radar.util.WindowUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Set-based visibility analysis over a keyed metric source. Stateless; every
 * call reads its own rows through the repository.
 */
@Slf4j
public class DimensionVisibilityAnalyzer implements VisibilityAnalyzer {

    private final MetricSource dimension;
    private final DailyMetricRepository metricRepository;
    private final RadarProperties properties;

    public DimensionVisibilityAnalyzer(MetricSource dimension,
                                       DailyMetricRepository metricRepository,
                                       RadarProperties properties) {
        if (!dimension.isKeyed()) {
            throw new IllegalArgumentException("Visibility analysis needs a keyed source, got " + dimension);
        }
        this.dimension = dimension;
        this.metricRepository = metricRepository;
        this.properties = properties;
    }

    @Override
    public MetricSource dimension() {
        return dimension;
    }

    @Override
    public VisibilityReport analyze(UUID accountId, Property property) {
        LocalDate since = LocalDate.now().minusDays(properties.getIngestion().getBackfillDays());
        List<DailyMetric> rows = metricRepository.findSince(dimension, accountId, property.getId(), since);

        VisibilityReport report = VisibilityReport.builder()
                .propertyId(property.getId())
                .siteUrl(property.getSiteUrl())
                .dimension(dimension)
                .build();

        if (rows.isEmpty()) {
            report.setInsufficientData(true);
            return report;
        }

        WindowSplit split = WindowUtils.split(rows, properties.getIngestion().getHalfWindowDays());
        report.setAnchorDate(split.getAnchorDate());

        Map<String, List<DailyMetric>> lastByKey = groupByKey(split.getLast());
        Map<String, List<DailyMetric>> prevByKey = groupByKey(split.getPrevious());

        Set<String> keys = new TreeSet<>(lastByKey.keySet());
        keys.addAll(prevByKey.keySet());

        int continuing = 0;
        for (String key : keys) {
            List<DailyMetric> lastRows = lastByKey.getOrDefault(key, List.of());
            List<DailyMetric> prevRows = prevByKey.getOrDefault(key, List.of());
            DimensionDelta delta = delta(key, lastRows, prevRows);

            ChangeClass changeClass = classify(lastRows.isEmpty(), prevRows.isEmpty(), delta.getDeltaPct());
            if (!lastRows.isEmpty() && !prevRows.isEmpty()) {
                continuing++;
            }
            if (changeClass == null) {
                report.getStable().add(delta);
            } else if (changeClass == ChangeClass.NEW) {
                report.getNewKeys().add(delta);
            } else if (changeClass == ChangeClass.LOST) {
                report.getLostKeys().add(delta);
            } else if (changeClass == ChangeClass.GAIN) {
                report.getGains().add(delta);
            } else {
                report.getDrops().add(delta);
            }
        }
        report.setContinuingCount(continuing);

        // Biggest losers first
        report.getLostKeys().sort(Comparator.comparingLong(DimensionDelta::getPrevImpressions).reversed());
        report.getDrops().sort(Comparator.comparingDouble(DimensionDelta::getDeltaPct));
        report.getGains().sort(Comparator.comparingDouble(DimensionDelta::getDeltaPct).reversed());

        return report;
    }

    /**
     * Null when a continuing key moved less than the significance threshold.
     */
    ChangeClass classify(boolean absentInLast, boolean absentInPrevious, double deltaPct) {
        if (absentInPrevious) {
            return ChangeClass.NEW;
        }
        if (absentInLast) {
            return ChangeClass.LOST;
        }
        double threshold = properties.getDetection().getSignificantChangePct();
        if (deltaPct >= threshold) {
            return ChangeClass.GAIN;
        }
        if (deltaPct <= -threshold) {
            return ChangeClass.DROP;
        }
        return null;
    }

    private DimensionDelta delta(String key, List<DailyMetric> lastRows, List<DailyMetric> prevRows) {
        WindowAggregate last = WindowUtils.aggregate(lastRows);
        WindowAggregate prev = WindowUtils.aggregate(prevRows);
        return DimensionDelta.builder()
                .key(key)
                .lastImpressions(last.getImpressions())
                .prevImpressions(prev.getImpressions())
                .lastClicks(last.getClicks())
                .prevClicks(prev.getClicks())
                .lastCtr(MetricUtils.round(last.getCtr(), 4))
                .prevCtr(MetricUtils.round(prev.getCtr(), 4))
                .deltaPct(MetricUtils.safeDeltaPct(last.getImpressions(), prev.getImpressions()))
                .clicksDeltaPct(MetricUtils.safeDeltaPct(last.getClicks(), prev.getClicks()))
                .ctrDeltaPct(MetricUtils.safeDeltaPct(last.getCtr(), prev.getCtr()))
                .build();
    }

    private Map<String, List<DailyMetric>> groupByKey(List<DailyMetric> rows) {
        return rows.stream()
                .filter(row -> row.getDimensionKey() != null)
                .collect(Collectors.groupingBy(DailyMetric::getDimensionKey, TreeMap::new, Collectors.toList()));
    }
}
