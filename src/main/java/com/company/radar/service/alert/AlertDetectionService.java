package com.company.radar.service.alert;

import com.company.radar.config.RadarProperties;
import com.company.radar.domain.Alert;
import com.company.radar.domain.DailyMetric;
import com.company.radar.domain.Property;
import com.company.radar.domain.enums.AlertType;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.repository.AlertRepository;
import com.company.radar.repository.DailyMetricRepository;
import com.company.radar.util.MetricUtils;
import com.company.radar.util.WindowSplit;
import com.company.radar.util.WindowUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sitewide impression-drop detection. Only records alerts; sending is the
 * dispatcher's job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertDetectionService {

    private final DailyMetricRepository metricRepository;
    private final AlertRepository alertRepository;
    private final RadarProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * @return number of alerts created
     */
    public int detectAll(UUID accountId, List<Property> safeProperties) {
        int triggered = 0;
        for (Property property : safeProperties) {
            if (detect(accountId, property).isPresent()) {
                triggered++;
            }
        }
        log.info("Alert detection for account {}: {} of {} properties triggered",
                accountId, triggered, safeProperties.size());
        return triggered;
    }

    public Optional<Alert> detect(UUID accountId, Property property) {
        Optional<ImpressionComparison> maybeComparison = compare(accountId, property);
        if (maybeComparison.isEmpty()) {
            log.debug("No site metrics for {}, nothing to evaluate", property.getBaseDomain());
            return Optional.empty();
        }

        ImpressionComparison comparison = maybeComparison.get();
        log.info("Evaluating {}: prev={} last={} delta={}", property.getBaseDomain(),
                comparison.getPrevious(), comparison.getLast(),
                MetricUtils.formatSignedPct(comparison.getDeltaPct()));

        if (!shouldTrigger(comparison)) {
            return Optional.empty();
        }

        Instant now = Instant.now();
        Instant dedupSince = now.minus(properties.getDetection().getDedupWindow());
        if (alertRepository.existsTriggeredSince(accountId, property.getId(), AlertType.IMPRESSION_DROP, dedupSince)) {
            log.info("Skipped {}: already alerted within {}", property.getBaseDomain(),
                    properties.getDetection().getDedupWindow());
            meterRegistry.counter("radar.alerts.deduplicated").increment();
            return Optional.empty();
        }

        Alert alert = alertRepository.insert(Alert.builder()
                .accountId(accountId)
                .propertyId(property.getId())
                .alertType(AlertType.IMPRESSION_DROP)
                .prevWindowValue(comparison.getPrevious())
                .lastWindowValue(comparison.getLast())
                .deltaPct(BigDecimal.valueOf(comparison.getDeltaPct()).setScale(2, RoundingMode.HALF_UP))
                .triggeredAt(now)
                .siteUrl(property.getSiteUrl())
                .build());

        meterRegistry.counter("radar.alerts.triggered", "type", AlertType.IMPRESSION_DROP.getCode()).increment();
        log.info("Triggered {} alert {} for {} (delta={})", AlertType.IMPRESSION_DROP.getCode(),
                alert.getId(), property.getBaseDomain(), MetricUtils.formatSignedPct(comparison.getDeltaPct()));
        return Optional.of(alert);
    }

    public Optional<ImpressionComparison> compare(UUID accountId, Property property) {
        LocalDate since = LocalDate.now().minusDays(properties.getIngestion().getBackfillDays());
        List<DailyMetric> rows = metricRepository.findSince(MetricSource.SITE, accountId, property.getId(), since);
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        WindowSplit split = WindowUtils.split(rows, properties.getIngestion().getHalfWindowDays());
        long last = WindowUtils.aggregate(split.getLast()).getImpressions();
        long previous = WindowUtils.aggregate(split.getPrevious()).getImpressions();

        return Optional.of(new ImpressionComparison(split.getAnchorDate(), previous, last,
                MetricUtils.safeDeltaPct(last, previous)));
    }

    /**
     * Noise floor on the previous window, then the drop threshold.
     */
    public boolean shouldTrigger(ImpressionComparison comparison) {
        RadarProperties.Detection detection = properties.getDetection();
        if (comparison.getPrevious() < detection.getNoiseFloor()) {
            return false;
        }
        return comparison.getDeltaPct() <= detection.getDropThresholdPct();
    }
}
