package com.company.radar.scheduled;

import com.company.radar.config.RadarProperties;
import com.company.radar.repository.AlertRepository;
import com.company.radar.repository.PipelineRunRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Prunes finished runs and closed alerts past the retention period.
 * Running runs and alerts with pending deliveries are never touched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "radar.jobs.retention.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class HistoryRetentionJob {

    private final PipelineRunRepository runRepository;
    private final AlertRepository alertRepository;
    private final RadarProperties properties;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${radar.jobs.retention.cron:0 0 2 * * SUN}")
    public void pruneHistory() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(properties.getRetention().getDays()));
        log.info("Pruning history older than {}", cutoff);

        try {
            int runs = runRepository.deleteFinishedBefore(cutoff);
            int alerts = alertRepository.deleteClosedBefore(cutoff);

            meterRegistry.counter("radar.retention.deleted", "table", "pipeline_runs").increment(runs);
            meterRegistry.counter("radar.retention.deleted", "table", "alerts").increment(alerts);
            log.info("Pruned {} pipeline runs and {} closed alerts", runs, alerts);
        } catch (Exception e) {
            log.error("History pruning failed", e);
            meterRegistry.counter("radar.retention.failures").increment();
        }
    }
}
