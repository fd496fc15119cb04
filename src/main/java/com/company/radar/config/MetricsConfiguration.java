package com.company.radar.config;

import com.company.radar.repository.AlertDeliveryRepository;
import com.company.radar.repository.AlertRepository;
import com.company.radar.repository.PipelineRunRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * Backlog gauges read from the database on scrape.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final PipelineRunRepository runRepository;
    private final AlertRepository alertRepository;
    private final AlertDeliveryRepository deliveryRepository;

    @Bean
    public MeterBinder radarMetrics() {
        return (reg) -> {
            Gauge.builder("radar.pipeline.active", runRepository,
                            safely("running pipelines", PipelineRunRepository::countRunning))
                    .description("Number of pipeline runs currently marked running")
                    .register(reg);

            Gauge.builder("radar.alerts.pending", alertRepository,
                            safely("pending alerts", AlertRepository::countPending))
                    .description("Alerts not yet closed by the dispatcher")
                    .register(reg);

            Gauge.builder("radar.deliveries.unsent", deliveryRepository,
                            safely("unsent deliveries", AlertDeliveryRepository::countUnsent))
                    .description("Materialized deliveries still waiting to be sent")
                    .register(reg);

            log.info("Radar metrics registered");
        };
    }

    private static <T> ToDoubleFunction<T> safely(String what, ToIntFunction<T> count) {
        return repo -> {
            try {
                return count.applyAsInt(repo);
            } catch (Exception e) {
                log.warn("Failed to count {}", what, e);
                return 0;
            }
        };
    }
}
