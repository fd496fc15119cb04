package com.company.radar.service.ingestion;

import com.company.radar.client.UpstreamCredentialService;
import com.company.radar.domain.Property;
import com.company.radar.exception.UpstreamAuthException;
import com.company.radar.service.run.CancellationChecker;
import com.company.radar.service.run.RunLockService;
import com.company.radar.service.run.RunStateUpdate;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Sequential per-property ingestion of the site, page and device sources. A
 * property that fails any source is left out of the safe set; the run goes on.
 */
@Service
@Slf4j
public class IngestionOrchestrator {

    private final IngestionWindowPlanner windowPlanner;
    private final UpstreamCredentialService credentialService;
    private final List<MetricIngestor> ingestors;
    private final RunLockService runLockService;
    private final CancellationChecker cancellationChecker;
    private final MeterRegistry meterRegistry;

    public IngestionOrchestrator(IngestionWindowPlanner windowPlanner,
                                 UpstreamCredentialService credentialService,
                                 SiteMetricIngestor siteIngestor,
                                 PageMetricIngestor pageIngestor,
                                 DeviceMetricIngestor deviceIngestor,
                                 RunLockService runLockService,
                                 CancellationChecker cancellationChecker,
                                 MeterRegistry meterRegistry) {
        this.windowPlanner = windowPlanner;
        this.credentialService = credentialService;
        // Site first: detection depends on it
        this.ingestors = List.of(siteIngestor, pageIngestor, deviceIngestor);
        this.runLockService = runLockService;
        this.cancellationChecker = cancellationChecker;
        this.meterRegistry = meterRegistry;
    }

    /**
     * The access token is resolved again for every property, so a run outliving
     * the token's lifetime picks up a refreshed one.
     *
     * @throws UpstreamAuthException when credentials are rejected; fatal for the run
     */
    public IngestionResult ingest(UUID accountId, UUID runId, List<Property> properties) {
        IngestionResult result = new IngestionResult();
        LocalDate today = LocalDate.now();
        int total = properties.size();

        for (int i = 0; i < total; i++) {
            Property property = properties.get(i);

            if (cancellationChecker.shouldBailOut(accountId, runId, "ingestion of " + property.getBaseDomain())) {
                result.markCancelled();
                return result;
            }

            runLockService.update(accountId, runId,
                    RunStateUpdate.progress("Ingesting " + property.getBaseDomain(), i, total));

            String accessToken = credentialService.getAccessToken(accountId);
            try {
                ingestProperty(accessToken, property, today);
                result.addSafe(property);
                meterRegistry.counter("radar.ingestion.properties", "outcome", "success").increment();

            } catch (UpstreamAuthException e) {
                throw e;

            } catch (Exception e) {
                log.error("Ingestion failed for property {}, excluding it from this run", property.getBaseDomain(), e);
                result.addFailed(property);
                meterRegistry.counter("radar.ingestion.properties", "outcome", "failed").increment();
            }
        }

        runLockService.update(accountId, runId, RunStateUpdate.progress("Ingestion complete", total, total));
        log.info("Ingestion finished for account {}: {} safe, {} failed",
                accountId, result.getSafeProperties().size(), result.getFailedProperties().size());
        return result;
    }

    private void ingestProperty(String accessToken, Property property, LocalDate today) {
        IngestionWindow window = windowPlanner.plan(property.getId(), today);
        log.info("Ingesting {} ({} {}..{})", property.getBaseDomain(),
                window.getMode(), window.getStartDate(), window.getEndDate());

        for (MetricIngestor ingestor : ingestors) {
            ingestor.ingest(accessToken, property, window);
        }
    }
}
