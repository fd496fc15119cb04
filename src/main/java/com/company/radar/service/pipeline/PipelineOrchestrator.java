package com.company.radar.service.pipeline;

import com.company.radar.client.UpstreamCredentialService;
import com.company.radar.domain.Property;
import com.company.radar.event.PipelineCompletedEvent;
import com.company.radar.exception.UpstreamAuthException;
import com.company.radar.repository.AccountRepository;
import com.company.radar.service.alert.AlertDetectionService;
import com.company.radar.service.analysis.AnalysisStage;
import com.company.radar.service.ingestion.IngestionOrchestrator;
import com.company.radar.service.ingestion.IngestionResult;
import com.company.radar.service.ingestion.PropertySyncService;
import com.company.radar.service.run.CancellationChecker;
import com.company.radar.service.run.RunLockService;
import com.company.radar.service.run.RunStateUpdate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One account run: authenticate, sync properties, ingest, analyze, detect.
 * The caller must already hold the run lock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineOrchestrator {

    static final String NO_SAFE_PROPERTIES_STEP = "Pipeline finished (no properties ingested successfully)";

    private final RunLockService runLockService;
    private final CancellationChecker cancellationChecker;
    private final UpstreamCredentialService credentialService;
    private final PropertySyncService propertySyncService;
    private final IngestionOrchestrator ingestionOrchestrator;
    private final AnalysisStage analysisStage;
    private final AlertDetectionService alertDetectionService;
    private final AccountRepository accountRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public void run(UUID accountId, UUID runId) {
        MDC.put("accountId", accountId.toString());
        MDC.put("runId", runId.toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Pipeline run {} starting for account {}", runId, accountId);

        try {
            runLockService.update(accountId, runId, RunStateUpdate.step("Authenticating"));
            String accessToken = credentialService.getAccessToken(accountId);

            if (cancellationChecker.shouldBailOut(accountId, runId, "property sync")) {
                return;
            }
            runLockService.update(accountId, runId, RunStateUpdate.step("Syncing properties"));
            List<Property> properties = propertySyncService.sync(accountId, accessToken);

            if (cancellationChecker.shouldBailOut(accountId, runId, "ingestion")) {
                return;
            }
            runLockService.update(accountId, runId, RunStateUpdate.progress("Ingesting metrics", 0, properties.size()));
            IngestionResult ingestion = ingestionOrchestrator.ingest(accountId, runId, properties);
            if (ingestion.isCancelled()) {
                return;
            }

            List<Property> safe = ingestion.getSafeProperties();
            if (safe.isEmpty()) {
                log.warn("No property ingested successfully, ending run early");
                runLockService.update(accountId, runId, RunStateUpdate.builder()
                        .currentStep(NO_SAFE_PROPERTIES_STEP)
                        .finish(true)
                        .build());
                return;
            }

            if (cancellationChecker.shouldBailOut(accountId, runId, "analysis")) {
                return;
            }
            runLockService.update(accountId, runId, RunStateUpdate.step("Running visibility analysis"));
            analysisStage.run(accountId, safe);

            if (cancellationChecker.shouldBailOut(accountId, runId, "alert detection")) {
                return;
            }
            runLockService.update(accountId, runId, RunStateUpdate.step("Detecting alerts"));
            int triggered = alertDetectionService.detectAll(accountId, safe);

            if (runLockService.complete(accountId, runId)) {
                accountRepository.markDataInitialized(accountId);
                eventPublisher.publishEvent(new PipelineCompletedEvent(accountId, runId,
                        safe.stream().map(Property::getId).collect(Collectors.toList())));
                log.info("Pipeline run {} completed: {} properties, {} alert(s) triggered",
                        runId, safe.size(), triggered);
            }

        } catch (UpstreamAuthException e) {
            // Not retried within the run; the next scheduled run starts from scratch
            log.error("Authentication failed for account {}: {}", accountId, e.getMessage());
            runLockService.fail(accountId, runId, e.getMessage());

        } catch (RuntimeException e) {
            log.error("Pipeline run {} failed", runId, e);
            try {
                runLockService.fail(accountId, runId, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            } catch (Exception cleanup) {
                log.warn("Failed to mark run {} as failed, the reaper will close it", runId, cleanup);
            }
            throw e;

        } finally {
            sample.stop(meterRegistry.timer("radar.pipeline.duration"));
            MDC.remove("runId");
            MDC.remove("accountId");
        }
    }
}
