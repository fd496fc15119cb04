package com.company.radar.service.run;

import com.company.radar.config.RadarProperties;
import com.company.radar.domain.PipelineRun;
import com.company.radar.exception.PipelineAlreadyRunningException;
import com.company.radar.repository.PipelineRunRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-flight lock and progress tracker for account pipelines. The lock is
 * the running row itself; the database enforces one per account.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RunLockService {

    static final int MAX_ERROR_LENGTH = 2000;

    private final PipelineRunRepository runRepository;
    private final RadarProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Reap stale runs of the account, then open a new running run.
     *
     * @throws PipelineAlreadyRunningException when a live run already holds the lock
     */
    public UUID start(UUID accountId) {
        Instant now = Instant.now();
        reapStale(accountId, now);

        UUID runId;
        try {
            runId = runRepository.insertRunning(accountId, now);
        } catch (DuplicateKeyException e) {
            log.info("Pipeline already running for account {}", accountId);
            meterRegistry.counter("radar.pipeline.start.rejected").increment();
            throw new PipelineAlreadyRunningException(accountId);
        }

        meterRegistry.counter("radar.pipeline.started").increment();
        log.info("Pipeline run {} started for account {}", runId, accountId);
        return runId;
    }

    /**
     * Apply a state update to the run if it is still running. Never throws on a
     * closed run.
     *
     * @return false when the run was already closed by someone else
     */
    public boolean update(UUID accountId, UUID runId, RunStateUpdate update) {
        int updated = runRepository.updateIfRunning(accountId, runId, truncate(update), Instant.now());
        if (updated == 0) {
            log.warn("Run {} of account {} is no longer running, update ignored", runId, accountId);
            return false;
        }
        return true;
    }

    public boolean isActive(UUID accountId, UUID runId) {
        return runRepository.isRunning(accountId, runId);
    }

    /**
     * Latest run of the account after a reap pass, so a dead run never reports as running.
     */
    public Optional<PipelineRun> currentStatus(UUID accountId) {
        reapStale(accountId, Instant.now());
        return runRepository.findLatest(accountId);
    }

    public Optional<PipelineRun> findRun(UUID accountId, UUID runId) {
        return runRepository.findById(accountId, runId);
    }

    public boolean complete(UUID accountId, UUID runId) {
        boolean closed = update(accountId, runId, RunStateUpdate.completed());
        if (closed) {
            meterRegistry.counter("radar.pipeline.completed", "outcome", "success").increment();
        }
        return closed;
    }

    public boolean fail(UUID accountId, UUID runId, String error) {
        boolean closed = update(accountId, runId, RunStateUpdate.failed(error));
        if (closed) {
            meterRegistry.counter("radar.pipeline.completed", "outcome", "failed").increment();
        }
        return closed;
    }

    /**
     * Close a run from outside its worker: external stop, executor rejection or shutdown.
     */
    public boolean terminate(UUID accountId, UUID runId, String reason) {
        boolean closed = update(accountId, runId, RunStateUpdate.builder()
                .currentStep("Terminated")
                .error(reason)
                .finish(true)
                .build());
        if (closed) {
            log.warn("Run {} of account {} terminated: {}", runId, accountId, reason);
            meterRegistry.counter("radar.pipeline.completed", "outcome", "terminated").increment();
        }
        return closed;
    }

    private void reapStale(UUID accountId, Instant now) {
        RadarProperties.Pipeline pipeline = properties.getPipeline();
        int reaped = runRepository.reapStale(accountId, now,
                now.minus(pipeline.getHeartbeatTimeout()),
                now.minus(pipeline.getHardTimeout()));
        if (reaped > 0) {
            log.warn("Reaped {} stale run(s) for account {}", reaped, accountId);
            meterRegistry.counter("radar.pipeline.reaped").increment(reaped);
        }
    }

    private RunStateUpdate truncate(RunStateUpdate update) {
        String error = update.getError();
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return update;
        }
        return RunStateUpdate.builder()
                .currentStep(update.getCurrentStep())
                .progressCurrent(update.getProgressCurrent())
                .progressTotal(update.getProgressTotal())
                .error(error.substring(0, MAX_ERROR_LENGTH))
                .finish(update.isFinish())
                .build();
    }
}
