package com.company.radar.service.pipeline;

import com.company.radar.exception.AccountNotFoundException;
import com.company.radar.repository.AccountRepository;
import com.company.radar.service.run.LocalRunRegistry;
import com.company.radar.service.run.RunLockService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Hands account runs to the bounded pipeline pool and tracks them in the
 * local registry while they execute.
 */
@Service
@Slf4j
public class PipelineLauncher {

    static final String REJECTED_REASON = "Rejected: pipeline worker pool is saturated";
    static final String STOPPED_REASON = "Stopped on request";

    private final RunLockService runLockService;
    private final PipelineOrchestrator orchestrator;
    private final LocalRunRegistry localRunRegistry;
    private final AccountRepository accountRepository;
    private final TaskExecutor pipelineExecutor;

    public PipelineLauncher(RunLockService runLockService,
                            PipelineOrchestrator orchestrator,
                            LocalRunRegistry localRunRegistry,
                            AccountRepository accountRepository,
                            @Qualifier("pipelineExecutor") TaskExecutor pipelineExecutor) {
        this.runLockService = runLockService;
        this.orchestrator = orchestrator;
        this.localRunRegistry = localRunRegistry;
        this.accountRepository = accountRepository;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * Take the run lock now and queue the run.
     *
     * @throws com.company.radar.exception.PipelineAlreadyRunningException when a run is active
     * @throws TaskRejectedException when the pool is saturated; the run is closed with an error
     */
    public UUID start(UUID accountId) {
        if (!accountRepository.exists(accountId)) {
            throw new AccountNotFoundException(accountId);
        }

        UUID runId = runLockService.start(accountId);
        try {
            pipelineExecutor.execute(() -> execute(accountId, runId));
        } catch (TaskRejectedException e) {
            runLockService.terminate(accountId, runId, REJECTED_REASON);
            throw e;
        }
        return runId;
    }

    /**
     * Run on the calling thread with the lock already held.
     */
    public void execute(UUID accountId, UUID runId) {
        localRunRegistry.register(accountId, runId);
        try {
            orchestrator.run(accountId, runId);
        } finally {
            localRunRegistry.unregister(accountId, runId);
        }
    }

    public boolean stop(UUID accountId, UUID runId) {
        return runLockService.terminate(accountId, runId, STOPPED_REASON);
    }
}
