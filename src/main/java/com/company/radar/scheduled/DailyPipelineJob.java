package com.company.radar.scheduled;

import com.company.radar.domain.Account;
import com.company.radar.exception.PipelineAlreadyRunningException;
import com.company.radar.repository.AccountRepository;
import com.company.radar.service.pipeline.PipelineLauncher;
import com.company.radar.service.run.RunLockService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the pipeline for every account once a day. The run lock is taken on
 * the worker thread, so queued accounts do not hold a lock while waiting.
 * The scheduler thread only queues the accounts; it never waits on a run.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "radar.jobs.daily-pipeline.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class DailyPipelineJob {

    private final AccountRepository accountRepository;
    private final RunLockService runLockService;
    private final PipelineLauncher pipelineLauncher;
    private final TaskExecutor pipelineExecutor;
    private final MeterRegistry meterRegistry;

    public DailyPipelineJob(AccountRepository accountRepository,
                            RunLockService runLockService,
                            PipelineLauncher pipelineLauncher,
                            @Qualifier("pipelineExecutor") TaskExecutor pipelineExecutor,
                            MeterRegistry meterRegistry) {
        this.accountRepository = accountRepository;
        this.runLockService = runLockService;
        this.pipelineLauncher = pipelineLauncher;
        this.pipelineExecutor = pipelineExecutor;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(cron = "${radar.jobs.daily-pipeline.cron:0 0 4 * * *}")
    public void runAllAccounts() {
        launchAll();
    }

    /**
     * Queue every account on the pipeline pool and return without waiting, so
     * the scheduler thread stays free for the dispatch and retention jobs. The
     * summary is recorded once the last account finishes.
     */
    CompletableFuture<Void> launchAll() {
        List<Account> accounts = accountRepository.findAll();
        log.info("Daily pipeline starting for {} accounts", accounts.size());

        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Account account : accounts) {
            try {
                futures.add(CompletableFuture.runAsync(
                        () -> runAccount(account, succeeded, skipped, failed), pipelineExecutor));
            } catch (TaskRejectedException e) {
                log.error("Worker pool rejected account {}, skipping until next cycle", account.getId());
                failed.incrementAndGet();
            }
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> {
                    meterRegistry.counter("radar.cron.accounts", "outcome", "succeeded").increment(succeeded.get());
                    meterRegistry.counter("radar.cron.accounts", "outcome", "skipped").increment(skipped.get());
                    meterRegistry.counter("radar.cron.accounts", "outcome", "failed").increment(failed.get());

                    log.info("Daily pipeline summary: total={} succeeded={} skipped={} failed={}",
                            accounts.size(), succeeded.get(), skipped.get(), failed.get());
                });
    }

    void runAccount(Account account, AtomicInteger succeeded, AtomicInteger skipped, AtomicInteger failed) {
        UUID accountId = account.getId();
        UUID runId;
        try {
            runId = runLockService.start(accountId);
        } catch (PipelineAlreadyRunningException e) {
            log.warn("Skipping account {}: pipeline already active", accountId);
            skipped.incrementAndGet();
            return;
        }

        try {
            pipelineLauncher.execute(accountId, runId);
        } catch (Exception e) {
            log.error("Pipeline for account {} failed", accountId, e);
            failed.incrementAndGet();
            return;
        }

        // Auth failures close the run with an error without throwing
        boolean clean = runLockService.findRun(accountId, runId)
                .map(run -> run.getError() == null)
                .orElse(false);
        if (clean) {
            succeeded.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
    }
}
