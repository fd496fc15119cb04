package com.company.radar.service.run;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Runs executing on this instance. On shutdown every one of them is marked
 * interrupted before the data source goes away, so no run stays "running"
 * until the reaper finds it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LocalRunRegistry {

    static final String SHUTDOWN_REASON = "Interrupted (worker shutdown)";

    private final RunLockService runLockService;

    private final Object lock = new Object();
    private final Set<LocalRun> active = new LinkedHashSet<>();

    public void register(UUID accountId, UUID runId) {
        synchronized (lock) {
            active.add(new LocalRun(accountId, runId));
        }
    }

    public void unregister(UUID accountId, UUID runId) {
        synchronized (lock) {
            active.remove(new LocalRun(accountId, runId));
        }
    }

    public List<LocalRun> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(active);
        }
    }

    @PreDestroy
    public void markInterrupted() {
        List<LocalRun> runs = snapshot();
        if (runs.isEmpty()) {
            return;
        }

        log.warn("Shutting down with {} active run(s), marking them interrupted", runs.size());
        for (LocalRun run : runs) {
            try {
                runLockService.terminate(run.getAccountId(), run.getRunId(), SHUTDOWN_REASON);
            } catch (Exception e) {
                log.error("Failed to mark run {} interrupted, the reaper will close it", run.getRunId(), e);
            }
        }
    }

    @Value
    public static class LocalRun {
        UUID accountId;
        UUID runId;
    }
}
