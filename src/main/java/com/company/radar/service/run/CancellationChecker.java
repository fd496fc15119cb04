package com.company.radar.service.run;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Checked at phase boundaries and before each property. A run closed by the
 * reaper, an external stop or shutdown stops at the next check point.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CancellationChecker {

    private final RunLockService runLockService;

    public boolean shouldBailOut(UUID accountId, UUID runId, String checkpoint) {
        if (runLockService.isActive(accountId, runId)) {
            return false;
        }
        log.warn("Run {} of account {} is no longer active, stopping at {}", runId, accountId, checkpoint);
        return true;
    }
}
