package com.company.radar.scheduled;

import com.company.radar.service.alert.AlertDispatchService;
import com.company.radar.service.alert.DispatchSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic pass over pending alerts. Safe to run on several instances:
 * deliveries are claimed before they are sent.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "radar.jobs.dispatch.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AlertDispatchJob {

    private final AlertDispatchService dispatchService;

    @Scheduled(cron = "${radar.jobs.dispatch.cron:0 */15 * * * *}")
    public void dispatch() {
        log.debug("Checking for pending alerts");

        try {
            DispatchSummary summary = dispatchService.dispatchPending();
            log.info("Alert dispatch finished: {}", summary);
        } catch (Exception e) {
            log.error("Alert dispatch cycle failed", e);
        }
    }
}
