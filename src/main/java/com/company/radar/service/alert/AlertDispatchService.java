package com.company.radar.service.alert;

import com.company.radar.config.RadarProperties;
import com.company.radar.domain.Alert;
import com.company.radar.domain.AlertDelivery;
import com.company.radar.repository.AlertDeliveryRepository;
import com.company.radar.repository.AlertRepository;
import com.company.radar.repository.AlertSubscriptionRepository;
import com.company.radar.service.email.AlertEmailComposer;
import com.company.radar.service.email.EmailMessage;
import com.company.radar.service.email.EmailProvider;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drives every pending alert through delivery. Each alert is re-evaluated on
 * every cycle, so retrying a failed send means running the next cycle.
 *
 * <p>Deliveries are claimed with a short lease before sending. Overlapping
 * cycles skip claimed rows, and no transaction is open while the provider is
 * called or while pacing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertDispatchService {

    private final AlertRepository alertRepository;
    private final AlertDeliveryRepository deliveryRepository;
    private final AlertSubscriptionRepository subscriptionRepository;
    private final EmailProvider emailProvider;
    private final AlertEmailComposer emailComposer;
    private final RadarProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Walk every pending alert, oldest first, a page at a time. Paging is keyed on
     * (triggered_at, id) so alerts that keep failing never hide newer ones.
     */
    public DispatchSummary dispatchPending() {
        DispatchSummary summary = new DispatchSummary();
        int pageSize = properties.getDispatch().getBatchSize();
        List<Alert> page = alertRepository.findPending(pageSize);

        if (page.isEmpty()) {
            log.debug("No pending alerts to dispatch");
            return summary;
        }

        log.info("Dispatching pending alerts through {}", emailProvider.name());

        while (!page.isEmpty()) {
            for (Alert alert : page) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Dispatcher interrupted, remaining alerts wait for the next cycle");
                    log.info("Dispatch cycle stopped: {}", summary);
                    return summary;
                }
                dispatchOne(alert, summary);
            }

            if (page.size() < pageSize) {
                break;
            }
            Alert last = page.get(page.size() - 1);
            page = alertRepository.findPendingAfter(last.getTriggeredAt(), last.getId(), pageSize);
        }

        log.info("Dispatch cycle completed: {}", summary);
        return summary;
    }

    private void dispatchOne(Alert alert, DispatchSummary summary) {
        MDC.put("accountId", String.valueOf(alert.getAccountId()));
        try {
            processAlert(alert, summary);
        } catch (Exception e) {
            log.error("Failed to dispatch alert {}, will retry next cycle", alert.getId(), e);
            summary.alertError();
        } finally {
            MDC.remove("accountId");
        }
    }

    void processAlert(Alert alert, DispatchSummary summary) {
        summary.alertProcessed();

        List<String> recipients = subscriptionRepository.findRecipients(alert.getAccountId(), alert.getPropertyId());

        if (recipients.isEmpty() && deliveryRepository.countByAlert(alert.getId()) == 0) {
            log.info("Alert {} has no subscribers, closing without sending", alert.getId());
            close(alert, summary);
            return;
        }

        for (String recipient : recipients) {
            deliveryRepository.insertIfAbsent(alert.getId(), alert.getAccountId(), recipient);
        }

        RadarProperties.Dispatch dispatch = properties.getDispatch();
        Instant now = Instant.now();
        List<AlertDelivery> claimed = deliveryRepository.claimUnsent(
                alert.getId(), now, now.plus(dispatch.getClaimLease()), dispatch.getBatchSize());

        String subject = null;
        String body = null;

        for (int i = 0; i < claimed.size(); i++) {
            AlertDelivery delivery = claimed.get(i);
            Instant cooldownSince = Instant.now().minus(dispatch.getCooldown());
            if (deliveryRepository.hasSentSince(alert.getAccountId(), alert.getPropertyId(),
                    delivery.getRecipient(), cooldownSince)) {
                deliveryRepository.markSuppressed(delivery.getId());
                summary.suppressed();
                meterRegistry.counter("radar.deliveries.suppressed").increment();
                log.info("Delivery {} to {} suppressed, recipient inside cooldown",
                        delivery.getId(), delivery.getRecipient());
                continue;
            }

            if (subject == null) {
                subject = emailComposer.subject(alert);
                body = emailComposer.body(alert);
            }

            if (summary.sendAttempts() > 0 && !pace(dispatch.getPacingDelay())) {
                for (AlertDelivery remaining : claimed.subList(i, claimed.size())) {
                    deliveryRepository.releaseClaim(remaining.getId());
                }
                break;
            }

            send(delivery, EmailMessage.builder()
                    .to(delivery.getRecipient())
                    .subject(subject)
                    .body(body)
                    .build(), summary);
        }

        if (deliveryRepository.countUnsentByAlert(alert.getId()) == 0) {
            close(alert, summary);
        } else {
            log.debug("Alert {} still has unsent deliveries, revisiting next cycle", alert.getId());
        }
    }

    private void send(AlertDelivery delivery, EmailMessage message, DispatchSummary summary) {
        boolean accepted;
        try {
            accepted = emailProvider.send(message);
        } catch (Exception e) {
            log.warn("Provider failed for delivery {} to {}: {}",
                    delivery.getId(), delivery.getRecipient(), e.getMessage());
            accepted = false;
        }

        if (accepted) {
            deliveryRepository.markSent(delivery.getId(), Instant.now());
            summary.sent();
            meterRegistry.counter("radar.deliveries.sent", "provider", emailProvider.name()).increment();
            log.info("Delivery {} sent to {}", delivery.getId(), delivery.getRecipient());
        } else {
            deliveryRepository.releaseClaim(delivery.getId());
            summary.failed();
            meterRegistry.counter("radar.deliveries.failed", "provider", emailProvider.name()).increment();
        }
    }

    private void close(Alert alert, DispatchSummary summary) {
        if (alertRepository.markClosed(alert.getAccountId(), alert.getId())) {
            summary.alertClosed();
            meterRegistry.counter("radar.alerts.closed").increment();
            log.info("Alert {} closed", alert.getId());
        }
    }

    /**
     * @return false when interrupted; the cycle should stop
     */
    private boolean pace(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
