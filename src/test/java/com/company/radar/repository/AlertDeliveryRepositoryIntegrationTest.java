package com.company.radar.repository;

import com.company.radar.domain.Alert;
import com.company.radar.domain.AlertDelivery;
import com.company.radar.domain.enums.AlertType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AlertDeliveryRepositoryIntegrationTest extends BaseRepositoryIntegrationTest {

    @Autowired
    private PlatformTransactionManager transactionManager;

    private AlertDeliveryRepository deliveryRepository;
    private AlertRepository alertRepository;
    private UUID accountId;
    private UUID propertyId;

    @BeforeEach
    void setUp() {
        deliveryRepository = new AlertDeliveryRepository(jdbcTemplate);
        alertRepository = new AlertRepository(jdbcTemplate);
        accountId = createAccount("owner@example.com");
        propertyId = createProperty(accountId, "sc-domain:example.com");
    }

    @Test
    void shouldIgnoreDuplicateDeliveryForSameRecipient() {
        // given
        UUID alertId = insertAlert(Instant.now()).getId();

        // when
        boolean first = deliveryRepository.insertIfAbsent(alertId, accountId, "ops@example.com");
        boolean second = deliveryRepository.insertIfAbsent(alertId, accountId, "ops@example.com");
        boolean other = deliveryRepository.insertIfAbsent(alertId, accountId, "seo@example.com");

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(other).isTrue();
        assertThat(deliveryRepository.countByAlert(alertId)).isEqualTo(2);
    }

    @Test
    void shouldNotReclaimDeliveryWithinLease() {
        // given
        UUID alertId = insertAlert(Instant.now()).getId();
        deliveryRepository.insertIfAbsent(alertId, accountId, "ops@example.com");
        Instant now = Instant.now();

        // when
        List<AlertDelivery> first = deliveryRepository.claimUnsent(alertId, now, now.plus(Duration.ofMinutes(10)), 10);
        List<AlertDelivery> second = deliveryRepository.claimUnsent(alertId, now, now.plus(Duration.ofMinutes(10)), 10);
        List<AlertDelivery> afterLease =
                deliveryRepository.claimUnsent(alertId, now.plus(Duration.ofMinutes(11)), now.plus(Duration.ofMinutes(21)), 10);

        // then
        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        assertThat(afterLease).extracting(AlertDelivery::getRecipient).containsExactly("ops@example.com");
    }

    @Test
    void shouldSkipRowsLockedByConcurrentClaim() throws Exception {
        // given
        UUID alertId = insertAlert(Instant.now()).getId();
        deliveryRepository.insertIfAbsent(alertId, accountId, "a@example.com");
        deliveryRepository.insertIfAbsent(alertId, accountId, "b@example.com");
        Instant now = Instant.now();
        Instant leaseUntil = now.plus(Duration.ofMinutes(10));

        CountDownLatch claimed = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        CompletableFuture<List<AlertDelivery>> holder = CompletableFuture.supplyAsync(() ->
                transaction.execute(status -> {
                    List<AlertDelivery> rows = deliveryRepository.claimUnsent(alertId, now, leaseUntil, 1);
                    claimed.countDown();
                    try {
                        release.await(30, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return rows;
                }));
        assertThat(claimed.await(30, TimeUnit.SECONDS)).isTrue();

        // when
        List<AlertDelivery> concurrent = deliveryRepository.claimUnsent(alertId, now, leaseUntil, 10);
        release.countDown();
        List<AlertDelivery> held = holder.get(30, TimeUnit.SECONDS);

        // then
        assertThat(held).hasSize(1);
        assertThat(concurrent).hasSize(1);
        assertThat(concurrent.get(0).getId()).isNotEqualTo(held.get(0).getId());
    }

    @Test
    void shouldMarkSentOnlyOnce() {
        // given
        UUID alertId = insertAlert(Instant.now()).getId();
        deliveryRepository.insertIfAbsent(alertId, accountId, "ops@example.com");
        AlertDelivery delivery = deliveryRepository
                .claimUnsent(alertId, Instant.now(), Instant.now().plusSeconds(600), 10).get(0);

        // when
        boolean sent = deliveryRepository.markSent(delivery.getId(), Instant.now());
        boolean suppressedAfterSend = deliveryRepository.markSuppressed(delivery.getId());

        // then
        assertThat(sent).isTrue();
        assertThat(suppressedAfterSend).isFalse();
        assertThat(deliveryRepository.countUnsentByAlert(alertId)).isZero();
    }

    @Test
    void shouldApplyCooldownStrictlyAfterCutoff() {
        // given
        Instant sentAt = Instant.now().minus(Duration.ofDays(2)).truncatedTo(ChronoUnit.MICROS);
        UUID alertId = insertAlert(sentAt).getId();
        deliveryRepository.insertIfAbsent(alertId, accountId, "ops@example.com");
        AlertDelivery delivery = deliveryRepository
                .claimUnsent(alertId, Instant.now(), Instant.now().plusSeconds(600), 10).get(0);
        deliveryRepository.markSent(delivery.getId(), sentAt);

        // when / then
        assertThat(deliveryRepository.hasSentSince(accountId, propertyId, "ops@example.com",
                sentAt.minus(1, ChronoUnit.MICROS))).isTrue();
        assertThat(deliveryRepository.hasSentSince(accountId, propertyId, "ops@example.com", sentAt)).isFalse();
        assertThat(deliveryRepository.hasSentSince(accountId, propertyId, "seo@example.com",
                sentAt.minus(Duration.ofDays(1)))).isFalse();
        UUID otherProperty = createProperty(accountId, "https://example.com/");
        assertThat(deliveryRepository.hasSentSince(accountId, otherProperty, "ops@example.com",
                sentAt.minus(Duration.ofDays(1)))).isFalse();
    }

    @Test
    void shouldIgnoreSuppressedDeliveriesForCooldown() {
        // given
        UUID alertId = insertAlert(Instant.now()).getId();
        deliveryRepository.insertIfAbsent(alertId, accountId, "ops@example.com");
        AlertDelivery delivery = deliveryRepository
                .claimUnsent(alertId, Instant.now(), Instant.now().plusSeconds(600), 10).get(0);

        // when
        deliveryRepository.markSuppressed(delivery.getId());

        // then
        assertThat(deliveryRepository.hasSentSince(accountId, propertyId, "ops@example.com",
                Instant.now().minus(Duration.ofDays(3)))).isFalse();
    }

    @Test
    void shouldPageThroughPendingAlertsByTriggerTime() {
        // given
        Instant base = Instant.now().minus(Duration.ofHours(1)).truncatedTo(ChronoUnit.MICROS);
        Alert first = insertAlert(base);
        Alert second = insertAlert(base.plusSeconds(1));
        Alert third = insertAlert(base.plusSeconds(2));
        alertRepository.markClosed(accountId, second.getId());

        // when
        List<Alert> page = alertRepository.findPending(1);
        List<Alert> next = alertRepository.findPendingAfter(page.get(0).getTriggeredAt(), page.get(0).getId(), 1);
        List<Alert> rest = alertRepository.findPendingAfter(next.get(0).getTriggeredAt(), next.get(0).getId(), 1);

        // then
        assertThat(page).extracting(Alert::getId).containsExactly(first.getId());
        assertThat(next).extracting(Alert::getId).containsExactly(third.getId());
        assertThat(rest).isEmpty();
    }

    private Alert insertAlert(Instant triggeredAt) {
        return alertRepository.insert(Alert.builder()
                .accountId(accountId)
                .propertyId(propertyId)
                .alertType(AlertType.IMPRESSION_DROP)
                .prevWindowValue(1000)
                .lastWindowValue(400)
                .deltaPct(new BigDecimal("-60.00"))
                .triggeredAt(triggeredAt)
                .build());
    }
}
