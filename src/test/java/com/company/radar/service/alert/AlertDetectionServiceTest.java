package com.company.radar.service.alert;

import com.company.radar.config.RadarProperties;
import com.company.radar.domain.Alert;
import com.company.radar.domain.DailyMetric;
import com.company.radar.domain.Property;
import com.company.radar.domain.enums.AlertType;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.repository.AlertRepository;
import com.company.radar.repository.DailyMetricRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class AlertDetectionServiceTest {

    private static final UUID ACCOUNT_ID = UUID.randomUUID();
    private static final LocalDate ANCHOR = LocalDate.of(2024, 6, 28);

    @Mock
    private DailyMetricRepository metricRepository;

    @Mock
    private AlertRepository alertRepository;

    private SimpleMeterRegistry meterRegistry;
    private AlertDetectionService detectionService;
    private Property property;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        detectionService = new AlertDetectionService(metricRepository, alertRepository,
                new RadarProperties(), meterRegistry);
        property = Property.builder()
                .id(UUID.randomUUID())
                .accountId(ACCOUNT_ID)
                .siteUrl("https://example.com/")
                .build();
    }

    @Test
    void shouldTriggerWhenImpressionsDropFifteenPercent() {
        // given
        givenSiteImpressions(1000, 850);
        given(alertRepository.existsTriggeredSince(eq(ACCOUNT_ID), eq(property.getId()),
                eq(AlertType.IMPRESSION_DROP), any())).willReturn(false);
        given(alertRepository.insert(any(Alert.class))).willAnswer(inv -> {
            Alert alert = inv.getArgument(0);
            alert.setId(UUID.randomUUID());
            return alert;
        });

        // when
        Optional<Alert> alert = detectionService.detect(ACCOUNT_ID, property);

        // then
        assertThat(alert).isPresent();
        ArgumentCaptor<Alert> captor = ArgumentCaptor.forClass(Alert.class);
        then(alertRepository).should().insert(captor.capture());
        Alert inserted = captor.getValue();
        assertThat(inserted.getPrevWindowValue()).isEqualTo(1000);
        assertThat(inserted.getLastWindowValue()).isEqualTo(850);
        assertThat(inserted.getDeltaPct()).isEqualByComparingTo(new BigDecimal("-15.00"));
        assertThat(inserted.getAlertType()).isEqualTo(AlertType.IMPRESSION_DROP);
        assertThat(inserted.isEmailSent()).isFalse();
        assertThat(meterRegistry.counter("radar.alerts.triggered", "type", "impression_drop").count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldNotTriggerBelowNoiseFloor() {
        // given
        givenSiteImpressions(50, 10);

        // when
        Optional<Alert> alert = detectionService.detect(ACCOUNT_ID, property);

        // then
        assertThat(alert).isEmpty();
        then(alertRepository).should(never()).insert(any());
    }

    @Test
    void shouldNotTriggerOnSmallDrop() {
        // given
        givenSiteImpressions(1000, 950);

        // when
        Optional<Alert> alert = detectionService.detect(ACCOUNT_ID, property);

        // then
        assertThat(alert).isEmpty();
        then(alertRepository).should(never()).existsTriggeredSince(any(), any(), any(), any());
    }

    @Test
    void shouldSkipWhenAlreadyAlertedWithinDedupWindow() {
        // given
        givenSiteImpressions(1000, 500);
        ArgumentCaptor<Instant> since = ArgumentCaptor.forClass(Instant.class);
        given(alertRepository.existsTriggeredSince(eq(ACCOUNT_ID), eq(property.getId()),
                eq(AlertType.IMPRESSION_DROP), since.capture())).willReturn(true);

        // when
        Instant before = Instant.now();
        Optional<Alert> alert = detectionService.detect(ACCOUNT_ID, property);

        // then
        assertThat(alert).isEmpty();
        then(alertRepository).should(never()).insert(any());
        assertThat(since.getValue()).isBetween(before.minus(Duration.ofHours(24)).minusSeconds(1),
                Instant.now().minus(Duration.ofHours(24)));
        assertThat(meterRegistry.counter("radar.alerts.deduplicated").count()).isEqualTo(1.0);
    }

    @Test
    void shouldTriggerAtExactlyTenPercentDrop() {
        // given
        ImpressionComparison comparison = new ImpressionComparison(ANCHOR, 100, 90, -10.0);

        // when / then
        assertThat(detectionService.shouldTrigger(comparison)).isTrue();
    }

    @Test
    void shouldSkipPropertyWithoutSiteMetrics() {
        // given
        given(metricRepository.findSince(eq(MetricSource.SITE), eq(ACCOUNT_ID), eq(property.getId()), any()))
                .willReturn(List.of());

        // when
        Optional<Alert> alert = detectionService.detect(ACCOUNT_ID, property);

        // then
        assertThat(alert).isEmpty();
    }

    /**
     * Spreads each window total over its seven days, anchored at {@link #ANCHOR}.
     */
    private void givenSiteImpressions(long previous, long last) {
        List<DailyMetric> rows = new ArrayList<>();
        for (int day = 0; day < 7; day++) {
            rows.add(siteRow(ANCHOR.minusDays(day), day == 0 ? last - 6 * (last / 7) : last / 7));
            rows.add(siteRow(ANCHOR.minusDays(7 + day), day == 0 ? previous - 6 * (previous / 7) : previous / 7));
        }
        given(metricRepository.findSince(eq(MetricSource.SITE), eq(ACCOUNT_ID), eq(property.getId()), any()))
                .willReturn(rows);
    }

    private static DailyMetric siteRow(LocalDate date, long impressions) {
        return DailyMetric.builder().date(date).impressions(impressions).clicks(0).position(5.0).build();
    }
}
