package com.company.radar.scheduled;

import com.company.radar.config.RadarProperties;
import com.company.radar.repository.AlertRepository;
import com.company.radar.repository.PipelineRunRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class HistoryRetentionJobTest {

    @Mock
    private PipelineRunRepository runRepository;
    @Mock
    private AlertRepository alertRepository;

    private RadarProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private HistoryRetentionJob job;

    @BeforeEach
    void setUp() {
        properties = new RadarProperties();
        properties.getRetention().setDays(30);
        meterRegistry = new SimpleMeterRegistry();
        job = new HistoryRetentionJob(runRepository, alertRepository, properties, meterRegistry);
    }

    @Test
    void shouldPruneBothTablesWithConfiguredCutoff() {
        // given
        given(runRepository.deleteFinishedBefore(any())).willReturn(4);
        given(alertRepository.deleteClosedBefore(any())).willReturn(7);
        Instant before = Instant.now();

        // when
        job.pruneHistory();

        // then
        ArgumentCaptor<Instant> runCutoff = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> alertCutoff = ArgumentCaptor.forClass(Instant.class);
        then(runRepository).should().deleteFinishedBefore(runCutoff.capture());
        then(alertRepository).should().deleteClosedBefore(alertCutoff.capture());
        assertThat(runCutoff.getValue()).isEqualTo(alertCutoff.getValue());
        assertThat(runCutoff.getValue())
                .isBetween(before.minus(Duration.ofDays(30)), Instant.now().minus(Duration.ofDays(30)));
        assertThat(meterRegistry.counter("radar.retention.deleted", "table", "pipeline_runs").count()).isEqualTo(4.0);
        assertThat(meterRegistry.counter("radar.retention.deleted", "table", "alerts").count()).isEqualTo(7.0);
    }

    @Test
    void shouldCountFailureWithoutPropagating() {
        // given
        given(runRepository.deleteFinishedBefore(any()))
                .willThrow(new DataAccessResourceFailureException("database down"));

        // when
        job.pruneHistory();

        // then
        then(alertRepository).shouldHaveNoInteractions();
        assertThat(meterRegistry.counter("radar.retention.failures").count()).isEqualTo(1.0);
    }
}
