package com.company.radar.service.run;

import com.company.radar.config.RadarProperties;
import com.company.radar.exception.PipelineAlreadyRunningException;
import com.company.radar.repository.PipelineRunRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.inOrder;

@ExtendWith(MockitoExtension.class)
class RunLockServiceTest {

    private static final UUID ACCOUNT_ID = UUID.randomUUID();
    private static final UUID RUN_ID = UUID.randomUUID();

    @Mock
    private PipelineRunRepository runRepository;

    private SimpleMeterRegistry meterRegistry;
    private RunLockService runLockService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        runLockService = new RunLockService(runRepository, new RadarProperties(), meterRegistry);
    }

    @Test
    void shouldReapStaleRunsBeforeInsertingNewRun() {
        // given
        given(runRepository.reapStale(eq(ACCOUNT_ID), any(), any(), any())).willReturn(1);
        given(runRepository.insertRunning(eq(ACCOUNT_ID), any())).willReturn(RUN_ID);

        // when
        UUID runId = runLockService.start(ACCOUNT_ID);

        // then
        assertThat(runId).isEqualTo(RUN_ID);
        InOrder order = inOrder(runRepository);
        order.verify(runRepository).reapStale(eq(ACCOUNT_ID), any(), any(), any());
        order.verify(runRepository).insertRunning(eq(ACCOUNT_ID), any());
        assertThat(meterRegistry.counter("radar.pipeline.reaped").count()).isEqualTo(1.0);
    }

    @Test
    void shouldUseHeartbeatAndHardTimeoutCutoffsWhenReaping() {
        // given
        ArgumentCaptor<Instant> now = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> heartbeatCutoff = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> hardCutoff = ArgumentCaptor.forClass(Instant.class);
        given(runRepository.insertRunning(eq(ACCOUNT_ID), any())).willReturn(RUN_ID);

        // when
        runLockService.start(ACCOUNT_ID);

        // then
        then(runRepository).should().reapStale(eq(ACCOUNT_ID), now.capture(),
                heartbeatCutoff.capture(), hardCutoff.capture());
        assertThat(heartbeatCutoff.getValue()).isEqualTo(now.getValue().minusSeconds(20 * 60));
        assertThat(hardCutoff.getValue()).isEqualTo(now.getValue().minusSeconds(2 * 3600));
    }

    @Test
    void shouldRejectStartWhenAnotherRunHoldsTheLock() {
        // given
        given(runRepository.insertRunning(eq(ACCOUNT_ID), any()))
                .willThrow(new DuplicateKeyException("one_running_pipeline_per_account"));

        // when / then
        assertThatThrownBy(() -> runLockService.start(ACCOUNT_ID))
                .isInstanceOf(PipelineAlreadyRunningException.class);
        assertThat(meterRegistry.counter("radar.pipeline.start.rejected").count()).isEqualTo(1.0);
    }

    @Test
    void shouldIgnoreUpdateOfClosedRun() {
        // given
        given(runRepository.updateIfRunning(eq(ACCOUNT_ID), eq(RUN_ID), any(), any())).willReturn(0);

        // when
        boolean applied = runLockService.update(ACCOUNT_ID, RUN_ID, RunStateUpdate.step("Analyzing"));

        // then
        assertThat(applied).isFalse();
    }

    @Test
    void shouldCountCompletionOnlyWhenRunWasStillRunning() {
        // given
        given(runRepository.updateIfRunning(eq(ACCOUNT_ID), eq(RUN_ID), any(), any())).willReturn(1, 0);

        // when
        boolean first = runLockService.complete(ACCOUNT_ID, RUN_ID);
        boolean second = runLockService.complete(ACCOUNT_ID, RUN_ID);

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(meterRegistry.counter("radar.pipeline.completed", "outcome", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldTruncateLongErrorMessages() {
        // given
        ArgumentCaptor<RunStateUpdate> captor = ArgumentCaptor.forClass(RunStateUpdate.class);
        given(runRepository.updateIfRunning(eq(ACCOUNT_ID), eq(RUN_ID), captor.capture(), any())).willReturn(1);

        // when
        runLockService.fail(ACCOUNT_ID, RUN_ID, "x".repeat(5000));

        // then
        RunStateUpdate applied = captor.getValue();
        assertThat(applied.getError()).hasSize(RunLockService.MAX_ERROR_LENGTH);
        assertThat(applied.isFinish()).isTrue();
        assertThat(applied.getCurrentStep()).isEqualTo("Failed");
    }

    @Test
    void shouldReapBeforeReadingStatus() {
        // given
        given(runRepository.findLatest(ACCOUNT_ID)).willReturn(java.util.Optional.empty());

        // when
        runLockService.currentStatus(ACCOUNT_ID);

        // then
        InOrder order = inOrder(runRepository);
        order.verify(runRepository).reapStale(eq(ACCOUNT_ID), any(), any(), any());
        order.verify(runRepository).findLatest(ACCOUNT_ID);
    }
}
