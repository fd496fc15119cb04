package com.company.radar.service.run;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class LocalRunRegistryTest {

    @Mock
    private RunLockService runLockService;

    private LocalRunRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new LocalRunRegistry(runLockService);
    }

    @Test
    void shouldMarkEveryActiveRunInterruptedOnShutdown() {
        // given
        UUID accountA = UUID.randomUUID();
        UUID runA = UUID.randomUUID();
        UUID accountB = UUID.randomUUID();
        UUID runB = UUID.randomUUID();
        registry.register(accountA, runA);
        registry.register(accountB, runB);

        // when
        registry.markInterrupted();

        // then
        then(runLockService).should().terminate(accountA, runA, LocalRunRegistry.SHUTDOWN_REASON);
        then(runLockService).should().terminate(accountB, runB, LocalRunRegistry.SHUTDOWN_REASON);
    }

    @Test
    void shouldNotTouchUnregisteredRuns() {
        // given
        UUID accountId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();
        registry.register(accountId, runId);
        registry.unregister(accountId, runId);

        // when
        registry.markInterrupted();

        // then
        assertThat(registry.snapshot()).isEmpty();
        then(runLockService).should(never()).terminate(any(), any(), any());
    }

    @Test
    void shouldContinueWhenOneRunCannotBeMarked() {
        // given
        UUID accountA = UUID.randomUUID();
        UUID runA = UUID.randomUUID();
        UUID accountB = UUID.randomUUID();
        UUID runB = UUID.randomUUID();
        registry.register(accountA, runA);
        registry.register(accountB, runB);
        willThrow(new IllegalStateException("pool closed"))
                .given(runLockService).terminate(accountA, runA, LocalRunRegistry.SHUTDOWN_REASON);
        given(runLockService.terminate(accountB, runB, LocalRunRegistry.SHUTDOWN_REASON)).willReturn(true);

        // when
        registry.markInterrupted();

        // then
        then(runLockService).should().terminate(accountB, runB, LocalRunRegistry.SHUTDOWN_REASON);
    }
}
