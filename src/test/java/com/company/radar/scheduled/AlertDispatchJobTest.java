package com.company.radar.scheduled;

import com.company.radar.service.alert.AlertDispatchService;
import com.company.radar.service.alert.DispatchSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
class AlertDispatchJobTest {

    @Mock
    private AlertDispatchService dispatchService;

    private AlertDispatchJob job;

    @BeforeEach
    void setUp() {
        job = new AlertDispatchJob(dispatchService);
    }

    @Test
    void shouldRunOneDispatchCycle() {
        // given
        given(dispatchService.dispatchPending()).willReturn(new DispatchSummary());

        // when
        job.dispatch();

        // then
        then(dispatchService).should().dispatchPending();
    }

    @Test
    void shouldSurviveFailedCycleSoNextTickRuns() {
        // given
        given(dispatchService.dispatchPending())
                .willThrow(new DataAccessResourceFailureException("database down"))
                .willReturn(new DispatchSummary());

        // when / then
        assertThatCode(job::dispatch).doesNotThrowAnyException();
        assertThatCode(job::dispatch).doesNotThrowAnyException();
        then(dispatchService).should(times(2)).dispatchPending();
    }
}
