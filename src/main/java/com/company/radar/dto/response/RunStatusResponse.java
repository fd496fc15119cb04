package com.company.radar.dto.response;

import com.company.radar.domain.PipelineRun;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Run read model polled by clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunStatusResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private UUID runId;
    @JsonProperty("is_running")
    private boolean running;
    private String currentStep;
    private ProgressInfo progress;
    private String error;
    private Instant startedAt;
    private Instant completedAt;

    public static RunStatusResponse from(PipelineRun run) {
        return RunStatusResponse.builder()
                .runId(run.getId())
                .running(run.isRunning())
                .currentStep(run.getCurrentStep())
                .progress(new ProgressInfo(
                        run.getProgressCurrent() != null ? run.getProgressCurrent() : 0,
                        run.getProgressTotal() != null ? run.getProgressTotal() : 0))
                .error(run.getError())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .build();
    }

    public static RunStatusResponse idle() {
        return RunStatusResponse.builder()
                .running(false)
                .progress(new ProgressInfo(0, 0))
                .build();
    }
}
