package com.company.radar.service.run;

import lombok.Builder;
import lombok.Getter;

/**
 * Partial update of a running run. Null fields are left unchanged;
 * {@code finish} closes the run and stamps completed_at.
 */
@Getter
@Builder
public class RunStateUpdate {
    private final String currentStep;
    private final Integer progressCurrent;
    private final Integer progressTotal;
    private final String error;
    private final boolean finish;

    public static RunStateUpdate step(String currentStep) {
        return RunStateUpdate.builder().currentStep(currentStep).build();
    }

    public static RunStateUpdate progress(String currentStep, int current, int total) {
        return RunStateUpdate.builder()
                .currentStep(currentStep)
                .progressCurrent(current)
                .progressTotal(total)
                .build();
    }

    public static RunStateUpdate completed() {
        return RunStateUpdate.builder().currentStep("Completed").finish(true).build();
    }

    public static RunStateUpdate failed(String error) {
        return RunStateUpdate.builder().currentStep("Failed").error(error).finish(true).build();
    }
}
