package com.company.radar.controller;

import com.company.radar.dto.response.RunStatusResponse;
import com.company.radar.dto.response.StartRunResponse;
import com.company.radar.dto.response.StopRunResponse;
import com.company.radar.exception.RunNotFoundException;
import com.company.radar.security.AccountContext;
import com.company.radar.service.pipeline.PipelineLauncher;
import com.company.radar.service.run.RunLockService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/accounts/{accountId}/pipeline")
@Tag(name = "Pipeline", description = "Start, stop and poll account pipeline runs")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class PipelineController {

    private final PipelineLauncher pipelineLauncher;
    private final RunLockService runLockService;
    private final AccountContext accountContext;
    private final MeterRegistry meterRegistry;

    @PostMapping("/run")
    @Operation(summary = "Start a pipeline run",
            description = "Returns 202 with the run id, or 409 when a run is already active for the account")
    @PreAuthorize("hasAnyRole('UI_READER', 'SCHEDULER', 'ADMIN')")
    public ResponseEntity<StartRunResponse> startRun(@PathVariable UUID accountId) {
        accountContext.verifyAccess(accountId);

        log.info("Pipeline start requested by {} for account {}",
                accountContext.getCurrentUserId(), accountId);
        meterRegistry.counter("api.pipeline.start.requests").increment();

        UUID runId = pipelineLauncher.start(accountId);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new StartRunResponse(runId));
    }

    @PostMapping("/{runId}/stop")
    @Operation(summary = "Stop a pipeline run",
            description = "Marks the run terminated; the worker bails out at its next checkpoint")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<StopRunResponse> stopRun(@PathVariable UUID accountId, @PathVariable UUID runId) {
        accountContext.verifyAccess(accountId);

        runLockService.findRun(accountId, runId)
                .orElseThrow(() -> new RunNotFoundException(runId));

        boolean stopped = pipelineLauncher.stop(accountId, runId);
        log.info("Stop requested for run {} of account {} (stopped={})", runId, accountId, stopped);

        return ResponseEntity.ok(new StopRunResponse(runId, stopped));
    }

    @GetMapping("/status")
    @Operation(summary = "Get the latest run of the account",
            description = "Stale runs are reaped before the read, so a dead worker never shows as running")
    @PreAuthorize("hasAnyRole('UI_READER', 'SCHEDULER', 'ADMIN')")
    public ResponseEntity<RunStatusResponse> getStatus(@PathVariable UUID accountId) {
        accountContext.verifyAccess(accountId);

        RunStatusResponse response = runLockService.currentStatus(accountId)
                .map(RunStatusResponse::from)
                .orElseGet(RunStatusResponse::idle);

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(response);
    }
}
