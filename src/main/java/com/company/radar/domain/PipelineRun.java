package com.company.radar.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution attempt of ingest, analyze and detect for an account.
 * At most one row per account has running=true.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRun implements Serializable {
    private static final long serialVersionUID = 1L;

    private UUID id;
    private UUID accountId;

    private boolean running;
    private String currentStep;
    private Integer progressCurrent;
    private Integer progressTotal;
    private String error;

    private Instant startedAt;
    private Instant completedAt;

    // Heartbeat, bumped on every successful state write
    private Instant updatedAt;
}
