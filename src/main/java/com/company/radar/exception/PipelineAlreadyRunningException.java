package com.company.radar.exception;

import java.util.UUID;

public class PipelineAlreadyRunningException extends RuntimeException {
    public PipelineAlreadyRunningException(UUID accountId) {
        super("Pipeline is already running for account " + accountId);
    }
}
