package com.company.radar.exception;

import java.util.UUID;

public class RunNotFoundException extends RuntimeException {
    public RunNotFoundException(UUID runId) {
        super("Run not found: " + runId);
    }
}
