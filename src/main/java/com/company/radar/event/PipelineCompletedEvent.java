package com.company.radar.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.UUID;

@Getter
@AllArgsConstructor
public class PipelineCompletedEvent {
    private final UUID accountId;
    private final UUID runId;
    private final List<UUID> ingestedPropertyIds;
}
