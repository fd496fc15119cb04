package com.company.radar.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertSubscription {
    private UUID id;
    private UUID accountId;
    private String recipient;
    private UUID propertyId;
    private Instant createdAt;
}
