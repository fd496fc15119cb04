package com.company.radar.domain;

import com.company.radar.domain.enums.DeliveryState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One recipient's send record for one alert. Unique per (alertId, recipient).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertDelivery {
    private UUID id;
    private UUID alertId;
    private UUID accountId;
    private String recipient;
    private DeliveryState state;
    private Instant sentAt;
    private Instant claimedUntil;
    private Instant createdAt;
}
