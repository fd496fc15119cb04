package com.company.radar.domain;

import com.company.radar.domain.enums.AlertType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable trigger record. Only emailSent changes, when the dispatcher closes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    private UUID id;
    private UUID accountId;
    private UUID propertyId;
    private AlertType alertType;

    private long prevWindowValue;
    private long lastWindowValue;
    private BigDecimal deltaPct;

    private Instant triggeredAt;
    private boolean emailSent;

    // Joined from properties, not persisted on the alert row
    private String siteUrl;
}
