package com.company.radar.dto.response;

import com.company.radar.domain.Alert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {
    private UUID id;
    private UUID propertyId;
    private String siteUrl;
    private String alertType;
    private long prevWindowValue;
    private long lastWindowValue;
    private BigDecimal deltaPct;
    private Instant triggeredAt;
    private boolean emailSent;

    public static AlertResponse from(Alert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .propertyId(alert.getPropertyId())
                .siteUrl(alert.getSiteUrl())
                .alertType(alert.getAlertType().getCode())
                .prevWindowValue(alert.getPrevWindowValue())
                .lastWindowValue(alert.getLastWindowValue())
                .deltaPct(alert.getDeltaPct())
                .triggeredAt(alert.getTriggeredAt())
                .emailSent(alert.isEmailSent())
                .build();
    }
}
