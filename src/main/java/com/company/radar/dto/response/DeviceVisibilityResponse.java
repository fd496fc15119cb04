package com.company.radar.dto.response;

import com.company.radar.service.analysis.DimensionDelta;
import com.company.radar.service.analysis.VisibilityReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Per-device clicks, impressions and CTR for both windows. Devices with no
 * rows in either window are absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceVisibilityResponse {
    private UUID propertyId;
    private boolean insufficientData;
    private LocalDate anchorDate;
    private Map<String, KeyDeltaResponse> devices;

    public static DeviceVisibilityResponse from(VisibilityReport report) {
        Map<String, KeyDeltaResponse> devices = new TreeMap<>();
        for (DimensionDelta delta : report.allDeltas()) {
            devices.put(delta.getKey(), KeyDeltaResponse.from(delta));
        }
        return DeviceVisibilityResponse.builder()
                .propertyId(report.getPropertyId())
                .insufficientData(report.isInsufficientData())
                .anchorDate(report.getAnchorDate())
                .devices(devices)
                .build();
    }
}
