package com.company.radar.dto.response;

import com.company.radar.service.analysis.DimensionDelta;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last-vs-previous window figures of one page or device.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyDeltaResponse {
    private String key;
    private long lastImpressions;
    private long prevImpressions;
    private double impressionsDeltaPct;
    private long lastClicks;
    private long prevClicks;
    private double clicksDeltaPct;
    private double lastCtr;
    private double prevCtr;
    private double ctrDeltaPct;

    public static KeyDeltaResponse from(DimensionDelta delta) {
        return KeyDeltaResponse.builder()
                .key(delta.getKey())
                .lastImpressions(delta.getLastImpressions())
                .prevImpressions(delta.getPrevImpressions())
                .impressionsDeltaPct(delta.getDeltaPct())
                .lastClicks(delta.getLastClicks())
                .prevClicks(delta.getPrevClicks())
                .clicksDeltaPct(delta.getClicksDeltaPct())
                .lastCtr(delta.getLastCtr())
                .prevCtr(delta.getPrevCtr())
                .ctrDeltaPct(delta.getCtrDeltaPct())
                .build();
    }
}
