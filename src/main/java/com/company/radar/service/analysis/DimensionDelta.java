package com.company.radar.service.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Window-over-window change of one dimension key (a page URL or a device).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionDelta {
    private String key;
    private long prevImpressions;
    private long lastImpressions;
    private long prevClicks;
    private long lastClicks;
    private double prevCtr;
    private double lastCtr;
    // Impressions change, the figure keys are classified on
    private double deltaPct;
    private double clicksDeltaPct;
    private double ctrDeltaPct;
}
