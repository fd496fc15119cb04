package com.company.radar.service.overview;

import com.company.radar.domain.enums.PropertyHealth;

/**
 * Window-over-window health of a property from its sitewide impressions and clicks.
 */
public final class PropertyHealthClassifier {

    static final long MIN_TOTAL_IMPRESSIONS = 500;

    private PropertyHealthClassifier() {
    }

    public static PropertyHealth classify(long lastImpressions, long prevImpressions,
                                          long lastClicks, long prevClicks) {
        if (lastImpressions + prevImpressions < MIN_TOTAL_IMPRESSIONS || prevImpressions == 0) {
            return PropertyHealth.INSUFFICIENT_DATA;
        }

        double impressionsPct = (double) (lastImpressions - prevImpressions) / prevImpressions * 100;
        // No clicks before means no click signal, not a gain
        double clicksPct = prevClicks > 0 ? (double) (lastClicks - prevClicks) / prevClicks * 100 : 0.0;

        if (impressionsPct <= -50 || clicksPct <= -50) {
            return PropertyHealth.CRITICAL;
        }
        if (impressionsPct <= -25 && clicksPct <= -25) {
            return PropertyHealth.CRITICAL;
        }
        if (impressionsPct <= -12 || clicksPct <= -12) {
            return PropertyHealth.WARNING;
        }
        return PropertyHealth.HEALTHY;
    }
}
