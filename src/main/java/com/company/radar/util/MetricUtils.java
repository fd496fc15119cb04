package com.company.radar.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MetricUtils {

    private MetricUtils() {
    }

    /**
     * Percentage change that never divides by zero.
     * previous > 0: standard delta rounded to two decimals;
     * previous == 0 and current > 0: 100;
     * both zero: 0.
     */
    public static double safeDeltaPct(double current, double previous) {
        if (previous > 0) {
            return BigDecimal.valueOf((current - previous) / previous * 100)
                    .setScale(2, RoundingMode.HALF_UP)
                    .doubleValue();
        }
        if (current > 0) {
            return 100.0;
        }
        return 0.0;
    }

    public static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static String formatSignedPct(double pct) {
        return String.format("%+.1f%%", pct);
    }
}
