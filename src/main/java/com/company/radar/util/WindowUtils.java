package com.company.radar.util;

import com.company.radar.domain.DailyMetric;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Window anchoring, splitting and aggregation shared by the analyzers,
 * the alert detector and the overview read model.
 */
public final class WindowUtils {

    private WindowUtils() {
    }

    /**
     * Latest date in the rows, or {@code fallback} when there are none.
     */
    public static LocalDate mostRecentDate(Collection<DailyMetric> rows, LocalDate fallback) {
        LocalDate max = null;
        for (DailyMetric row : rows) {
            if (max == null || row.getDate().isAfter(max)) {
                max = row.getDate();
            }
        }
        return max != null ? max : fallback;
    }

    /**
     * Split rows anchored at their own max date: last = [0, W) days ago,
     * previous = [W, 2W) days ago. Older and future rows are dropped.
     *
     * @param halfWindowDays W, half of the total analysis window
     */
    public static WindowSplit split(Collection<DailyMetric> rows, int halfWindowDays) {
        if (halfWindowDays <= 0) {
            throw new IllegalArgumentException("halfWindowDays must be positive: " + halfWindowDays);
        }
        LocalDate anchor = mostRecentDate(rows, LocalDate.now());
        return split(rows, anchor, halfWindowDays);
    }

    public static WindowSplit split(Collection<DailyMetric> rows, LocalDate anchor, int halfWindowDays) {
        List<DailyMetric> last = new ArrayList<>();
        List<DailyMetric> previous = new ArrayList<>();

        for (DailyMetric row : rows) {
            long daysAgo = ChronoUnit.DAYS.between(row.getDate(), anchor);
            if (daysAgo >= 0 && daysAgo < halfWindowDays) {
                last.add(row);
            } else if (daysAgo >= halfWindowDays && daysAgo < 2L * halfWindowDays) {
                previous.add(row);
            }
        }
        return new WindowSplit(anchor, last, previous);
    }

    /**
     * Sums clicks and impressions, recomputes CTR from the sums and averages
     * position over the rows that reported one.
     */
    public static WindowAggregate aggregate(Collection<DailyMetric> rows) {
        long clicks = 0;
        long impressions = 0;
        double positionSum = 0.0;
        int positionDays = 0;
        Set<LocalDate> dates = new HashSet<>();

        for (DailyMetric row : rows) {
            clicks += row.getClicks();
            impressions += row.getImpressions();
            if (row.getPosition() != null) {
                positionSum += row.getPosition();
                positionDays++;
            }
            dates.add(row.getDate());
        }

        double ctr = impressions > 0 ? (double) clicks / impressions : 0.0;
        double avgPosition = positionDays > 0 ? positionSum / positionDays : 0.0;

        return WindowAggregate.builder()
                .clicks(clicks)
                .impressions(impressions)
                .ctr(ctr)
                .avgPosition(avgPosition)
                .daysWithData(dates.size())
                .build();
    }
}
