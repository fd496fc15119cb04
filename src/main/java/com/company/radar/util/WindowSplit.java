package com.company.radar.util;

import com.company.radar.domain.DailyMetric;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

/**
 * Rows partitioned into the last and previous comparison windows.
 */
@Getter
@AllArgsConstructor
public class WindowSplit {
    private final LocalDate anchorDate;
    private final List<DailyMetric> last;
    private final List<DailyMetric> previous;
}
