package com.company.radar.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A single dated metric row. dimensionKey is the page URL or device name,
 * and null for the site aggregate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyMetric {
    private String dimensionKey;
    private LocalDate date;
    private long clicks;
    private long impressions;
    private double ctr;
    private Double position;
}
