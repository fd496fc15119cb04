package com.company.radar.service.alert;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Sitewide impressions of the previous and last windows of one property.
 */
@Getter
@ToString
@AllArgsConstructor
public class ImpressionComparison {
    private final LocalDate anchorDate;
    private final long previous;
    private final long last;
    private final double deltaPct;
}
