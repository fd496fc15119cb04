package com.company.radar.service.ingestion;

import com.company.radar.domain.enums.IngestionMode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive date range to fetch for one property.
 */
@Getter
@ToString
@AllArgsConstructor
public class IngestionWindow {
    private final IngestionMode mode;
    private final LocalDate startDate;
    private final LocalDate endDate;

    public long days() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }
}
