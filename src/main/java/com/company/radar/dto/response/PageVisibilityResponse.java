package com.company.radar.dto.response;

import com.company.radar.service.analysis.DimensionDelta;
import com.company.radar.service.analysis.VisibilityReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Pages that appeared, disappeared or moved significantly between the two windows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageVisibilityResponse {
    private UUID propertyId;
    private boolean insufficientData;
    private LocalDate anchorDate;
    private Map<String, List<KeyDeltaResponse>> pages;
    private Map<String, Integer> totals;

    public static PageVisibilityResponse from(VisibilityReport report) {
        Map<String, List<KeyDeltaResponse>> pages = new LinkedHashMap<>();
        pages.put("new", map(report.getNewKeys()));
        pages.put("lost", map(report.getLostKeys()));
        pages.put("drop", map(report.getDrops()));
        pages.put("gain", map(report.getGains()));

        Map<String, Integer> totals = new LinkedHashMap<>();
        pages.forEach((group, keys) -> totals.put(group, keys.size()));

        return PageVisibilityResponse.builder()
                .propertyId(report.getPropertyId())
                .insufficientData(report.isInsufficientData())
                .anchorDate(report.getAnchorDate())
                .pages(pages)
                .totals(totals)
                .build();
    }

    private static List<KeyDeltaResponse> map(List<DimensionDelta> deltas) {
        return deltas.stream().map(KeyDeltaResponse::from).collect(Collectors.toList());
    }
}
