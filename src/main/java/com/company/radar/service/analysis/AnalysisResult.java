package com.company.radar.service.analysis;

import com.company.radar.domain.enums.MetricSource;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Getter
public class AnalysisResult {
    private final Map<MetricSource, List<VisibilityReport>> reports;

    public AnalysisResult(Map<MetricSource, List<VisibilityReport>> reports) {
        this.reports = Collections.unmodifiableMap(new EnumMap<>(reports));
    }

    public List<VisibilityReport> reportsFor(MetricSource dimension) {
        return reports.getOrDefault(dimension, List.of());
    }
}
