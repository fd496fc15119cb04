package com.company.radar.service.analysis;

import com.company.radar.domain.Property;
import com.company.radar.domain.enums.MetricSource;

import java.util.UUID;

/**
 * Compares the two halves of the analysis window for one grouping dimension.
 */
public interface VisibilityAnalyzer {

    MetricSource dimension();

    VisibilityReport analyze(UUID accountId, Property property);
}
