package com.company.radar.service.analysis;

import com.company.radar.domain.Property;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.exception.PropertyNotFoundException;
import com.company.radar.repository.PropertyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * On-demand visibility analysis for the read API, using the same analyzers
 * the pipeline runs.
 */
@Service
@Slf4j
public class VisibilityQueryService {

    private final Map<MetricSource, VisibilityAnalyzer> analyzers = new EnumMap<>(MetricSource.class);
    private final PropertyRepository propertyRepository;

    public VisibilityQueryService(List<VisibilityAnalyzer> analyzers, PropertyRepository propertyRepository) {
        for (VisibilityAnalyzer analyzer : analyzers) {
            this.analyzers.put(analyzer.dimension(), analyzer);
        }
        this.propertyRepository = propertyRepository;
    }

    /**
     * @throws PropertyNotFoundException when the property is not part of the account
     */
    public VisibilityReport analyze(UUID accountId, UUID propertyId, MetricSource dimension) {
        Property property = propertyRepository.findById(accountId, propertyId)
                .orElseThrow(() -> new PropertyNotFoundException(accountId, propertyId));

        VisibilityAnalyzer analyzer = analyzers.get(dimension);
        if (analyzer == null) {
            throw new IllegalArgumentException("No visibility analyzer for " + dimension);
        }

        VisibilityReport report = analyzer.analyze(accountId, property);
        log.debug("{} visibility for {}: {}", dimension, property.getBaseDomain(), report.summary());
        return report;
    }
}
