package com.company.radar.service.overview;

import com.company.radar.config.RadarProperties;
import com.company.radar.config.RedisCacheConfig;
import com.company.radar.domain.DailyMetric;
import com.company.radar.domain.Property;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.dto.response.OverviewDeltas;
import com.company.radar.dto.response.PropertyOverviewResponse;
import com.company.radar.dto.response.WindowMetrics;
import com.company.radar.exception.PropertyNotFoundException;
import com.company.radar.repository.DailyMetricRepository;
import com.company.radar.repository.PropertyRepository;
import com.company.radar.util.MetricUtils;
import com.company.radar.util.WindowAggregate;
import com.company.radar.util.WindowSplit;
import com.company.radar.util.WindowUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class PropertyOverviewService {

    private final PropertyRepository propertyRepository;
    private final DailyMetricRepository metricRepository;
    private final RadarProperties properties;

    public List<Property> listProperties(UUID accountId) {
        return propertyRepository.findAllByAccount(accountId);
    }

    /**
     * Sitewide last-vs-previous window comparison, anchored at the most recent
     * stored date rather than today.
     */
    @Cacheable(value = RedisCacheConfig.PROPERTY_OVERVIEW_CACHE,
            key = "#accountId + ':' + #propertyId")
    public PropertyOverviewResponse getOverview(UUID accountId, UUID propertyId) {
        Property property = propertyRepository.findById(accountId, propertyId)
                .orElseThrow(() -> new PropertyNotFoundException(accountId, propertyId));

        LocalDate since = LocalDate.now().minusDays(properties.getIngestion().getBackfillDays());
        List<DailyMetric> rows = metricRepository.findSince(MetricSource.SITE, accountId, propertyId, since);

        if (rows.isEmpty()) {
            return PropertyOverviewResponse.builder()
                    .propertyId(propertyId)
                    .siteUrl(property.getSiteUrl())
                    .initialized(false)
                    .lastWindow(WindowMetrics.from(WindowAggregate.empty()))
                    .previousWindow(WindowMetrics.from(WindowAggregate.empty()))
                    .deltas(new OverviewDeltas())
                    .build();
        }

        WindowSplit split = WindowUtils.split(rows, properties.getIngestion().getHalfWindowDays());
        WindowAggregate last = WindowUtils.aggregate(split.getLast());
        WindowAggregate previous = WindowUtils.aggregate(split.getPrevious());

        log.debug("Overview for {} anchored at {}", property.getBaseDomain(), split.getAnchorDate());

        return PropertyOverviewResponse.builder()
                .propertyId(propertyId)
                .siteUrl(property.getSiteUrl())
                .initialized(true)
                .lastWindow(WindowMetrics.from(last))
                .previousWindow(WindowMetrics.from(previous))
                .deltas(deltas(last, previous))
                .computedAt(split.getAnchorDate())
                .build();
    }

    static OverviewDeltas deltas(WindowAggregate last, WindowAggregate previous) {
        return OverviewDeltas.builder()
                .clicks(last.getClicks() - previous.getClicks())
                .impressions(last.getImpressions() - previous.getImpressions())
                .clicksPct(MetricUtils.safeDeltaPct(last.getClicks(), previous.getClicks()))
                .impressionsPct(MetricUtils.safeDeltaPct(last.getImpressions(), previous.getImpressions()))
                .ctr(MetricUtils.round(last.getCtr() - previous.getCtr(), 4))
                .ctrPct(MetricUtils.safeDeltaPct(last.getCtr(), previous.getCtr()))
                .avgPosition(MetricUtils.round(last.getAvgPosition() - previous.getAvgPosition(), 2))
                .build();
    }
}
