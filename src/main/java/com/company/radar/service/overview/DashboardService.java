package com.company.radar.service.overview;

import com.company.radar.config.RadarProperties;
import com.company.radar.domain.Account;
import com.company.radar.domain.DailyMetric;
import com.company.radar.domain.Property;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.dto.response.DashboardSummaryResponse;
import com.company.radar.dto.response.DashboardSummaryResponse.WebsiteHealth;
import com.company.radar.dto.response.PropertyHealthSummary;
import com.company.radar.exception.AccountNotFoundException;
import com.company.radar.repository.AccountRepository;
import com.company.radar.repository.DailyMetricRepository;
import com.company.radar.repository.PropertyRepository;
import com.company.radar.util.MetricUtils;
import com.company.radar.util.WindowAggregate;
import com.company.radar.util.WindowSplit;
import com.company.radar.util.WindowUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Account-wide health board. Properties without sitewide data are left out,
 * as are websites left with no property.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardService {

    private final AccountRepository accountRepository;
    private final PropertyRepository propertyRepository;
    private final DailyMetricRepository metricRepository;
    private final RadarProperties properties;

    public DashboardSummaryResponse summary(UUID accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));

        if (!account.isDataInitialized()) {
            return DashboardSummaryResponse.notInitialized();
        }

        LocalDate since = LocalDate.now().minusDays(properties.getIngestion().getBackfillDays());
        int halfWindow = properties.getIngestion().getHalfWindowDays();
        Map<String, WebsiteHealth> websites = new TreeMap<>();

        for (Property property : propertyRepository.findAllByAccount(accountId)) {
            List<DailyMetric> rows = metricRepository.findSince(MetricSource.SITE, accountId, property.getId(), since);
            if (rows.isEmpty()) {
                continue;
            }

            WindowSplit split = WindowUtils.split(rows, halfWindow);
            WindowAggregate last = WindowUtils.aggregate(split.getLast());
            WindowAggregate previous = WindowUtils.aggregate(split.getPrevious());

            websites.computeIfAbsent(property.getBaseDomain(), domain -> WebsiteHealth.builder().domain(domain).build())
                    .getProperties()
                    .add(PropertyHealthSummary.builder()
                            .propertyId(property.getId())
                            .siteUrl(property.getSiteUrl())
                            .status(PropertyHealthClassifier.classify(last.getImpressions(), previous.getImpressions(),
                                    last.getClicks(), previous.getClicks()))
                            .dataThrough(split.getAnchorDate())
                            .lastImpressions(last.getImpressions())
                            .prevImpressions(previous.getImpressions())
                            .lastClicks(last.getClicks())
                            .prevClicks(previous.getClicks())
                            .impressionsDeltaPct(MetricUtils.safeDeltaPct(last.getImpressions(), previous.getImpressions()))
                            .clicksDeltaPct(MetricUtils.safeDeltaPct(last.getClicks(), previous.getClicks()))
                            .build());
        }

        log.debug("Dashboard for account {}: {} website(s)", accountId, websites.size());
        return DashboardSummaryResponse.builder()
                .status(DashboardSummaryResponse.STATUS_READY)
                .websites(new ArrayList<>(websites.values()))
                .build();
    }
}
