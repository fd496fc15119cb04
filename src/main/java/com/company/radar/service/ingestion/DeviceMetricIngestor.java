package com.company.radar.service.ingestion;

import com.company.radar.client.SearchAnalyticsClient;
import com.company.radar.config.RadarProperties;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.repository.DailyMetricRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Locale;

@Component
public class DeviceMetricIngestor extends MetricIngestor {

    public DeviceMetricIngestor(SearchAnalyticsClient client,
                                DailyMetricRepository metricRepository,
                                TransactionTemplate transactionTemplate,
                                RadarProperties properties) {
        super(client, metricRepository, transactionTemplate, properties);
    }

    @Override
    public MetricSource source() {
        return MetricSource.DEVICE;
    }

    @Override
    protected List<String> dimensions() {
        return List.of("device", "date");
    }

    @Override
    protected String dimensionKey(List<String> keys) {
        // Upstream reports DESKTOP/MOBILE/TABLET
        return keys.get(0).toLowerCase(Locale.ROOT);
    }
}
