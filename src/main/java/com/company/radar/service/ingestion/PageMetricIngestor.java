package com.company.radar.service.ingestion;

import com.company.radar.client.SearchAnalyticsClient;
import com.company.radar.config.RadarProperties;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.repository.DailyMetricRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Component
public class PageMetricIngestor extends MetricIngestor {

    public PageMetricIngestor(SearchAnalyticsClient client,
                              DailyMetricRepository metricRepository,
                              TransactionTemplate transactionTemplate,
                              RadarProperties properties) {
        super(client, metricRepository, transactionTemplate, properties);
    }

    @Override
    public MetricSource source() {
        return MetricSource.PAGE;
    }

    @Override
    protected List<String> dimensions() {
        return List.of("page", "date");
    }

    @Override
    protected String dimensionKey(List<String> keys) {
        return keys.get(0);
    }
}
