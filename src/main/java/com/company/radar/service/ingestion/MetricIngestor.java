package com.company.radar.service.ingestion;

import com.company.radar.client.SearchAnalyticsClient;
import com.company.radar.client.dto.SearchAnalyticsQuery;
import com.company.radar.client.dto.SearchAnalyticsResponse;
import com.company.radar.client.dto.SearchAnalyticsRow;
import com.company.radar.config.RadarProperties;
import com.company.radar.domain.DailyMetric;
import com.company.radar.domain.Property;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.repository.DailyMetricRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches one metric source for a property page by page and upserts each page
 * in short batch transactions. No transaction spans an upstream call.
 */
@Slf4j
public abstract class MetricIngestor {

    private final SearchAnalyticsClient client;
    private final DailyMetricRepository metricRepository;
    private final TransactionTemplate transactionTemplate;
    private final RadarProperties properties;

    protected MetricIngestor(SearchAnalyticsClient client,
                             DailyMetricRepository metricRepository,
                             TransactionTemplate transactionTemplate,
                             RadarProperties properties) {
        this.client = client;
        this.metricRepository = metricRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    public abstract MetricSource source();

    /**
     * Dimensions requested upstream. The last one is always "date".
     */
    protected abstract List<String> dimensions();

    /**
     * Dimension key of a row, or null when the row carries none.
     */
    protected abstract String dimensionKey(List<String> keys);

    /**
     * @return number of rows persisted
     */
    public int ingest(String accessToken, Property property, IngestionWindow window) {
        int pageSize = properties.getIngestion().getPageSize();
        SearchAnalyticsQuery query = SearchAnalyticsQuery.builder()
                .startDate(window.getStartDate().toString())
                .endDate(window.getEndDate().toString())
                .dimensions(dimensions())
                .rowLimit(pageSize)
                .startRow(0)
                .build();

        int startRow = 0;
        int persisted = 0;
        while (true) {
            SearchAnalyticsResponse response = client.query(accessToken, property.getSiteUrl(),
                    query.toBuilder().startRow(startRow).build());
            List<SearchAnalyticsRow> rows = response.getRows();

            persisted += persist(property, toMetrics(rows));

            if (rows.size() < pageSize) {
                break;
            }
            startRow += pageSize;
        }

        log.debug("{} rows persisted for {} ({} {}..{})", persisted, property.getBaseDomain(),
                source(), window.getStartDate(), window.getEndDate());
        return persisted;
    }

    List<DailyMetric> toMetrics(List<SearchAnalyticsRow> rows) {
        int expectedKeys = dimensions().size();
        List<DailyMetric> metrics = new ArrayList<>(rows.size());
        for (SearchAnalyticsRow row : rows) {
            List<String> keys = row.getKeys();
            if (keys == null || keys.size() != expectedKeys) {
                continue;
            }
            LocalDate date;
            try {
                date = LocalDate.parse(keys.get(expectedKeys - 1));
            } catch (DateTimeParseException e) {
                log.debug("Skipping row with unparseable date {}", keys);
                continue;
            }
            metrics.add(DailyMetric.builder()
                    .dimensionKey(dimensionKey(keys))
                    .date(date)
                    .clicks(Math.round(row.getClicks()))
                    .impressions(Math.round(row.getImpressions()))
                    .ctr(row.getCtr())
                    .position(row.getPosition())
                    .build());
        }
        return metrics;
    }

    private int persist(Property property, List<DailyMetric> metrics) {
        int batchSize = properties.getIngestion().getPersistBatchSize();
        int persisted = 0;
        for (int from = 0; from < metrics.size(); from += batchSize) {
            List<DailyMetric> batch = metrics.subList(from, Math.min(from + batchSize, metrics.size()));
            Integer count = transactionTemplate.execute(status ->
                    metricRepository.upsertBatch(source(), property.getId(), batch));
            persisted += count != null ? count : 0;
        }
        return persisted;
    }
}
