package com.company.radar.service.analysis;

import com.company.radar.config.RadarProperties;
import com.company.radar.domain.enums.MetricSource;
import com.company.radar.repository.DailyMetricRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

    @Bean
    public VisibilityAnalyzer pageVisibilityAnalyzer(DailyMetricRepository metricRepository,
                                                     RadarProperties properties) {
        return new DimensionVisibilityAnalyzer(MetricSource.PAGE, metricRepository, properties);
    }

    @Bean
    public VisibilityAnalyzer deviceVisibilityAnalyzer(DailyMetricRepository metricRepository,
                                                       RadarProperties properties) {
        return new DimensionVisibilityAnalyzer(MetricSource.DEVICE, metricRepository, properties);
    }
}
