package com.company.radar.service.analysis;

import com.company.radar.domain.Property;
import com.company.radar.domain.enums.MetricSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs every analyzer over the safe properties, one analyzer per task on the
 * analysis executor. A failing analyzer fails the stage.
 */
@Service
@Slf4j
public class AnalysisStage {

    private final List<VisibilityAnalyzer> analyzers;
    private final TaskExecutor analysisExecutor;

    public AnalysisStage(List<VisibilityAnalyzer> analyzers,
                         @Qualifier("analysisExecutor") TaskExecutor analysisExecutor) {
        this.analyzers = analyzers;
        this.analysisExecutor = analysisExecutor;
    }

    public AnalysisResult run(UUID accountId, List<Property> safeProperties) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Map<MetricSource, CompletableFuture<List<VisibilityReport>>> futures = new LinkedHashMap<>();

        for (VisibilityAnalyzer analyzer : analyzers) {
            futures.put(analyzer.dimension(), CompletableFuture.supplyAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return analyzeAll(analyzer, accountId, safeProperties);
                } finally {
                    MDC.clear();
                }
            }, analysisExecutor));
        }

        Map<MetricSource, List<VisibilityReport>> reports = new EnumMap<>(MetricSource.class);
        try {
            for (Map.Entry<MetricSource, CompletableFuture<List<VisibilityReport>>> entry : futures.entrySet()) {
                reports.put(entry.getKey(), entry.getValue().join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        return new AnalysisResult(reports);
    }

    private List<VisibilityReport> analyzeAll(VisibilityAnalyzer analyzer, UUID accountId, List<Property> properties) {
        List<VisibilityReport> reports = new ArrayList<>(properties.size());
        for (Property property : properties) {
            VisibilityReport report = analyzer.analyze(accountId, property);
            if (report.isInsufficientData()) {
                log.info("{} analysis for {}: insufficient data", analyzer.dimension(), property.getBaseDomain());
            } else {
                log.info("{} analysis for {}: {}", analyzer.dimension(), property.getBaseDomain(), report.summary());
            }
            reports.add(report);
        }
        return reports;
    }
}
