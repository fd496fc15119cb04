package com.company.radar.service.email;

import com.company.radar.domain.Alert;
import com.company.radar.domain.Property;
import com.company.radar.repository.PropertyRepository;
import com.company.radar.service.analysis.DimensionDelta;
import com.company.radar.service.analysis.VisibilityAnalyzer;
import com.company.radar.service.analysis.VisibilityReport;
import com.company.radar.util.MetricUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Plain-text alert mail: sitewide 7v7 impressions plus a page health summary
 * computed from stored page metrics at send time.
 */
@Component
@Slf4j
public class AlertEmailComposer {

    static final int MAX_LOST_PAGES = 10;

    private final PropertyRepository propertyRepository;
    private final VisibilityAnalyzer pageAnalyzer;

    public AlertEmailComposer(PropertyRepository propertyRepository,
                              @Qualifier("pageVisibilityAnalyzer") VisibilityAnalyzer pageAnalyzer) {
        this.propertyRepository = propertyRepository;
        this.pageAnalyzer = pageAnalyzer;
    }

    public String subject(Alert alert) {
        return String.format(Locale.ROOT, "[Search Radar Alert] Impressions dropped by %.1f%%",
                alert.getDeltaPct().abs().doubleValue());
    }

    public String body(Alert alert) {
        String siteUrl = alert.getSiteUrl() != null ? alert.getSiteUrl() : "";
        VisibilityReport health = pageHealth(alert).orElse(null);

        StringBuilder body = new StringBuilder();
        body.append("Search Alert: Impressions Drop Detected\n\n");
        body.append("Property:\n").append(siteUrl).append("\n\n");
        body.append("Sitewide Impressions (7-day comparison):\n");
        body.append(String.format(Locale.US, "Previous 7 days: %,d%n", alert.getPrevWindowValue()));
        body.append(String.format(Locale.US, "Last 7 days: %,d%n", alert.getLastWindowValue()));
        body.append("Change: ").append(MetricUtils.formatSignedPct(alert.getDeltaPct().doubleValue())).append("\n\n");

        body.append("Page Health Summary:\n");
        body.append("- New pages: ").append(health != null ? health.getNewKeys().size() : 0).append('\n');
        body.append("- Lost pages: ").append(health != null ? health.getLostKeys().size() : 0).append('\n');
        body.append("- Page drops: ").append(health != null ? health.getDrops().size() : 0).append('\n');
        body.append("- Page gains: ").append(health != null ? health.getGains().size() : 0).append('\n');

        if (health != null && !health.getLostKeys().isEmpty()) {
            body.append("\nLost Pages (top ").append(MAX_LOST_PAGES).append("):\n");
            List<DimensionDelta> lost = health.getLostKeys();
            for (DimensionDelta page : lost.subList(0, Math.min(MAX_LOST_PAGES, lost.size()))) {
                body.append("- ").append(relativePath(page.getKey(), siteUrl)).append('\n');
            }
        }

        body.append("\nThis alert was generated automatically by Search Radar.\n");
        return body.toString();
    }

    static String relativePath(String pageUrl, String siteUrl) {
        String prefix = siteUrl.replaceAll("/+$", "");
        String path = !prefix.isEmpty() && pageUrl.startsWith(prefix)
                ? pageUrl.substring(prefix.length())
                : pageUrl;
        return path.isEmpty() ? "/" : path;
    }

    private Optional<VisibilityReport> pageHealth(Alert alert) {
        try {
            Optional<Property> property = propertyRepository.findById(alert.getAccountId(), alert.getPropertyId());
            if (property.isEmpty()) {
                return Optional.empty();
            }
            VisibilityReport report = pageAnalyzer.analyze(alert.getAccountId(), property.get());
            return report.isInsufficientData() ? Optional.empty() : Optional.of(report);
        } catch (Exception e) {
            // The drop itself is still worth mailing
            log.warn("Page health summary unavailable for alert {}: {}", alert.getId(), e.getMessage());
            return Optional.empty();
        }
    }
}
