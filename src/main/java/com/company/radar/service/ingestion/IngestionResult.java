package com.company.radar.service.ingestion;

import com.company.radar.domain.Property;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of the ingestion phase. Only safe properties go on to analysis and detection.
 */
@Getter
public class IngestionResult {
    private final List<Property> safeProperties = new ArrayList<>();
    private final List<Property> failedProperties = new ArrayList<>();
    private boolean cancelled;

    void addSafe(Property property) {
        safeProperties.add(property);
    }

    void addFailed(Property property) {
        failedProperties.add(property);
    }

    void markCancelled() {
        this.cancelled = true;
    }

    public List<Property> getSafeProperties() {
        return Collections.unmodifiableList(safeProperties);
    }

    public List<Property> getFailedProperties() {
        return Collections.unmodifiableList(failedProperties);
    }
}
