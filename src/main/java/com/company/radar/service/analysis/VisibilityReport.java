package com.company.radar.service.analysis;

import com.company.radar.domain.enums.MetricSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * In-memory result of one analyzer for one property. Not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisibilityReport {
    private UUID propertyId;
    private String siteUrl;
    private MetricSource dimension;
    private LocalDate anchorDate;
    private boolean insufficientData;

    @Builder.Default
    private List<DimensionDelta> newKeys = new ArrayList<>();
    @Builder.Default
    private List<DimensionDelta> lostKeys = new ArrayList<>();
    @Builder.Default
    private List<DimensionDelta> gains = new ArrayList<>();
    @Builder.Default
    private List<DimensionDelta> drops = new ArrayList<>();
    // Continuing keys that moved less than the significance threshold
    @Builder.Default
    private List<DimensionDelta> stable = new ArrayList<>();

    private int continuingCount;

    /**
     * Every key seen in either window, whatever its class.
     */
    public List<DimensionDelta> allDeltas() {
        List<DimensionDelta> all = new ArrayList<>(newKeys);
        all.addAll(lostKeys);
        all.addAll(gains);
        all.addAll(drops);
        all.addAll(stable);
        return all;
    }

    public String summary() {
        return String.format("new=%d lost=%d gain=%d drop=%d continuing=%d",
                newKeys.size(), lostKeys.size(), gains.size(), drops.size(), continuingCount);
    }
}
