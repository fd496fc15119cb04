package com.company.radar.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.UUID;

/**
 * 7v7 sitewide overview of one property.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyOverviewResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private UUID propertyId;
    private String siteUrl;
    private boolean initialized;
    private WindowMetrics lastWindow;
    private WindowMetrics previousWindow;
    private OverviewDeltas deltas;
    // Max date of the data the windows are anchored at
    private LocalDate computedAt;
}
