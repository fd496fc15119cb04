package com.company.radar.dto.response;

import com.company.radar.domain.enums.PropertyHealth;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyHealthSummary {
    private UUID propertyId;
    private String siteUrl;
    private PropertyHealth status;
    private LocalDate dataThrough;
    private long lastImpressions;
    private long prevImpressions;
    private long lastClicks;
    private long prevClicks;
    private double impressionsDeltaPct;
    private double clicksDeltaPct;
}
