package com.company.radar.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Health of every property with data, grouped by website domain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummaryResponse {

    public static final String STATUS_READY = "ready";
    public static final String STATUS_NOT_INITIALIZED = "not_initialized";

    private String status;
    private String message;
    @Builder.Default
    private List<WebsiteHealth> websites = new ArrayList<>();

    public static DashboardSummaryResponse notInitialized() {
        return DashboardSummaryResponse.builder()
                .status(STATUS_NOT_INITIALIZED)
                .message("Data has not been initialized. Run the pipeline to sync your properties.")
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WebsiteHealth {
        private String domain;
        @Builder.Default
        private List<PropertyHealthSummary> properties = new ArrayList<>();
    }
}
