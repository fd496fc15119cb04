package com.company.radar.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body of the searchAnalytics/query call. Dates are ISO yyyy-MM-dd.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchAnalyticsQuery {
    private String startDate;
    private String endDate;
    private List<String> dimensions;
    private Integer rowLimit;
    private Integer startRow;
}
