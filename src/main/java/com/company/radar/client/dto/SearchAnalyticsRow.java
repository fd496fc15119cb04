package com.company.radar.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One upstream row. keys follow the order of the requested dimensions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchAnalyticsRow {
    private List<String> keys;
    private double clicks;
    private double impressions;
    private double ctr;
    private Double position;
}
