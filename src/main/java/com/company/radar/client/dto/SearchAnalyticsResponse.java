package com.company.radar.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchAnalyticsResponse {
    // Absent from the payload when the query matched nothing
    private List<SearchAnalyticsRow> rows = new ArrayList<>();
}
