package com.company.radar.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SiteListResponse {
    private List<SiteEntry> siteEntry = new ArrayList<>();
}
