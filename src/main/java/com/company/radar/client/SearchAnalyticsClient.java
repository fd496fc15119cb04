package com.company.radar.client;

import com.company.radar.client.dto.SearchAnalyticsQuery;
import com.company.radar.client.dto.SearchAnalyticsResponse;
import com.company.radar.client.dto.SiteEntry;

import java.util.List;

/**
 * Upstream search analytics API. Implementations throw
 * {@link com.company.radar.exception.UpstreamAuthException} when the access
 * token is rejected.
 */
public interface SearchAnalyticsClient {

    List<SiteEntry> listSites(String accessToken);

    SearchAnalyticsResponse query(String accessToken, String siteUrl, SearchAnalyticsQuery query);
}
