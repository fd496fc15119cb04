package com.company.radar.client;

import com.company.radar.client.dto.SearchAnalyticsQuery;
import com.company.radar.client.dto.SearchAnalyticsResponse;
import com.company.radar.client.dto.SiteEntry;
import com.company.radar.client.dto.SiteListResponse;
import com.company.radar.config.RadarProperties;
import com.company.radar.exception.UpstreamAuthException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

/**
 * Search Console webmasters v3 API over RestTemplate. Transient failures
 * (5xx, 429, I/O) are retried by the "searchAnalytics" Resilience4j instance;
 * a rejected token is not.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GoogleSearchConsoleClient implements SearchAnalyticsClient {

    private final RestTemplate restTemplate;
    private final RadarProperties properties;

    @Override
    @Retry(name = "searchAnalytics")
    public List<SiteEntry> listSites(String accessToken) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getUpstream().getBaseUrl() + "/webmasters/v3/sites")
                .build(true)
                .toUri();

        try {
            ResponseEntity<SiteListResponse> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers(accessToken)), SiteListResponse.class);
            SiteListResponse body = response.getBody();
            if (body == null || body.getSiteEntry() == null) {
                return Collections.emptyList();
            }
            return body.getSiteEntry();

        } catch (HttpClientErrorException.Unauthorized | HttpClientErrorException.Forbidden e) {
            throw new UpstreamAuthException("Upstream rejected credentials while listing sites", e);
        }
    }

    @Override
    @Retry(name = "searchAnalytics")
    public SearchAnalyticsResponse query(String accessToken, String siteUrl, SearchAnalyticsQuery query) {
        String encodedSite = URLEncoder.encode(siteUrl, StandardCharsets.UTF_8);
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getUpstream().getBaseUrl()
                        + "/webmasters/v3/sites/" + encodedSite + "/searchAnalytics/query")
                .build(true)
                .toUri();

        log.debug("Querying {} dimensions={} {}..{} startRow={}",
                siteUrl, query.getDimensions(), query.getStartDate(), query.getEndDate(), query.getStartRow());

        try {
            ResponseEntity<SearchAnalyticsResponse> response = restTemplate.exchange(
                    uri, HttpMethod.POST, new HttpEntity<>(query, headers(accessToken)),
                    SearchAnalyticsResponse.class);
            SearchAnalyticsResponse body = response.getBody();
            if (body == null || body.getRows() == null) {
                return new SearchAnalyticsResponse(Collections.emptyList());
            }
            return body;

        } catch (HttpClientErrorException.Unauthorized e) {
            throw new UpstreamAuthException("Upstream rejected credentials for " + siteUrl, e);
        }
    }

    private HttpHeaders headers(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
