package com.company.radar.client;

import com.company.radar.client.dto.TokenResponse;
import com.company.radar.config.RadarProperties;
import com.company.radar.domain.OAuthToken;
import com.company.radar.exception.UpstreamAuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

/**
 * OAuth2 refresh-token grant against the token endpoint stored with the token.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OAuthTokenClient {

    private final RestTemplate restTemplate;
    private final RadarProperties properties;

    public OAuthToken refresh(OAuthToken token) {
        String tokenUri = token.getTokenUri() != null
                ? token.getTokenUri()
                : properties.getUpstream().getTokenUri();
        String clientId = token.getClientId() != null
                ? token.getClientId()
                : properties.getUpstream().getClientId();

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", token.getRefreshToken());
        form.add("client_id", clientId);
        if (properties.getUpstream().getClientSecret() != null) {
            form.add("client_secret", properties.getUpstream().getClientSecret());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        TokenResponse response;
        try {
            response = restTemplate.postForObject(tokenUri, new HttpEntity<>(form, headers), TokenResponse.class);
        } catch (HttpClientErrorException e) {
            // invalid_grant and friends: the refresh token is revoked or expired
            throw new UpstreamAuthException(
                    "Token refresh rejected for account " + token.getAccountId() + ": " + e.getStatusCode(), e);
        }

        if (response == null || response.getAccessToken() == null) {
            throw new UpstreamAuthException("Token endpoint returned no access token for account "
                    + token.getAccountId());
        }

        log.debug("Refreshed access token for account {}", token.getAccountId());

        return token.toBuilder()
                .accessToken(response.getAccessToken())
                .refreshToken(response.getRefreshToken() != null ? response.getRefreshToken() : token.getRefreshToken())
                .tokenUri(tokenUri)
                .clientId(clientId)
                .scopes(response.getScope() != null ? response.getScope() : token.getScopes())
                .expiry(response.getExpiresIn() != null
                        ? Instant.now().plusSeconds(response.getExpiresIn())
                        : null)
                .build();
    }
}
