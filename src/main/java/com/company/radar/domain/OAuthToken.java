package com.company.radar.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OAuthToken {
    private UUID accountId;
    private String accessToken;
    private String refreshToken;
    private String tokenUri;
    private String clientId;
    private String scopes;
    private Instant expiry;

    public boolean isExpired(Instant now) {
        // Treat tokens expiring within a minute as already expired
        return expiry == null || !expiry.isAfter(now.plusSeconds(60));
    }
}
