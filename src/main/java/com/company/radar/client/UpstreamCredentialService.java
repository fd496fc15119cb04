package com.company.radar.client;

import com.company.radar.domain.OAuthToken;
import com.company.radar.exception.UpstreamAuthException;
import com.company.radar.repository.OAuthTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Hands out a valid access token for an account, refreshing and persisting it
 * when the stored one is expired.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UpstreamCredentialService {

    private final OAuthTokenRepository tokenRepository;
    private final OAuthTokenClient tokenClient;

    public String getAccessToken(UUID accountId) {
        OAuthToken token = tokenRepository.findByAccount(accountId)
                .orElseThrow(() -> new UpstreamAuthException("No stored credentials for account " + accountId));

        if (!token.isExpired(Instant.now()) && token.getAccessToken() != null) {
            return token.getAccessToken();
        }

        if (token.getRefreshToken() == null) {
            throw new UpstreamAuthException("Credentials for account " + accountId
                    + " are expired and no refresh token is stored");
        }

        log.info("Access token expired for account {}, refreshing", accountId);
        OAuthToken refreshed = tokenClient.refresh(token);
        tokenRepository.upsert(refreshed);
        return refreshed.getAccessToken();
    }
}
