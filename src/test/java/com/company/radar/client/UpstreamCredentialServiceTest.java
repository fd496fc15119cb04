package com.company.radar.client;

import com.company.radar.domain.OAuthToken;
import com.company.radar.exception.UpstreamAuthException;
import com.company.radar.repository.OAuthTokenRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class UpstreamCredentialServiceTest {

    private static final UUID ACCOUNT_ID = UUID.randomUUID();

    @Mock
    private OAuthTokenRepository tokenRepository;
    @Mock
    private OAuthTokenClient tokenClient;

    @InjectMocks
    private UpstreamCredentialService credentialService;

    @Test
    void shouldReuseStoredTokenWhileValid() {
        // given
        given(tokenRepository.findByAccount(ACCOUNT_ID))
                .willReturn(Optional.of(token("stored", Instant.now().plusSeconds(1800))));

        // when
        String accessToken = credentialService.getAccessToken(ACCOUNT_ID);

        // then
        assertThat(accessToken).isEqualTo("stored");
        then(tokenClient).should(never()).refresh(any());
    }

    @Test
    void shouldRefreshAndPersistTokenAboutToExpire() {
        // given
        OAuthToken expiring = token("stored", Instant.now().plusSeconds(30));
        OAuthToken refreshed = token("fresh", Instant.now().plusSeconds(3600));
        given(tokenRepository.findByAccount(ACCOUNT_ID)).willReturn(Optional.of(expiring));
        given(tokenClient.refresh(expiring)).willReturn(refreshed);

        // when
        String accessToken = credentialService.getAccessToken(ACCOUNT_ID);

        // then
        assertThat(accessToken).isEqualTo("fresh");
        then(tokenRepository).should().upsert(refreshed);
    }

    @Test
    void shouldFailWithoutRefreshToken() {
        // given
        OAuthToken expired = token("stored", Instant.now().minusSeconds(60)).toBuilder().refreshToken(null).build();
        given(tokenRepository.findByAccount(ACCOUNT_ID)).willReturn(Optional.of(expired));

        // when / then
        assertThatThrownBy(() -> credentialService.getAccessToken(ACCOUNT_ID))
                .isInstanceOf(UpstreamAuthException.class);
    }

    private static OAuthToken token(String accessToken, Instant expiry) {
        return OAuthToken.builder()
                .accountId(ACCOUNT_ID)
                .accessToken(accessToken)
                .refreshToken("refresh")
                .expiry(expiry)
                .build();
    }
}
