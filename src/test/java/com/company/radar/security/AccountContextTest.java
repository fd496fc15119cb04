package com.company.radar.security;

import com.company.radar.exception.AccountAccessDeniedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountContextTest {

    private static final UUID ACCOUNT_ID = UUID.randomUUID();

    private final AccountContext accountContext = new AccountContext();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void shouldAllowAccountListedInToken() {
        // given
        authenticate(List.of(ACCOUNT_ID.toString()), "ROLE_UI_READER");

        // when / then
        assertThatCode(() -> accountContext.verifyAccess(ACCOUNT_ID)).doesNotThrowAnyException();
        assertThat(accountContext.getCurrentUserId()).isEqualTo("user-1");
    }

    @Test
    void shouldDenyAccountMissingFromToken() {
        // given
        authenticate(List.of(UUID.randomUUID().toString()), "ROLE_UI_READER");

        // when / then
        assertThatThrownBy(() -> accountContext.verifyAccess(ACCOUNT_ID))
                .isInstanceOf(AccountAccessDeniedException.class)
                .hasMessageContaining("user-1");
    }

    @Test
    void shouldLetSchedulerReachEveryAccount() {
        // given
        authenticate(List.of(), "ROLE_SCHEDULER");

        // when / then
        assertThatCode(() -> accountContext.verifyAccess(ACCOUNT_ID)).doesNotThrowAnyException();
    }

    @Test
    void shouldDenyAnonymousCaller() {
        // when / then
        assertThatThrownBy(() -> accountContext.verifyAccess(ACCOUNT_ID))
                .isInstanceOf(AccountAccessDeniedException.class);
        assertThat(accountContext.getCurrentUserId()).isEqualTo("anonymous");
    }

    private static void authenticate(List<String> accountIds, String role) {
        Jwt jwt = Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("user-1")
                .claim("account_ids", accountIds)
                .build();
        SecurityContextHolder.getContext().setAuthentication(
                new JwtAuthenticationToken(jwt, List.of(new SimpleGrantedAuthority(role))));
    }
}
