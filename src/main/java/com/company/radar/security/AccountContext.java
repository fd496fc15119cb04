package com.company.radar.security;

import com.company.radar.exception.AccountAccessDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Resolves which accounts the caller may touch from the JWT, so the path
 * variable alone never grants access to another account's data.
 */
@Component
@Slf4j
public class AccountContext {

    private static final Set<String> CROSS_ACCOUNT_ROLES = Set.of("ROLE_ADMIN", "ROLE_SCHEDULER");

    /**
     * @throws AccountAccessDeniedException when the token carries neither a
     *         cross-account role nor the account in its account_ids claim
     */
    public void verifyAccess(UUID accountId) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            throw new AccountAccessDeniedException("anonymous", accountId);
        }

        for (GrantedAuthority authority : authentication.getAuthorities()) {
            if (CROSS_ACCOUNT_ROLES.contains(authority.getAuthority())) {
                return;
            }
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            List<String> accountIds = jwt.getClaimAsStringList("account_ids");
            if (accountIds != null && accountIds.contains(accountId.toString())) {
                return;
            }
            log.warn("Subject {} denied access to account {}", jwt.getSubject(), accountId);
            throw new AccountAccessDeniedException(jwt.getSubject(), accountId);
        }

        log.warn("Unexpected authentication principal type: {}",
                authentication.getPrincipal().getClass());
        throw new AccountAccessDeniedException(authentication.getName(), accountId);
    }

    public String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.getPrincipal() instanceof Jwt jwt) {
            return jwt.getSubject();
        }

        return "anonymous";
    }
}
