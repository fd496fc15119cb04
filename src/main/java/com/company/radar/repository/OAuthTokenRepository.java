package com.company.radar.repository;

import com.company.radar.domain.OAuthToken;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class OAuthTokenRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<OAuthToken> findByAccount(UUID accountId) {
        String sql = """
            SELECT account_id, access_token, refresh_token, token_uri, client_id, scopes, expiry
            FROM oauth_tokens
            WHERE account_id = ?
            """;
        List<OAuthToken> results = jdbcTemplate.query(sql, new OAuthTokenRowMapper(), accountId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public void upsert(OAuthToken token) {
        String sql = """
            INSERT INTO oauth_tokens (
                account_id, access_token, refresh_token, token_uri, client_id, scopes, expiry, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, now())
            ON CONFLICT (account_id) DO UPDATE SET
                access_token = EXCLUDED.access_token,
                refresh_token = COALESCE(EXCLUDED.refresh_token, oauth_tokens.refresh_token),
                token_uri = EXCLUDED.token_uri,
                client_id = EXCLUDED.client_id,
                scopes = EXCLUDED.scopes,
                expiry = EXCLUDED.expiry,
                updated_at = now()
            """;
        jdbcTemplate.update(sql,
                token.getAccountId(),
                token.getAccessToken(),
                token.getRefreshToken(),
                token.getTokenUri(),
                token.getClientId(),
                token.getScopes(),
                token.getExpiry() != null ? Timestamp.from(token.getExpiry()) : null);
    }

    private static class OAuthTokenRowMapper implements RowMapper<OAuthToken> {
        @Override
        public OAuthToken mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp expiry = rs.getTimestamp("expiry");
            return OAuthToken.builder()
                    .accountId(rs.getObject("account_id", UUID.class))
                    .accessToken(rs.getString("access_token"))
                    .refreshToken(rs.getString("refresh_token"))
                    .tokenUri(rs.getString("token_uri"))
                    .clientId(rs.getString("client_id"))
                    .scopes(rs.getString("scopes"))
                    .expiry(expiry != null ? expiry.toInstant() : null)
                    .build();
        }
    }
}
