package com.company.radar.repository;

import com.company.radar.domain.Account;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, google_email, data_initialized, created_at
        FROM accounts
        """;

    public List<Account> findAll() {
        return jdbcTemplate.query(SELECT_BASE + " ORDER BY created_at", new AccountRowMapper());
    }

    public Optional<Account> findById(UUID accountId) {
        List<Account> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE id = ?", new AccountRowMapper(), accountId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public boolean exists(UUID accountId) {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM accounts WHERE id = ?)", Boolean.class, accountId);
        return Boolean.TRUE.equals(exists);
    }

    public void markDataInitialized(UUID accountId) {
        jdbcTemplate.update(
                "UPDATE accounts SET data_initialized = true WHERE id = ? AND data_initialized = false",
                accountId);
    }

    private static class AccountRowMapper implements RowMapper<Account> {
        @Override
        public Account mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Account.builder()
                    .id(rs.getObject("id", UUID.class))
                    .googleEmail(rs.getString("google_email"))
                    .dataInitialized(rs.getBoolean("data_initialized"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
