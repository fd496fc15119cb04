package com.company.radar.repository;

import com.company.radar.domain.AlertSubscription;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class AlertSubscriptionRepository {

    private final JdbcTemplate jdbcTemplate;

    public List<String> findRecipients(UUID accountId, UUID propertyId) {
        return jdbcTemplate.queryForList("""
            SELECT DISTINCT recipient
            FROM alert_subscriptions
            WHERE account_id = ? AND property_id = ?
            ORDER BY recipient
            """, String.class, accountId, propertyId);
    }

    public List<AlertSubscription> findByAccount(UUID accountId) {
        return jdbcTemplate.query("""
            SELECT id, account_id, recipient, property_id, created_at
            FROM alert_subscriptions
            WHERE account_id = ?
            ORDER BY recipient, created_at
            """, new AlertSubscriptionRowMapper(), accountId);
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the subscription already exists
     */
    public AlertSubscription insert(UUID accountId, String recipient, UUID propertyId) {
        return jdbcTemplate.queryForObject("""
            INSERT INTO alert_subscriptions (account_id, recipient, property_id)
            VALUES (?, ?, ?)
            RETURNING id, account_id, recipient, property_id, created_at
            """, new AlertSubscriptionRowMapper(), accountId, recipient, propertyId);
    }

    public boolean delete(UUID accountId, UUID subscriptionId) {
        return jdbcTemplate.update(
                "DELETE FROM alert_subscriptions WHERE id = ? AND account_id = ?",
                subscriptionId, accountId) > 0;
    }

    private static class AlertSubscriptionRowMapper implements RowMapper<AlertSubscription> {
        @Override
        public AlertSubscription mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AlertSubscription.builder()
                    .id(rs.getObject("id", UUID.class))
                    .accountId(rs.getObject("account_id", UUID.class))
                    .recipient(rs.getString("recipient"))
                    .propertyId(rs.getObject("property_id", UUID.class))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
