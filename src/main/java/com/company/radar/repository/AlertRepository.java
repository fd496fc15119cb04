package com.company.radar.repository;

import com.company.radar.domain.Alert;
import com.company.radar.domain.enums.AlertType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AlertRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT a.id, a.account_id, a.property_id, a.alert_type,
               a.prev_window_value, a.last_window_value, a.delta_pct,
               a.triggered_at, a.email_sent, p.site_url
        FROM alerts a
        JOIN properties p ON p.id = a.property_id
        """;

    /**
     * True when an alert of the same type for the property was triggered after {@code since}.
     */
    public boolean existsTriggeredSince(UUID accountId, UUID propertyId, AlertType type, Instant since) {
        Boolean exists = jdbcTemplate.queryForObject("""
            SELECT EXISTS (
                SELECT 1 FROM alerts
                WHERE account_id = ?
                  AND property_id = ?
                  AND alert_type = ?
                  AND triggered_at > ?
            )
            """, Boolean.class,
                accountId, propertyId, type.getCode(), Timestamp.from(since));
        return Boolean.TRUE.equals(exists);
    }

    public Alert insert(Alert alert) {
        if (alert.getTriggeredAt() == null) {
            alert.setTriggeredAt(Instant.now());
        }

        UUID id = jdbcTemplate.queryForObject("""
            INSERT INTO alerts (
                account_id, property_id, alert_type,
                prev_window_value, last_window_value, delta_pct,
                triggered_at, email_sent
            ) VALUES (?, ?, ?, ?, ?, ?, ?, false)
            RETURNING id
            """, UUID.class,
                alert.getAccountId(),
                alert.getPropertyId(),
                alert.getAlertType().getCode(),
                alert.getPrevWindowValue(),
                alert.getLastWindowValue(),
                alert.getDeltaPct(),
                Timestamp.from(alert.getTriggeredAt()));

        alert.setId(id);
        alert.setEmailSent(false);
        return alert;
    }

    /**
     * First page of alerts not yet closed, ordered by (triggered_at, id).
     */
    public List<Alert> findPending(int limit) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE a.email_sent = false ORDER BY a.triggered_at ASC, a.id ASC LIMIT ?",
                new AlertRowMapper(), limit);
    }

    /**
     * Next page of alerts not yet closed, strictly after the given (triggered_at, id) key.
     */
    public List<Alert> findPendingAfter(Instant triggeredAt, UUID alertId, int limit) {
        return jdbcTemplate.query(SELECT_BASE + """
             WHERE a.email_sent = false
               AND (a.triggered_at, a.id) > (?, ?)
             ORDER BY a.triggered_at ASC, a.id ASC
             LIMIT ?
            """, new AlertRowMapper(), Timestamp.from(triggeredAt), alertId, limit);
    }

    public List<Alert> findByAccount(UUID accountId, int limit) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE a.account_id = ? ORDER BY a.triggered_at DESC LIMIT ?",
                new AlertRowMapper(), accountId, limit);
    }

    public Optional<Alert> findById(UUID accountId, UUID alertId) {
        List<Alert> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE a.account_id = ? AND a.id = ?",
                new AlertRowMapper(), accountId, alertId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Close the alert. Idempotent; only flips email_sent from false to true.
     */
    public boolean markClosed(UUID accountId, UUID alertId) {
        int updated = jdbcTemplate.update(
                "UPDATE alerts SET email_sent = true WHERE id = ? AND account_id = ? AND email_sent = false",
                alertId, accountId);
        return updated > 0;
    }

    public int countPending() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alerts WHERE email_sent = false", Integer.class);
        return count != null ? count : 0;
    }

    /**
     * Delete closed alerts triggered before the cutoff. Deliveries cascade.
     */
    public int deleteClosedBefore(Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM alerts WHERE email_sent = true AND triggered_at < ?",
                Timestamp.from(cutoff));
    }

    private static class AlertRowMapper implements RowMapper<Alert> {
        @Override
        public Alert mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Alert.builder()
                    .id(rs.getObject("id", UUID.class))
                    .accountId(rs.getObject("account_id", UUID.class))
                    .propertyId(rs.getObject("property_id", UUID.class))
                    .alertType(AlertType.fromCode(rs.getString("alert_type")))
                    .prevWindowValue(rs.getLong("prev_window_value"))
                    .lastWindowValue(rs.getLong("last_window_value"))
                    .deltaPct(rs.getBigDecimal("delta_pct"))
                    .triggeredAt(rs.getTimestamp("triggered_at").toInstant())
                    .emailSent(rs.getBoolean("email_sent"))
                    .siteUrl(rs.getString("site_url"))
                    .build();
        }
    }
}
