package com.company.radar.repository;

import com.company.radar.domain.AlertDelivery;
import com.company.radar.domain.enums.DeliveryState;
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
import java.util.UUID;

/**
 * Per-recipient delivery rows. A row leaves 'unsent' exactly once; every
 * state write is guarded by state = 'unsent'.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class AlertDeliveryRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Materialize a delivery for the recipient. A second insert for the same
     * (alert, recipient) is ignored.
     *
     * @return true when a new row was created
     */
    public boolean insertIfAbsent(UUID alertId, UUID accountId, String recipient) {
        int inserted = jdbcTemplate.update("""
            INSERT INTO alert_deliveries (alert_id, account_id, recipient, state)
            VALUES (?, ?, ?, 'unsent')
            ON CONFLICT (alert_id, recipient) DO NOTHING
            """, alertId, accountId, recipient);
        return inserted > 0;
    }

    public int countByAlert(UUID alertId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alert_deliveries WHERE alert_id = ?", Integer.class, alertId);
        return count != null ? count : 0;
    }

    public int countUnsentByAlert(UUID alertId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alert_deliveries WHERE alert_id = ? AND state = 'unsent'",
                Integer.class, alertId);
        return count != null ? count : 0;
    }

    /**
     * Claim the unsent, unclaimed deliveries of an alert until {@code leaseUntil}.
     * Rows locked by a concurrent claim are skipped. The statement commits on its
     * own so no lock or connection outlives this call.
     */
    public List<AlertDelivery> claimUnsent(UUID alertId, Instant now, Instant leaseUntil, int limit) {
        String sql = """
            UPDATE alert_deliveries
            SET claimed_until = ?
            WHERE id IN (
                SELECT id FROM alert_deliveries
                WHERE alert_id = ?
                  AND state = 'unsent'
                  AND (claimed_until IS NULL OR claimed_until < ?)
                ORDER BY created_at
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            RETURNING id, alert_id, account_id, recipient, state, sent_at, claimed_until, created_at
            """;
        return jdbcTemplate.query(sql, new AlertDeliveryRowMapper(),
                Timestamp.from(leaseUntil), alertId, Timestamp.from(now), limit);
    }

    public boolean markSent(UUID deliveryId, Instant sentAt) {
        int updated = jdbcTemplate.update("""
            UPDATE alert_deliveries
            SET state = 'sent', sent_at = ?, claimed_until = NULL
            WHERE id = ? AND state = 'unsent'
            """, Timestamp.from(sentAt), deliveryId);
        return updated > 0;
    }

    public boolean markSuppressed(UUID deliveryId) {
        int updated = jdbcTemplate.update("""
            UPDATE alert_deliveries
            SET state = 'suppressed', claimed_until = NULL
            WHERE id = ? AND state = 'unsent'
            """, deliveryId);
        return updated > 0;
    }

    /**
     * Make a failed delivery immediately claimable by the next dispatch cycle.
     */
    public void releaseClaim(UUID deliveryId) {
        jdbcTemplate.update(
                "UPDATE alert_deliveries SET claimed_until = NULL WHERE id = ? AND state = 'unsent'",
                deliveryId);
    }

    /**
     * True when the recipient was sent an alert for the same property after {@code since}.
     */
    public boolean hasSentSince(UUID accountId, UUID propertyId, String recipient, Instant since) {
        Boolean exists = jdbcTemplate.queryForObject("""
            SELECT EXISTS (
                SELECT 1
                FROM alert_deliveries d
                JOIN alerts a ON a.id = d.alert_id
                WHERE d.account_id = ?
                  AND a.property_id = ?
                  AND d.recipient = ?
                  AND d.state = 'sent'
                  AND d.sent_at > ?
            )
            """, Boolean.class,
                accountId, propertyId, recipient, Timestamp.from(since));
        return Boolean.TRUE.equals(exists);
    }

    public int countUnsent() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alert_deliveries WHERE state = 'unsent'", Integer.class);
        return count != null ? count : 0;
    }

    private static class AlertDeliveryRowMapper implements RowMapper<AlertDelivery> {
        @Override
        public AlertDelivery mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AlertDelivery.builder()
                    .id(rs.getObject("id", UUID.class))
                    .alertId(rs.getObject("alert_id", UUID.class))
                    .accountId(rs.getObject("account_id", UUID.class))
                    .recipient(rs.getString("recipient"))
                    .state(DeliveryState.fromDbValue(rs.getString("state")))
                    .sentAt(getInstant(rs, "sent_at"))
                    .claimedUntil(getInstant(rs, "claimed_until"))
                    .createdAt(getInstant(rs, "created_at"))
                    .build();
        }

        private static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
