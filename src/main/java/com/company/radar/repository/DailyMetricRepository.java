package com.company.radar.repository;

import com.company.radar.domain.DailyMetric;
import com.company.radar.domain.enums.MetricSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Daily metric rows for the three sources. Table and key column come from
 * {@link MetricSource}, never from callers.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class DailyMetricRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Upsert one batch keyed by (property, dimension key, date). Re-ingesting a
     * date overwrites its numbers.
     */
    public int upsertBatch(MetricSource source, UUID propertyId, List<DailyMetric> rows) {
        if (rows.isEmpty()) {
            return 0;
        }

        String sql = source.isKeyed()
                ? """
                  INSERT INTO %1$s (property_id, %2$s, date, clicks, impressions, ctr, position, updated_at)
                  VALUES (?, ?, ?, ?, ?, ?, ?, now())
                  ON CONFLICT (property_id, %2$s, date) DO UPDATE SET
                      clicks = EXCLUDED.clicks,
                      impressions = EXCLUDED.impressions,
                      ctr = EXCLUDED.ctr,
                      position = EXCLUDED.position,
                      updated_at = now()
                  """.formatted(source.getTable(), source.getKeyColumn())
                : """
                  INSERT INTO %1$s (property_id, date, clicks, impressions, ctr, position, updated_at)
                  VALUES (?, ?, ?, ?, ?, ?, now())
                  ON CONFLICT (property_id, date) DO UPDATE SET
                      clicks = EXCLUDED.clicks,
                      impressions = EXCLUDED.impressions,
                      ctr = EXCLUDED.ctr,
                      position = EXCLUDED.position,
                      updated_at = now()
                  """.formatted(source.getTable());

        int[] counts = jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                DailyMetric row = rows.get(i);
                int idx = 1;
                ps.setObject(idx++, propertyId);
                if (source.isKeyed()) {
                    ps.setString(idx++, row.getDimensionKey());
                }
                ps.setDate(idx++, Date.valueOf(row.getDate()));
                ps.setLong(idx++, row.getClicks());
                ps.setLong(idx++, row.getImpressions());
                ps.setBigDecimal(idx++, BigDecimal.valueOf(row.getCtr()));
                if (row.getPosition() != null) {
                    ps.setBigDecimal(idx, BigDecimal.valueOf(row.getPosition()));
                } else {
                    ps.setNull(idx, Types.NUMERIC);
                }
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });

        return counts.length;
    }

    /**
     * Distinct dates present for the property in [from, to], used by window planning.
     */
    public int countDistinctDates(MetricSource source, UUID propertyId, LocalDate from, LocalDate to) {
        String sql = """
            SELECT COUNT(DISTINCT date)
            FROM %s
            WHERE property_id = ?
              AND date BETWEEN ? AND ?
            """.formatted(source.getTable());
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class,
                propertyId, Date.valueOf(from), Date.valueOf(to));
        return count != null ? count : 0;
    }

    /**
     * Rows of one property dated on or after {@code since}, scoped to the owning account.
     */
    public List<DailyMetric> findSince(MetricSource source, UUID accountId, UUID propertyId, LocalDate since) {
        String keyExpr = source.isKeyed() ? "m." + source.getKeyColumn() : "NULL";
        String sql = """
            SELECT %s AS dimension_key, m.date, m.clicks, m.impressions, m.ctr, m.position
            FROM %s m
            JOIN properties p ON p.id = m.property_id
            WHERE p.account_id = ?
              AND m.property_id = ?
              AND m.date >= ?
            ORDER BY m.date
            """.formatted(keyExpr, source.getTable());
        return jdbcTemplate.query(sql, new DailyMetricRowMapper(),
                accountId, propertyId, Date.valueOf(since));
    }

    private static class DailyMetricRowMapper implements RowMapper<DailyMetric> {
        @Override
        public DailyMetric mapRow(ResultSet rs, int rowNum) throws SQLException {
            BigDecimal ctr = rs.getBigDecimal("ctr");
            BigDecimal position = rs.getBigDecimal("position");
            return DailyMetric.builder()
                    .dimensionKey(rs.getString("dimension_key"))
                    .date(rs.getDate("date").toLocalDate())
                    .clicks(rs.getLong("clicks"))
                    .impressions(rs.getLong("impressions"))
                    .ctr(ctr != null ? ctr.doubleValue() : 0.0)
                    .position(position != null ? position.doubleValue() : null)
                    .build();
        }
    }
}
