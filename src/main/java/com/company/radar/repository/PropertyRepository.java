package com.company.radar.repository;

import com.company.radar.domain.Property;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
@Slf4j
public class PropertyRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, account_id, site_url, permission_level, created_at
        FROM properties
        """;

    /**
     * Insert or refresh the permission level of a property. Identity (id, site_url)
     * never changes once created.
     */
    public Property upsert(UUID accountId, String siteUrl, String permissionLevel) {
        String sql = """
            INSERT INTO properties (account_id, site_url, permission_level)
            VALUES (?, ?, ?)
            ON CONFLICT (account_id, site_url) DO UPDATE SET
                permission_level = EXCLUDED.permission_level
            RETURNING id, account_id, site_url, permission_level, created_at
            """;
        return jdbcTemplate.queryForObject(sql, new PropertyRowMapper(), accountId, siteUrl, permissionLevel);
    }

    public List<Property> findAllByAccount(UUID accountId) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE account_id = ? ORDER BY site_url",
                new PropertyRowMapper(), accountId);
    }

    public Optional<Property> findById(UUID accountId, UUID propertyId) {
        List<Property> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE account_id = ? AND id = ?",
                new PropertyRowMapper(), accountId, propertyId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static class PropertyRowMapper implements RowMapper<Property> {
        @Override
        public Property mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Property.builder()
                    .id(rs.getObject("id", UUID.class))
                    .accountId(rs.getObject("account_id", UUID.class))
                    .siteUrl(rs.getString("site_url"))
                    .permissionLevel(rs.getString("permission_level"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
