package com.company.radar.repository;

import com.company.radar.domain.PipelineRun;
import com.company.radar.service.run.RunStateUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Guarded reads and writes of pipeline_runs. Every mutation of a running row
 * is conditional on is_running=true so a closed run can never be reopened.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class PipelineRunRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, account_id, is_running, current_step, progress_current, progress_total,
               error, started_at, completed_at, updated_at
        FROM pipeline_runs
        """;

    /**
     * Force-terminate running rows of the account whose heartbeat is older than
     * {@code heartbeatCutoff} or that started before {@code hardCutoff}.
     *
     * @return number of reaped runs
     */
    public int reapStale(UUID accountId, Instant now, Instant heartbeatCutoff, Instant hardCutoff) {
        return jdbcTemplate.update("""
            UPDATE pipeline_runs
            SET is_running = false,
                completed_at = ?,
                updated_at = ?,
                error = CASE
                    WHEN started_at < ? THEN 'Terminated: exceeded maximum run time (hard timeout)'
                    ELSE 'Terminated: no heartbeat received (worker presumed dead)'
                END
            WHERE account_id = ?
              AND is_running = true
              AND (updated_at < ? OR started_at < ?)
            """,
                Timestamp.from(now),
                Timestamp.from(now),
                Timestamp.from(hardCutoff),
                accountId,
                Timestamp.from(heartbeatCutoff),
                Timestamp.from(hardCutoff));
    }

    /**
     * Insert a running row. The partial unique index rejects a second running
     * row for the same account.
     *
     * @throws DuplicateKeyException when a run is already active
     */
    public UUID insertRunning(UUID accountId, Instant now) throws DuplicateKeyException {
        UUID runId = UUID.randomUUID();
        jdbcTemplate.update("""
            INSERT INTO pipeline_runs (
                id, account_id, is_running, current_step, progress_current, progress_total,
                started_at, updated_at
            ) VALUES (?, ?, true, 'Starting', 0, 0, ?, ?)
            """,
                runId,
                accountId,
                Timestamp.from(now),
                Timestamp.from(now));
        return runId;
    }

    /**
     * Apply the non-null fields of {@code update} to the run if it is still
     * running, bumping the heartbeat.
     *
     * @return rows affected, 0 when the run was already closed
     */
    public int updateIfRunning(UUID accountId, UUID runId, RunStateUpdate update, Instant now) {
        StringBuilder sql = new StringBuilder("UPDATE pipeline_runs SET updated_at = ?");
        List<Object> params = new ArrayList<>();
        params.add(Timestamp.from(now));

        if (update.getCurrentStep() != null) {
            sql.append(", current_step = ?");
            params.add(update.getCurrentStep());
        }
        if (update.getProgressCurrent() != null) {
            sql.append(", progress_current = ?");
            params.add(update.getProgressCurrent());
        }
        if (update.getProgressTotal() != null) {
            sql.append(", progress_total = ?");
            params.add(update.getProgressTotal());
        }
        if (update.getError() != null) {
            sql.append(", error = ?");
            params.add(update.getError());
        }
        if (update.isFinish()) {
            sql.append(", is_running = false, completed_at = ?");
            params.add(Timestamp.from(now));
        }

        sql.append(" WHERE id = ? AND account_id = ? AND is_running = true");
        params.add(runId);
        params.add(accountId);

        return jdbcTemplate.update(sql.toString(), params.toArray());
    }

    public boolean isRunning(UUID accountId, UUID runId) {
        List<Boolean> flags = jdbcTemplate.query(
                "SELECT is_running FROM pipeline_runs WHERE id = ? AND account_id = ?",
                (rs, rowNum) -> rs.getBoolean("is_running"),
                runId, accountId);
        return !flags.isEmpty() && flags.get(0);
    }

    public Optional<PipelineRun> findLatest(UUID accountId) {
        List<PipelineRun> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE account_id = ? ORDER BY started_at DESC NULLS LAST LIMIT 1",
                new PipelineRunRowMapper(), accountId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<PipelineRun> findById(UUID accountId, UUID runId) {
        List<PipelineRun> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE id = ? AND account_id = ?",
                new PipelineRunRowMapper(), runId, accountId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public int countRunning() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM pipeline_runs WHERE is_running = true", Integer.class);
        return count != null ? count : 0;
    }

    /**
     * Delete finished runs completed before the cutoff. Running rows are never touched.
     */
    public int deleteFinishedBefore(Instant cutoff) {
        return jdbcTemplate.update("""
            DELETE FROM pipeline_runs
            WHERE is_running = false
              AND completed_at < ?
            """, Timestamp.from(cutoff));
    }

    private static class PipelineRunRowMapper implements RowMapper<PipelineRun> {
        @Override
        public PipelineRun mapRow(ResultSet rs, int rowNum) throws SQLException {
            return PipelineRun.builder()
                    .id(rs.getObject("id", UUID.class))
                    .accountId(rs.getObject("account_id", UUID.class))
                    .running(rs.getBoolean("is_running"))
                    .currentStep(rs.getString("current_step"))
                    .progressCurrent(rs.getInt("progress_current"))
                    .progressTotal(rs.getInt("progress_total"))
                    .error(rs.getString("error"))
                    .startedAt(getInstant(rs, "started_at"))
                    .completedAt(getInstant(rs, "completed_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }

        private static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
