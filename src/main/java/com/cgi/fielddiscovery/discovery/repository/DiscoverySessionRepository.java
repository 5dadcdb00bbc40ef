package com.cgi.fielddiscovery.discovery.repository;

import com.cgi.fielddiscovery.discovery.model.DiscoverySession;
import com.cgi.fielddiscovery.discovery.model.enums.SessionStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to discovery sessions.
 * Status updates are conditional on the current status, so terminal sessions are never reopened,
 * and progress is written with GREATEST so it never decreases.
 */
@Repository
public class DiscoverySessionRepository extends AbstractJdbcRepository {

    private static final String SELECT_ALL = "SELECT * FROM field_discovery_sessions";

    private final RowMapper<DiscoverySession> rowMapper = (rs, rowNum) -> {
        long duration = rs.getLong("duration_ms");
        Long durationMs = rs.wasNull() ? null : duration;
        return DiscoverySession.builder()
                .id(rs.getString("id"))
                .dataSourceId(rs.getString("data_source_id"))
                .targetSchemas(fromJson(rs.getString("target_schemas")))
                .targetTables(fromJson(rs.getString("target_tables")))
                .status(SessionStatus.fromValue(rs.getString("status")))
                .progress(rs.getInt("progress"))
                .fieldsDiscovered(rs.getInt("fields_discovered"))
                .fieldsClassified(rs.getInt("fields_classified"))
                .piiFieldsFound(rs.getInt("pii_fields_found"))
                .phiFieldsFound(rs.getInt("phi_fields_found"))
                .financialFieldsFound(rs.getInt("financial_fields_found"))
                .failedTableGroups(rs.getInt("failed_table_groups"))
                .errorMessage(rs.getString("error_message"))
                .triggeredBy(rs.getString("triggered_by"))
                .forceRefresh(rs.getBoolean("force_refresh"))
                .startedAt(toLocalDateTime(rs.getTimestamp("started_at")))
                .completedAt(toLocalDateTime(rs.getTimestamp("completed_at")))
                .updatedAt(toLocalDateTime(rs.getTimestamp("updated_at")))
                .durationMs(durationMs)
                .build();
    };

    public DiscoverySessionRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    public void insert(DiscoverySession session) {
        String sql = "INSERT INTO field_discovery_sessions (id, data_source_id, target_schemas, target_tables, "
                + "status, progress, error_message, triggered_by, force_refresh, started_at, updated_at) "
                + "VALUES (:id, :dataSourceId, :targetSchemas, :targetTables, :status, :progress, :errorMessage, "
                + ":triggeredBy, :forceRefresh, :startedAt, :updatedAt)";

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", session.getId())
                .addValue("dataSourceId", session.getDataSourceId())
                .addValue("targetSchemas", toJson(session.getTargetSchemas()))
                .addValue("targetTables", toJson(session.getTargetTables()))
                .addValue("status", session.getStatus().getValue())
                .addValue("progress", session.getProgress())
                .addValue("errorMessage", session.getErrorMessage())
                .addValue("triggeredBy", session.getTriggeredBy())
                .addValue("forceRefresh", session.isForceRefresh())
                .addValue("startedAt", toTimestamp(session.getStartedAt()))
                .addValue("updatedAt", toTimestamp(session.getUpdatedAt()));

        execute("insert session " + session.getId(), jdbc -> jdbc.update(sql, params));
    }

    public Optional<DiscoverySession> findById(String id) {
        List<DiscoverySession> result = execute("find session " + id, jdbc -> jdbc.query(
                SELECT_ALL + " WHERE id = :id", new MapSqlParameterSource("id", id), rowMapper));
        return result.stream().findFirst();
    }

    /**
     * Lists sessions, newest first.
     *
     * @param dataSourceId Optional data source filter
     * @param limit Maximum number of sessions
     * @return Sessions
     */
    public List<DiscoverySession> findRecent(String dataSourceId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", limit);
        StringBuilder sql = new StringBuilder(SELECT_ALL);
        if (dataSourceId != null) {
            sql.append(" WHERE data_source_id = :dataSourceId");
            params.addValue("dataSourceId", dataSourceId);
        }
        sql.append(" ORDER BY started_at DESC LIMIT :limit");
        return execute("list sessions", jdbc -> jdbc.query(sql.toString(), params, rowMapper));
    }

    /**
     * Moves a pending session to processing.
     *
     * @return true if the session was pending
     */
    public boolean markProcessing(String id, int progress, LocalDateTime now) {
        String sql = "UPDATE field_discovery_sessions SET status = :processing, "
                + "progress = GREATEST(progress, :progress), updated_at = :now "
                + "WHERE id = :id AND status = :pending";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("progress", progress)
                .addValue("now", toTimestamp(now))
                .addValue("processing", SessionStatus.PROCESSING.getValue())
                .addValue("pending", SessionStatus.PENDING.getValue());
        return execute("mark session processing " + id, jdbc -> jdbc.update(sql, params)) == 1;
    }

    /**
     * Raises the progress of a processing session. Lower values are ignored.
     */
    public void updateProgress(String id, int progress, LocalDateTime now) {
        String sql = "UPDATE field_discovery_sessions SET progress = GREATEST(progress, :progress), "
                + "updated_at = :now WHERE id = :id AND status = :processing";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("progress", progress)
                .addValue("now", toTimestamp(now))
                .addValue("processing", SessionStatus.PROCESSING.getValue());
        execute("update session progress " + id, jdbc -> jdbc.update(sql, params));
    }

    /**
     * Completes a processing session with its aggregate counts and progress 100.
     *
     * @return true if the session was processing
     */
    public boolean complete(DiscoverySession session, LocalDateTime now) {
        String sql = "UPDATE field_discovery_sessions SET status = :completed, progress = 100, "
                + "fields_discovered = :fieldsDiscovered, fields_classified = :fieldsClassified, "
                + "pii_fields_found = :pii, phi_fields_found = :phi, financial_fields_found = :financial, "
                + "failed_table_groups = :failedTableGroups, error_message = :errorMessage, "
                + "completed_at = :now, updated_at = :now, duration_ms = :durationMs "
                + "WHERE id = :id AND status = :processing";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", session.getId())
                .addValue("fieldsDiscovered", session.getFieldsDiscovered())
                .addValue("fieldsClassified", session.getFieldsClassified())
                .addValue("pii", session.getPiiFieldsFound())
                .addValue("phi", session.getPhiFieldsFound())
                .addValue("financial", session.getFinancialFieldsFound())
                .addValue("failedTableGroups", session.getFailedTableGroups())
                .addValue("errorMessage", session.getErrorMessage())
                .addValue("durationMs", session.getDurationMs())
                .addValue("now", toTimestamp(now))
                .addValue("completed", SessionStatus.COMPLETED.getValue())
                .addValue("processing", SessionStatus.PROCESSING.getValue());
        return execute("complete session " + session.getId(), jdbc -> jdbc.update(sql, params)) == 1;
    }

    /**
     * Fails a non-terminal session.
     *
     * @return true if the session was still pending or processing
     */
    public boolean fail(String id, String errorMessage, LocalDateTime now) {
        String sql = "UPDATE field_discovery_sessions SET status = :failed, error_message = :errorMessage, "
                + "completed_at = :now, updated_at = :now WHERE id = :id AND status IN (:active)";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("errorMessage", errorMessage)
                .addValue("now", toTimestamp(now))
                .addValue("failed", SessionStatus.FAILED.getValue())
                .addValue("active", List.of(SessionStatus.PENDING.getValue(), SessionStatus.PROCESSING.getValue()));
        return execute("fail session " + id, jdbc -> jdbc.update(sql, params)) == 1;
    }

    /**
     * Finds pending or processing sessions whose last update is older than the threshold.
     */
    public List<String> findStaleIds(LocalDateTime updatedBefore) {
        String sql = "SELECT id FROM field_discovery_sessions WHERE status IN (:active) AND updated_at < :threshold";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("threshold", toTimestamp(updatedBefore))
                .addValue("active", List.of(SessionStatus.PENDING.getValue(), SessionStatus.PROCESSING.getValue()));
        return execute("find stale sessions", jdbc -> jdbc.queryForList(sql, params, String.class));
    }

    public boolean delete(String id) {
        return execute("delete session " + id, jdbc -> jdbc.update(
                "DELETE FROM field_discovery_sessions WHERE id = :id", new MapSqlParameterSource("id", id))) == 1;
    }
}
