package com.cgi.fielddiscovery.discovery.repository;

import com.cgi.fielddiscovery.discovery.model.ClassificationHistoryEntry;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.function.Function;

/**
 * Append-only access to the classification audit trail. Entries are never updated,
 * except for detaching them from a deleted session.
 */
@Repository
public class ClassificationHistoryRepository extends AbstractJdbcRepository {

    private final RowMapper<ClassificationHistoryEntry> rowMapper = (rs, rowNum) -> ClassificationHistoryEntry.builder()
            .id(rs.getString("id"))
            .fieldId(rs.getString("field_id"))
            .previousClassification(parse(rs.getString("previous_classification"), FieldClassification::fromValue))
            .newClassification(parse(rs.getString("new_classification"), FieldClassification::fromValue))
            .previousSensitivity(parse(rs.getString("previous_sensitivity"), Sensitivity::fromValue))
            .newSensitivity(parse(rs.getString("new_sensitivity"), Sensitivity::fromValue))
            .previousStatus(parse(rs.getString("previous_status"), FieldStatus::fromValue))
            .newStatus(parse(rs.getString("new_status"), FieldStatus::fromValue))
            .changeReason(rs.getString("change_reason"))
            .changedBy(rs.getString("changed_by"))
            .changedAt(toLocalDateTime(rs.getTimestamp("changed_at")))
            .sessionId(rs.getString("session_id"))
            .build();

    public ClassificationHistoryRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    public void insert(ClassificationHistoryEntry entry) {
        String sql = "INSERT INTO field_classification_history (id, field_id, previous_classification, "
                + "new_classification, previous_sensitivity, new_sensitivity, previous_status, new_status, "
                + "change_reason, changed_by, changed_at, session_id) VALUES (:id, :fieldId, :previousClassification, "
                + ":newClassification, :previousSensitivity, :newSensitivity, :previousStatus, :newStatus, "
                + ":changeReason, :changedBy, :changedAt, :sessionId)";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", entry.getId())
                .addValue("fieldId", entry.getFieldId())
                .addValue("previousClassification", value(entry.getPreviousClassification()))
                .addValue("newClassification", value(entry.getNewClassification()))
                .addValue("previousSensitivity", value(entry.getPreviousSensitivity()))
                .addValue("newSensitivity", value(entry.getNewSensitivity()))
                .addValue("previousStatus", value(entry.getPreviousStatus()))
                .addValue("newStatus", value(entry.getNewStatus()))
                .addValue("changeReason", entry.getChangeReason())
                .addValue("changedBy", entry.getChangedBy())
                .addValue("changedAt", toTimestamp(entry.getChangedAt()))
                .addValue("sessionId", entry.getSessionId());
        execute("insert history entry for field " + entry.getFieldId(), jdbc -> jdbc.update(sql, params));
    }

    /**
     * Lists the history of a field in the order it was written.
     */
    public List<ClassificationHistoryEntry> findByFieldId(String fieldId) {
        String sql = "SELECT * FROM field_classification_history WHERE field_id = :fieldId ORDER BY changed_at, id";
        return execute("find history of field " + fieldId, jdbc -> jdbc.query(
                sql, new MapSqlParameterSource("fieldId", fieldId), rowMapper));
    }

    public long countBySessionId(String sessionId) {
        Long count = execute("count history of session " + sessionId, jdbc -> jdbc.queryForObject(
                "SELECT COUNT(*) FROM field_classification_history WHERE session_id = :sessionId",
                new MapSqlParameterSource("sessionId", sessionId), Long.class));
        return count != null ? count : 0;
    }

    /**
     * Detaches history entries from a session about to be deleted.
     *
     * @return Number of detached entries
     */
    public int unlinkSession(String sessionId) {
        return execute("unlink history of session " + sessionId, jdbc -> jdbc.update(
                "UPDATE field_classification_history SET session_id = NULL WHERE session_id = :sessionId",
                new MapSqlParameterSource("sessionId", sessionId)));
    }

    private static String value(Object constant) {
        if (constant instanceof FieldClassification) {
            return ((FieldClassification) constant).getValue();
        }
        if (constant instanceof Sensitivity) {
            return ((Sensitivity) constant).getValue();
        }
        if (constant instanceof FieldStatus) {
            return ((FieldStatus) constant).getValue();
        }
        return null;
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        return value != null ? parser.apply(value) : null;
    }
}
