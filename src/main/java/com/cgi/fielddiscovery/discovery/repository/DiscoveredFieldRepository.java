package com.cgi.fielddiscovery.discovery.repository;

import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.DiscoveryStats;
import com.cgi.fielddiscovery.discovery.model.FieldFilter;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to discovered fields.
 */
@Repository
public class DiscoveredFieldRepository extends AbstractJdbcRepository {

    private static final String SELECT_ALL = "SELECT * FROM discovered_fields";

    private final RowMapper<DiscoveredField> rowMapper = (rs, rowNum) -> DiscoveredField.builder()
            .id(rs.getString("id"))
            .dataSourceId(rs.getString("datasource_id"))
            .assetId(rs.getString("asset_id"))
            .assetName(rs.getString("asset_name"))
            .schema(rs.getString("schema_name"))
            .tableName(rs.getString("table_name"))
            .fieldName(rs.getString("field_name"))
            .dataType(rs.getString("data_type"))
            .nullable(rs.getBoolean("nullable"))
            .classification(FieldClassification.fromValue(rs.getString("classification")))
            .sensitivity(Sensitivity.fromValue(rs.getString("sensitivity")))
            .description(rs.getString("description"))
            .suggestedTags(fromJson(rs.getString("suggested_tags")))
            .suggestedRules(fromJson(rs.getString("suggested_rules")))
            .dataPatterns(fromJson(rs.getString("data_patterns")))
            .businessContext(rs.getString("business_context"))
            .confidence(rs.getDouble("confidence"))
            .status(FieldStatus.fromValue(rs.getString("status")))
            .aiGenerated(rs.getBoolean("is_ai_generated"))
            .riskLevel(rs.getString("risk_level"))
            .regulations(fromJson(rs.getString("regulations")))
            .recommendations(fromJson(rs.getString("recommendations")))
            .retentionPolicy(rs.getString("retention_policy"))
            .encryptionRequired(rs.getBoolean("encryption_required"))
            .detectedAt(toLocalDateTime(rs.getTimestamp("detected_at")))
            .reviewedAt(toLocalDateTime(rs.getTimestamp("reviewed_at")))
            .reviewedBy(rs.getString("reviewed_by"))
            .createdAt(toLocalDateTime(rs.getTimestamp("created_at")))
            .updatedAt(toLocalDateTime(rs.getTimestamp("updated_at")))
            .build();

    public DiscoveredFieldRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    public Optional<DiscoveredField> findById(String id) {
        List<DiscoveredField> result = execute("find field " + id, jdbc -> jdbc.query(
                SELECT_ALL + " WHERE id = :id", new MapSqlParameterSource("id", id), rowMapper));
        return result.stream().findFirst();
    }

    /**
     * Finds a field by its natural key.
     */
    public Optional<DiscoveredField> findByKey(String dataSourceId, String schema, String tableName, String fieldName) {
        String sql = SELECT_ALL + " WHERE datasource_id = :dataSourceId AND schema_name = :schema "
                + "AND table_name = :tableName AND field_name = :fieldName";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("dataSourceId", dataSourceId)
                .addValue("schema", schema)
                .addValue("tableName", tableName)
                .addValue("fieldName", fieldName);
        List<DiscoveredField> result = execute("find field by key", jdbc -> jdbc.query(sql, params, rowMapper));
        return result.stream().findFirst();
    }

    public void insert(DiscoveredField field) {
        String sql = "INSERT INTO discovered_fields (id, datasource_id, asset_id, asset_name, schema_name, table_name, "
                + "field_name, data_type, nullable, classification, sensitivity, description, suggested_tags, "
                + "suggested_rules, data_patterns, business_context, confidence, status, is_ai_generated, risk_level, "
                + "regulations, recommendations, retention_policy, encryption_required, detected_at, reviewed_at, "
                + "reviewed_by, created_at, updated_at) VALUES (:id, :dataSourceId, :assetId, :assetName, :schema, "
                + ":tableName, :fieldName, :dataType, :nullable, :classification, :sensitivity, :description, "
                + ":suggestedTags, :suggestedRules, :dataPatterns, :businessContext, :confidence, :status, "
                + ":aiGenerated, :riskLevel, :regulations, :recommendations, :retentionPolicy, :encryptionRequired, "
                + ":detectedAt, :reviewedAt, :reviewedBy, :createdAt, :updatedAt)";
        execute("insert field " + field.getFieldName(), jdbc -> jdbc.update(sql, toParams(field)));
    }

    /**
     * Rewrites the discovery attributes and status of an existing field.
     * Review stamps and creation time are left untouched.
     */
    public void updateDiscovery(DiscoveredField field) {
        String sql = "UPDATE discovered_fields SET asset_id = :assetId, asset_name = :assetName, "
                + "data_type = :dataType, nullable = :nullable, classification = :classification, "
                + "sensitivity = :sensitivity, description = :description, suggested_tags = :suggestedTags, "
                + "suggested_rules = :suggestedRules, data_patterns = :dataPatterns, "
                + "business_context = :businessContext, confidence = :confidence, status = :status, "
                + "is_ai_generated = :aiGenerated, risk_level = :riskLevel, regulations = :regulations, "
                + "recommendations = :recommendations, retention_policy = :retentionPolicy, "
                + "encryption_required = :encryptionRequired, detected_at = :detectedAt, updated_at = :updatedAt "
                + "WHERE id = :id";
        execute("update field " + field.getId(), jdbc -> jdbc.update(sql, toParams(field)));
    }

    /**
     * Sets the review status of a field.
     *
     * @param reviewedAt Review time, or null to keep the current review stamp
     * @param reviewedBy Reviewer, or null to keep the current review stamp
     * @return true if the field exists
     */
    public boolean updateStatus(String id, FieldStatus status, LocalDateTime reviewedAt, String reviewedBy,
                                LocalDateTime now) {
        String sql = "UPDATE discovered_fields SET status = :status, "
                + "reviewed_at = COALESCE(:reviewedAt, reviewed_at), reviewed_by = COALESCE(:reviewedBy, reviewed_by), "
                + "updated_at = :now WHERE id = :id";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("status", status.getValue())
                .addValue("reviewedAt", toTimestamp(reviewedAt), Types.TIMESTAMP)
                .addValue("reviewedBy", reviewedBy, Types.VARCHAR)
                .addValue("now", toTimestamp(now));
        return execute("update field status " + id, jdbc -> jdbc.update(sql, params)) == 1;
    }

    /**
     * Overrides the classification of a field as a manual review decision.
     *
     * @return true if the field exists
     */
    public boolean updateClassification(String id, FieldClassification classification, Sensitivity sensitivity,
                                        String reviewedBy, LocalDateTime now) {
        String sql = "UPDATE discovered_fields SET classification = :classification, sensitivity = :sensitivity, "
                + "confidence = 1.0, is_ai_generated = FALSE, reviewed_at = :now, reviewed_by = :reviewedBy, "
                + "updated_at = :now WHERE id = :id";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("classification", classification.getValue())
                .addValue("sensitivity", sensitivity.getValue())
                .addValue("reviewedBy", reviewedBy)
                .addValue("now", toTimestamp(now));
        return execute("classify field " + id, jdbc -> jdbc.update(sql, params)) == 1;
    }

    /**
     * Finds fields matching a filter, newest detection first.
     */
    public List<DiscoveredField> findByFilter(FieldFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = SELECT_ALL + where(filter, params)
                + " ORDER BY detected_at DESC, table_name, field_name LIMIT :limit OFFSET :offset";
        params.addValue("limit", filter.getLimit());
        params.addValue("offset", filter.getOffset());
        return execute("find fields", jdbc -> jdbc.query(sql, params, rowMapper));
    }

    public long countByFilter(FieldFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT COUNT(*) FROM discovered_fields" + where(filter, params);
        Long count = execute("count fields", jdbc -> jdbc.queryForObject(sql, params, Long.class));
        return count != null ? count : 0;
    }

    /**
     * Aggregates counts by status, classification and sensitivity.
     *
     * @param dataSourceId Optional data source filter
     * @param recentSince Lower bound of the recent-discoveries window
     * @return Statistics, with every known key present
     */
    public DiscoveryStats aggregateStats(String dataSourceId, LocalDateTime recentSince) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) AS total");
        for (FieldStatus status : FieldStatus.values()) {
            sql.append(countCase("status", status.getValue(), "st_" + status.name()));
        }
        for (FieldClassification classification : FieldClassification.values()) {
            sql.append(countCase("classification", classification.getValue(), "cl_" + classification.name()));
        }
        for (Sensitivity sensitivity : Sensitivity.values()) {
            sql.append(countCase("sensitivity", sensitivity.getValue(), "se_" + sensitivity.name()));
        }
        sql.append(", AVG(confidence) AS avg_confidence")
                .append(", COUNT(CASE WHEN detected_at >= :recentSince THEN 1 END) AS recent")
                .append(" FROM discovered_fields");

        MapSqlParameterSource params = new MapSqlParameterSource("recentSince", toTimestamp(recentSince));
        if (dataSourceId != null) {
            sql.append(" WHERE datasource_id = :dataSourceId");
            params.addValue("dataSourceId", dataSourceId);
        }

        return execute("aggregate field stats", jdbc -> jdbc.queryForObject(sql.toString(), params, (rs, rowNum) -> {
            Map<String, Long> byStatus = new LinkedHashMap<>();
            for (FieldStatus status : FieldStatus.values()) {
                byStatus.put(status.getValue(), rs.getLong("st_" + status.name()));
            }
            Map<String, Long> byClassification = new LinkedHashMap<>();
            for (FieldClassification classification : FieldClassification.values()) {
                byClassification.put(classification.getValue(), rs.getLong("cl_" + classification.name()));
            }
            Map<String, Long> bySensitivity = new LinkedHashMap<>();
            for (Sensitivity sensitivity : Sensitivity.values()) {
                bySensitivity.put(sensitivity.getValue(), rs.getLong("se_" + sensitivity.name()));
            }
            return DiscoveryStats.builder()
                    .totalFields(rs.getLong("total"))
                    .byStatus(byStatus)
                    .byClassification(byClassification)
                    .bySensitivity(bySensitivity)
                    .averageConfidence(rs.getDouble("avg_confidence"))
                    .recentDiscoveries(rs.getLong("recent"))
                    .build();
        }));
    }

    private static String countCase(String column, String value, String alias) {
        // Values come from enum constants, never from callers
        return ", COUNT(CASE WHEN " + column + " = '" + value + "' THEN 1 END) AS " + alias;
    }

    private String where(FieldFilter filter, MapSqlParameterSource params) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        if (filter.getDataSourceId() != null) {
            where.append(" AND datasource_id = :dataSourceId");
            params.addValue("dataSourceId", filter.getDataSourceId());
        }
        if (filter.getSchema() != null) {
            where.append(" AND schema_name = :schema");
            params.addValue("schema", filter.getSchema());
        }
        if (filter.getTable() != null) {
            where.append(" AND table_name = :table");
            params.addValue("table", filter.getTable());
        }
        if (filter.getStatus() != null) {
            where.append(" AND status = :status");
            params.addValue("status", filter.getStatus().getValue());
        }
        if (filter.getClassification() != null) {
            where.append(" AND classification = :classification");
            params.addValue("classification", filter.getClassification().getValue());
        }
        if (filter.getSensitivity() != null) {
            where.append(" AND sensitivity = :sensitivity");
            params.addValue("sensitivity", filter.getSensitivity().getValue());
        }
        if (filter.getSearch() != null && !filter.getSearch().isBlank()) {
            where.append(" AND (LOWER(field_name) LIKE :search ESCAPE '\\'"
                    + " OR LOWER(table_name) LIKE :search ESCAPE '\\'"
                    + " OR LOWER(description) LIKE :search ESCAPE '\\')");
            params.addValue("search", "%" + escapeLike(filter.getSearch().trim().toLowerCase(Locale.ROOT)) + "%");
        }
        return where.toString();
    }

    /**
     * Makes LIKE wildcards in user input match literally.
     */
    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private MapSqlParameterSource toParams(DiscoveredField field) {
        return new MapSqlParameterSource()
                .addValue("id", field.getId())
                .addValue("dataSourceId", field.getDataSourceId())
                .addValue("assetId", field.getAssetId())
                .addValue("assetName", field.getAssetName())
                .addValue("schema", field.getSchema())
                .addValue("tableName", field.getTableName())
                .addValue("fieldName", field.getFieldName())
                .addValue("dataType", field.getDataType())
                .addValue("nullable", field.isNullable())
                .addValue("classification", field.getClassification().getValue())
                .addValue("sensitivity", field.getSensitivity().getValue())
                .addValue("description", field.getDescription())
                .addValue("suggestedTags", toJson(field.getSuggestedTags()))
                .addValue("suggestedRules", toJson(field.getSuggestedRules()))
                .addValue("dataPatterns", toJson(field.getDataPatterns()))
                .addValue("businessContext", field.getBusinessContext())
                .addValue("confidence", field.getConfidence())
                .addValue("status", field.getStatus().getValue())
                .addValue("aiGenerated", field.isAiGenerated())
                .addValue("riskLevel", field.getRiskLevel())
                .addValue("regulations", toJson(field.getRegulations()))
                .addValue("recommendations", toJson(field.getRecommendations()))
                .addValue("retentionPolicy", field.getRetentionPolicy())
                .addValue("encryptionRequired", field.isEncryptionRequired())
                .addValue("detectedAt", toTimestamp(field.getDetectedAt()))
                .addValue("reviewedAt", toTimestamp(field.getReviewedAt()))
                .addValue("reviewedBy", field.getReviewedBy())
                .addValue("createdAt", toTimestamp(field.getCreatedAt()))
                .addValue("updatedAt", toTimestamp(field.getUpdatedAt()));
    }
}
