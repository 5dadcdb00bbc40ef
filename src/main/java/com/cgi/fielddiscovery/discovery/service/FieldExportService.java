package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.common.exception.ExportException;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.FieldFilter;
import com.cgi.fielddiscovery.discovery.model.enums.ExportFormat;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import com.cgi.fielddiscovery.discovery.repository.DiscoveredFieldRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opencsv.CSVWriter;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders discovered fields as JSON, CSV, SQL column comments or a Markdown data dictionary.
 */
@Service
public class FieldExportService {
    private static final Logger log = LoggerFactory.getLogger(FieldExportService.class);

    static final int MAX_EXPORT_FIELDS = 10_000;

    static final String[] CSV_HEADER = {"Schema", "Table", "Field", "Data Type", "Classification", "Sensitivity",
            "Confidence", "Status", "Description", "Suggested Tags", "Suggested Rules", "Patterns"};

    private final DiscoveredFieldRepository fieldRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public FieldExportService(DiscoveredFieldRepository fieldRepository, ObjectMapper objectMapper) {
        this(fieldRepository, objectMapper, Clock.systemUTC());
    }

    FieldExportService(DiscoveredFieldRepository fieldRepository, ObjectMapper objectMapper, Clock clock) {
        this.fieldRepository = fieldRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Exports the fields matching a filter. The page window of the filter is replaced by the export limit.
     *
     * @param filter Field criteria
     * @param format Output format
     * @return Rendered document
     */
    public ExportResult exportFields(FieldFilter filter, ExportFormat format) {
        FieldFilter window = filter.toBuilder().limit(MAX_EXPORT_FIELDS).offset(0).build();
        List<DiscoveredField> fields = fieldRepository.findByFilter(window);
        Instant now = clock.instant();
        long stamp = now.toEpochMilli();

        log.info("Exporting {} fields as {}", fields.size(), format.getValue());
        switch (format) {
            case JSON:
                return new ExportResult(toJson(fields, now), "application/json",
                        "discovered_fields_" + stamp + ".json");
            case CSV:
                return new ExportResult(toCsv(fields), "text/csv", "discovered_fields_" + stamp + ".csv");
            case SQL:
                return new ExportResult(toSql(fields, now), "text/plain",
                        "field_classifications_" + stamp + ".sql");
            case MARKDOWN:
                return new ExportResult(toMarkdown(fields, now), "text/markdown",
                        "data_dictionary_" + stamp + ".md");
            default:
                throw new ExportException("Unsupported export format: " + format);
        }
    }

    String toJson(List<DiscoveredField> fields, Instant now) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("exportDate", now.toString());
        root.put("totalFields", fields.size());
        ArrayNode items = root.putArray("fields");

        for (DiscoveredField field : fields) {
            ObjectNode item = items.addObject();
            item.put("id", field.getId());
            item.put("dataSource", field.getAssetName());
            item.put("schema", field.getSchema());
            item.put("table", field.getTableName());
            item.put("field", field.getFieldName());
            item.put("dataType", field.getDataType());
            item.put("classification", valueOf(field.getClassification()));
            item.put("sensitivity", valueOf(field.getSensitivity()));
            item.put("confidence", field.getConfidence());
            item.put("status", valueOf(field.getStatus()));
            item.put("description", field.getDescription());
            item.set("suggestedTags", objectMapper.valueToTree(field.getSuggestedTags()));
            item.set("suggestedRules", objectMapper.valueToTree(field.getSuggestedRules()));
            item.set("patterns", objectMapper.valueToTree(field.getDataPatterns()));
            item.put("reviewedBy", field.getReviewedBy());
            item.put("reviewedAt", field.getReviewedAt() != null ? field.getReviewedAt().toString() : null);
        }

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ExportException("Could not render JSON export", e);
        }
    }

    String toCsv(List<DiscoveredField> fields) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_HEADER);
            for (DiscoveredField field : fields) {
                writer.writeNext(new String[]{
                        nullToEmpty(field.getSchema()),
                        nullToEmpty(field.getTableName()),
                        nullToEmpty(field.getFieldName()),
                        nullToEmpty(field.getDataType()),
                        valueOf(field.getClassification()),
                        valueOf(field.getSensitivity()),
                        String.valueOf(field.getConfidence()),
                        valueOf(field.getStatus()),
                        nullToEmpty(field.getDescription()),
                        String.join(";", field.getSuggestedTags()),
                        String.join(";", field.getSuggestedRules()),
                        String.join(";", field.getDataPatterns())
                });
            }
        } catch (IOException e) {
            throw new ExportException("Could not render CSV export", e);
        }
        return out.toString();
    }

    String toSql(List<DiscoveredField> fields, Instant now) {
        StringBuilder sql = new StringBuilder()
                .append("-- Field Discovery Export\n")
                .append("-- Generated: ").append(now).append('\n')
                .append("-- Total Fields: ").append(fields.size()).append("\n\n");

        for (Map.Entry<String, List<DiscoveredField>> table : groupByTable(fields).entrySet()) {
            String tableName = table.getKey();
            sql.append("\n-- Table: ").append(tableName).append('\n')
                    .append("-- Fields: ").append(table.getValue().size()).append('\n');

            for (DiscoveredField field : table.getValue()) {
                sql.append("COMMENT ON COLUMN ").append(tableName).append('.').append(field.getFieldName())
                        .append(" IS '")
                        .append("Classification: ").append(valueOf(field.getClassification())).append(", ")
                        .append("Sensitivity: ").append(valueOf(field.getSensitivity())).append(", ")
                        .append("Status: ").append(valueOf(field.getStatus()));
                if (field.getDescription() != null && !field.getDescription().isEmpty()) {
                    sql.append(". ").append(field.getDescription().replace("'", "''"));
                }
                sql.append("';\n");

                if (!field.getSuggestedTags().isEmpty()) {
                    sql.append("-- Tags: ").append(String.join(", ", field.getSuggestedTags())).append('\n');
                }
                if (!field.getSuggestedRules().isEmpty()) {
                    sql.append("-- Suggested validations:\n");
                    for (String rule : field.getSuggestedRules()) {
                        sql.append("-- ALTER TABLE ").append(tableName)
                                .append(" ADD CONSTRAINT chk_").append(field.getFieldName()).append('_')
                                .append(rule.toLowerCase(Locale.ROOT).replaceAll("\\s+", "_"))
                                .append(" CHECK (...);\n");
                    }
                }
                sql.append('\n');
            }
        }
        return sql.toString();
    }

    String toMarkdown(List<DiscoveredField> fields, Instant now) {
        StringBuilder md = new StringBuilder()
                .append("# Data Dictionary\n\n")
                .append("Generated: ").append(now).append("\n\n")
                .append("Total Fields Discovered: ").append(fields.size()).append("\n\n");

        md.append("## Summary Statistics\n\n")
                .append("| Classification | Count |\n")
                .append("|---------------|-------|\n");
        for (FieldClassification classification : FieldClassification.values()) {
            md.append("| ").append(classification.getValue()).append(" | ")
                    .append(fields.stream().filter(f -> f.getClassification() == classification).count())
                    .append(" |\n");
        }
        md.append('\n')
                .append("| Status | Count |\n")
                .append("|--------|-------|\n")
                .append("| Accepted | ").append(countStatus(fields, FieldStatus.ACCEPTED)).append(" |\n")
                .append("| Rejected | ").append(countStatus(fields, FieldStatus.REJECTED)).append(" |\n")
                .append("| Needs Review | ").append(countStatus(fields, FieldStatus.NEEDS_REVIEW)).append(" |\n")
                .append("| Pending Review | ").append(countStatus(fields, FieldStatus.PENDING)).append(" |\n")
                .append('\n');

        Map<String, Map<String, List<DiscoveredField>>> schemas = new LinkedHashMap<>();
        for (DiscoveredField field : fields) {
            schemas.computeIfAbsent(field.getSchema(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(field.getTableName(), k -> new ArrayList<>())
                    .add(field);
        }

        md.append("## Field Documentation\n\n");
        for (Map.Entry<String, Map<String, List<DiscoveredField>>> schema : schemas.entrySet()) {
            md.append("### Schema: ").append(schema.getKey()).append("\n\n");
            for (Map.Entry<String, List<DiscoveredField>> table : schema.getValue().entrySet()) {
                md.append("#### Table: ").append(table.getKey()).append("\n\n");

                long sensitive = table.getValue().stream().filter(FieldExportService::isSensitive).count();
                if (sensitive > 0) {
                    md.append("> **Contains ").append(sensitive).append(" sensitive fields**\n\n");
                }

                md.append("| Field | Type | Classification | Sensitivity | Status | Description |\n")
                        .append("|-------|------|---------------|-------------|--------|-------------|\n");
                for (DiscoveredField field : table.getValue()) {
                    md.append("| **").append(field.getFieldName()).append("** | ")
                            .append(field.getDataType()).append(" | ")
                            .append(valueOf(field.getClassification())).append(" | ")
                            .append(valueOf(field.getSensitivity())).append(" | ")
                            .append(valueOf(field.getStatus())).append(" | ")
                            .append(field.getDescription() != null && !field.getDescription().isEmpty()
                                    ? field.getDescription().replace("|", "\\|") : "-")
                            .append(" |\n");
                }
                md.append('\n');
            }
        }
        return md.toString();
    }

    static boolean isSensitive(DiscoveredField field) {
        return field.getClassification() != FieldClassification.GENERAL
                || field.getSensitivity() == Sensitivity.HIGH
                || field.getSensitivity() == Sensitivity.CRITICAL;
    }

    private static Map<String, List<DiscoveredField>> groupByTable(List<DiscoveredField> fields) {
        Map<String, List<DiscoveredField>> tables = new LinkedHashMap<>();
        for (DiscoveredField field : fields) {
            tables.computeIfAbsent(field.getSchema() + "." + field.getTableName(), k -> new ArrayList<>())
                    .add(field);
        }
        return tables;
    }

    private static long countStatus(List<DiscoveredField> fields, FieldStatus status) {
        return fields.stream().filter(f -> f.getStatus() == status).count();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String valueOf(FieldClassification classification) {
        return classification != null ? classification.getValue() : "";
    }

    private static String valueOf(Sensitivity sensitivity) {
        return sensitivity != null ? sensitivity.getValue() : "";
    }

    private static String valueOf(FieldStatus status) {
        return status != null ? status.getValue() : "";
    }

    /**
     * Rendered export document.
     */
    @Getter
    @AllArgsConstructor
    public static class ExportResult {
        private final String content;
        private final String contentType;
        private final String filename;
    }
}
