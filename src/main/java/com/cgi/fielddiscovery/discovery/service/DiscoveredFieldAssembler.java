package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.classifier.model.ClassificationResult;
import com.cgi.fielddiscovery.classifier.model.FieldAnalysis;
import com.cgi.fielddiscovery.classifier.model.PatternMatch;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.TableAnalysis;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import com.cgi.fielddiscovery.classifier.model.enums.RiskLevel;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps table analyses onto the persisted field representation.
 */
@Component
public class DiscoveredFieldAssembler {

    /**
     * Builds one pending field per analyzed column.
     *
     * @param dataSourceId Data source the table belongs to
     * @param analysis Table analysis
     * @param detectedAt Detection time stamped on every field
     * @return Fields, in column order
     */
    public List<DiscoveredField> assemble(String dataSourceId, TableAnalysis analysis, LocalDateTime detectedAt) {
        List<DiscoveredField> fields = new ArrayList<>();
        for (FieldAnalysis fieldAnalysis : analysis.getFields()) {
            fields.add(assemble(dataSourceId, analysis, fieldAnalysis.getColumn(), fieldAnalysis.getResult(),
                    detectedAt));
        }
        return fields;
    }

    DiscoveredField assemble(String dataSourceId, TableAnalysis table, CatalogColumn column,
                             ClassificationResult result, LocalDateTime detectedAt) {
        SemanticClassification semantic = result.getClassification();
        FieldClassification classification = classificationOf(semantic.getCategory());
        List<String> regulations = result.getRisk().getRegulations();
        String dataType = column.getDataType() != null ? column.getDataType() : "unknown";

        return DiscoveredField.builder()
                .dataSourceId(dataSourceId)
                .assetId(column.getId() != null ? column.getId() : table.getAssetId())
                .assetName(table.getSchema() + "." + table.getTableName())
                .schema(table.getSchema())
                .tableName(table.getTableName())
                .fieldName(column.getName())
                .dataType(dataType)
                .nullable(column.isNullable())
                .classification(classification)
                .sensitivity(sensitivityOf(classification, result.getRiskLevel()))
                .description(column.getDescription() != null && !column.getDescription().isBlank()
                        ? column.getDescription()
                        : dataType + " field in " + table.getTableName())
                .suggestedTags(suggestTags(column.getName(), classification, regulations))
                .suggestedRules(suggestRules(dataType, classification))
                .dataPatterns(dataPatterns(result.getPatterns(), dataType))
                .businessContext(semantic.isAiGenerated() && semantic.getReasoning() != null
                        ? semantic.getReasoning()
                        : "Data field in " + table.getTableName() + " table")
                .confidence(semantic.getConfidence())
                .status(FieldStatus.PENDING)
                .aiGenerated(semantic.isAiGenerated())
                .riskLevel(result.getRiskLevel().getValue())
                .regulations(new ArrayList<>(regulations))
                .recommendations(new ArrayList<>(result.getRisk().getRecommendations()))
                .retentionPolicy(result.getRisk().getRetentionPolicy())
                .encryptionRequired(result.getRisk().isEncryptionRequired())
                .detectedAt(detectedAt)
                .build();
    }

    static FieldClassification classificationOf(DataCategory category) {
        if (category == null) {
            return FieldClassification.GENERAL;
        }
        switch (category) {
            case PERSONAL_DATA:
                return FieldClassification.PII;
            case HEALTH_DATA:
                return FieldClassification.PHI;
            case FINANCIAL_DATA:
                return FieldClassification.FINANCIAL;
            default:
                return FieldClassification.GENERAL;
        }
    }

    static Sensitivity sensitivityOf(FieldClassification classification, RiskLevel riskLevel) {
        if (classification != FieldClassification.GENERAL) {
            return classification.defaultSensitivity();
        }
        if (riskLevel == null) {
            return Sensitivity.LOW;
        }
        switch (riskLevel) {
            case CRITICAL:
                return Sensitivity.CRITICAL;
            case HIGH:
                return Sensitivity.HIGH;
            case MEDIUM:
                return Sensitivity.MEDIUM;
            default:
                return Sensitivity.LOW;
        }
    }

    private static List<String> suggestTags(String fieldName, FieldClassification classification,
                                            List<String> regulations) {
        Set<String> tags = new LinkedHashSet<>();
        String lowerName = fieldName.toLowerCase(Locale.ROOT);

        if (classification != FieldClassification.GENERAL) {
            tags.add(classification.getValue().toLowerCase(Locale.ROOT));
        }
        if (lowerName.contains("payment")) {
            tags.add("payments");
        }
        if (lowerName.contains("customer")) {
            tags.add("customers");
        }
        if (lowerName.contains("order")) {
            tags.add("orders");
        }
        regulations.forEach(r -> tags.add(r.toLowerCase(Locale.ROOT)));

        return new ArrayList<>(tags);
    }

    private static List<String> suggestRules(String dataType, FieldClassification classification) {
        List<String> rules = new ArrayList<>();
        rules.add("Not null validation");

        if (dataType.toLowerCase(Locale.ROOT).contains("varchar")) {
            rules.add("String length validation");
        }
        if (classification == FieldClassification.PII || classification == FieldClassification.PHI) {
            rules.add("Data encryption required");
            rules.add("Access audit logging");
        }
        return rules;
    }

    private static List<String> dataPatterns(List<PatternMatch> matches, String dataType) {
        Set<String> patterns = new LinkedHashSet<>();
        matches.forEach(m -> patterns.add(m.getType()));

        String lowerType = dataType.toLowerCase(Locale.ROOT);
        if (lowerType.contains("date") || lowerType.contains("timestamp")) {
            patterns.add("Date format");
        }
        return new ArrayList<>(patterns);
    }
}
