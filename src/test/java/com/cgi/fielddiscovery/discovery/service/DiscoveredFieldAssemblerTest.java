package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.classifier.model.ClassificationResult;
import com.cgi.fielddiscovery.classifier.model.FieldAnalysis;
import com.cgi.fielddiscovery.classifier.model.PatternMatch;
import com.cgi.fielddiscovery.classifier.model.RiskAssessment;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.TableAnalysis;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import com.cgi.fielddiscovery.classifier.model.enums.RiskLevel;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DiscoveredFieldAssembler")
class DiscoveredFieldAssemblerTest {

    private final DiscoveredFieldAssembler assembler = new DiscoveredFieldAssembler();
    private final LocalDateTime detectedAt = LocalDateTime.of(2024, 6, 1, 12, 0);

    private static ClassificationResult result(DataCategory category, String subcategory, boolean ai,
                                               RiskLevel risk, List<String> regulations, String... patterns) {
        List<PatternMatch> matches = new ArrayList<>();
        for (String type : patterns) {
            matches.add(PatternMatch.builder().type(type).confidence(0.9).build());
        }
        return ClassificationResult.builder()
                .patterns(matches)
                .classification(SemanticClassification.builder()
                        .category(category)
                        .subcategory(subcategory)
                        .confidence(ai ? 0.93 : 0.85)
                        .reasoning("Contact address of the customer")
                        .aiGenerated(ai)
                        .build())
                .risk(RiskAssessment.builder()
                        .riskLevel(risk)
                        .regulations(regulations)
                        .recommendations(List.of("Enable encryption at rest and in transit"))
                        .retentionPolicy("Retain only as long as necessary for specified purpose")
                        .encryptionRequired(risk.isAtLeastHigh())
                        .build())
                .build();
    }

    private static TableAnalysis table(CatalogColumn column, ClassificationResult result) {
        return TableAnalysis.builder()
                .schema("crm")
                .tableName("customers")
                .assetId("asset-9")
                .fields(List.of(FieldAnalysis.builder().column(column).result(result).build()))
                .build();
    }

    @Test
    @DisplayName("An email column becomes a pending PII field with high sensitivity")
    void emailColumn() {
        CatalogColumn column = CatalogColumn.builder().name("customer_email").dataType("varchar(255)").build();
        ClassificationResult result = result(DataCategory.PERSONAL_DATA, "PII", true, RiskLevel.CRITICAL,
                List.of("GDPR", "CCPA", "FERPA", "COPPA"), "email");

        List<DiscoveredField> fields = assembler.assemble("ds-1", table(column, result), detectedAt);

        assertThat(fields).hasSize(1);
        DiscoveredField field = fields.get(0);
        assertThat(field.getClassification()).isEqualTo(FieldClassification.PII);
        assertThat(field.getSensitivity()).isEqualTo(Sensitivity.HIGH);
        assertThat(field.getRiskLevel()).isEqualTo("critical");
        assertThat(field.getStatus()).isEqualTo(FieldStatus.PENDING);
        assertThat(field.isAiGenerated()).isTrue();
        assertThat(field.getConfidence()).isEqualTo(0.93);
        assertThat(field.getAssetId()).isEqualTo("asset-9");
        assertThat(field.getAssetName()).isEqualTo("crm.customers");
        assertThat(field.getDescription()).isEqualTo("varchar(255) field in customers");
        assertThat(field.getBusinessContext()).isEqualTo("Contact address of the customer");
        assertThat(field.getSuggestedTags()).containsExactly("pii", "customers", "gdpr", "ccpa", "ferpa", "coppa");
        assertThat(field.getSuggestedRules()).containsExactly("Not null validation", "String length validation",
                "Data encryption required", "Access audit logging");
        assertThat(field.getDataPatterns()).containsExactly("email");
        assertThat(field.isEncryptionRequired()).isTrue();
        assertThat(field.getDetectedAt()).isEqualTo(detectedAt);
        assertThat(field.getId()).isNull();
    }

    @Test
    @DisplayName("A rule-based general field gets a generic context and keeps the column description")
    void ruleBasedGeneralField() {
        CatalogColumn column = CatalogColumn.builder().id("col-3").name("created_at").dataType("timestamp")
                .description("Row creation time").build();
        ClassificationResult result = result(DataCategory.BUSINESS_DATA, "Internal", false, RiskLevel.MEDIUM,
                List.of("SOX"));

        DiscoveredField field = assembler.assemble("ds-1", table(column, result), detectedAt).get(0);

        assertThat(field.getClassification()).isEqualTo(FieldClassification.GENERAL);
        assertThat(field.getSensitivity()).isEqualTo(Sensitivity.MEDIUM);
        assertThat(field.getAssetId()).isEqualTo("col-3");
        assertThat(field.getDescription()).isEqualTo("Row creation time");
        assertThat(field.getBusinessContext()).isEqualTo("Data field in customers table");
        assertThat(field.getSuggestedTags()).containsExactly("sox");
        assertThat(field.getSuggestedRules()).containsExactly("Not null validation");
        assertThat(field.getDataPatterns()).containsExactly("Date format");
        assertThat(field.isAiGenerated()).isFalse();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "PERSONAL_DATA, PII",
            "HEALTH_DATA, PHI",
            "FINANCIAL_DATA, FINANCIAL",
            "BUSINESS_DATA, GENERAL",
            "TECHNICAL_DATA, GENERAL"
    })
    @DisplayName("Maps categories onto classifications")
    void classificationOf(DataCategory category, FieldClassification expected) {
        assertThat(DiscoveredFieldAssembler.classificationOf(category)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Sensitivity follows the classification, or the risk tier for general fields")
    void sensitivityOf() {
        assertThat(DiscoveredFieldAssembler.sensitivityOf(FieldClassification.PHI, RiskLevel.LOW))
                .isEqualTo(Sensitivity.CRITICAL);
        assertThat(DiscoveredFieldAssembler.sensitivityOf(FieldClassification.FINANCIAL, RiskLevel.CRITICAL))
                .isEqualTo(Sensitivity.HIGH);
        assertThat(DiscoveredFieldAssembler.sensitivityOf(FieldClassification.GENERAL, RiskLevel.CRITICAL))
                .isEqualTo(Sensitivity.CRITICAL);
        assertThat(DiscoveredFieldAssembler.sensitivityOf(FieldClassification.GENERAL, null))
                .isEqualTo(Sensitivity.LOW);
    }
}
