package com.cgi.fielddiscovery.classifier.service;

import com.cgi.fielddiscovery.classifier.model.ComplianceFlag;
import com.cgi.fielddiscovery.classifier.model.DataProfile;
import com.cgi.fielddiscovery.classifier.model.PatternMatch;
import com.cgi.fielddiscovery.classifier.model.RiskAssessment;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.enums.ComplianceStatus;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import com.cgi.fielddiscovery.classifier.model.enums.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RiskComplianceEngine")
class RiskComplianceEngineTest {

    private final RiskComplianceEngine engine = new RiskComplianceEngine();

    private static SemanticClassification classification(DataCategory category, String subcategory) {
        return SemanticClassification.builder()
                .category(category).subcategory(subcategory).confidence(0.9).reasoning("r").build();
    }

    private static PatternMatch pattern(String type) {
        return PatternMatch.builder().type(type).pattern(".*").matches(1).confidence(1.0).build();
    }

    @Test
    @DisplayName("Health data without samples is critical with a HIPAA flag awaiting review")
    void healthField() {
        RiskAssessment risk = engine.assess(Collections.emptyList(),
                classification(DataCategory.HEALTH_DATA, "PHI"), DataProfile.empty());

        assertThat(risk.getRiskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(risk.getComplianceFlags())
                .anySatisfy(flag -> {
                    assertThat(flag.getFramework()).isEqualTo("HIPAA");
                    assertThat(flag.getStatus()).isEqualTo(ComplianceStatus.NEEDS_REVIEW);
                    assertThat(flag.getRequirement()).isEqualTo("Privacy Rule");
                    assertThat(flag.getActions()).hasSize(3).first().isEqualTo("Ensure privacy rule");
                });
        assertThat(risk.getRegulations()).containsExactly("HIPAA");
        assertThat(risk.getRetentionPolicy()).isEqualTo("Minimum 6 years as per HIPAA requirements");
        assertThat(risk.isEncryptionRequired()).isTrue();
        assertThat(risk.getAccessRestrictions()).contains("Limit to healthcare professionals");
    }

    @Test
    @DisplayName("Compliance actions are lower-cased independently of the default locale")
    void actionsIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            List<ComplianceFlag> flags = engine.complianceFlags(DataCategory.BUSINESS_DATA);

            assertThat(flags).singleElement().satisfies(flag -> {
                assertThat(flag.getFramework()).isEqualTo("SOX");
                assertThat(flag.getActions()).first().isEqualTo("Ensure internal controls");
            });
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Personal data maps to the privacy frameworks with EU and California restrictions")
    void personalFrameworks() {
        RiskAssessment risk = engine.assess(List.of(pattern("email")),
                classification(DataCategory.PERSONAL_DATA, "PII"), DataProfile.empty());

        assertThat(risk.getRegulations()).containsExactly("GDPR", "CCPA", "FERPA", "COPPA");
        assertThat(risk.getGeoRestrictions())
                .containsExactly("Data must remain within EU/EEA", "California resident data handling requirements");
        assertThat(risk.getRetentionPolicy()).isEqualTo("Retain only as long as necessary for specified purpose");
        assertThat(risk.getRecommendations()).hasSize(RiskComplianceEngine.MAX_RECOMMENDATIONS);
    }

    @Nested
    @DisplayName("Risk tiers")
    class RiskTiers {

        @Test
        void criticalPatternOverridesBusinessCategory() {
            assertThat(engine.riskLevel(List.of(pattern("creditCard")),
                    classification(DataCategory.BUSINESS_DATA, "Internal"), DataProfile.empty()))
                    .isEqualTo(RiskLevel.CRITICAL);
        }

        @Test
        void highPatternOnTechnicalField() {
            assertThat(engine.riskLevel(List.of(pattern("email")),
                    classification(DataCategory.TECHNICAL_DATA, "Code"), DataProfile.empty()))
                    .isEqualTo(RiskLevel.HIGH);
        }

        @Test
        void financialCategoryIsHigh() {
            assertThat(engine.riskLevel(Collections.emptyList(),
                    classification(DataCategory.FINANCIAL_DATA, "Banking"), DataProfile.empty()))
                    .isEqualTo(RiskLevel.HIGH);
        }

        @Test
        void highlyUniqueValuesAreMedium() {
            DataProfile unique = DataProfile.builder().uniqueness(0.99).build();

            assertThat(engine.riskLevel(Collections.emptyList(),
                    classification(DataCategory.BUSINESS_DATA, "Public"), unique))
                    .isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        void internalBusinessDataIsMedium() {
            assertThat(engine.riskLevel(Collections.emptyList(),
                    classification(DataCategory.BUSINESS_DATA, "Internal"), DataProfile.empty()))
                    .isEqualTo(RiskLevel.MEDIUM);
        }

        @Test
        void publicBusinessDataIsLow() {
            RiskAssessment risk = engine.assess(Collections.emptyList(),
                    classification(DataCategory.BUSINESS_DATA, "Public"), DataProfile.empty());

            assertThat(risk.getRiskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(risk.isEncryptionRequired()).isFalse();
            assertThat(risk.getRegulations()).containsExactly("SOX");
        }
    }
}
