/*
 * RuleBasedClassificationStrategy.java - Deterministic keyword classification of field names
 */
package com.cgi.fielddiscovery.classifier.strategy;

import com.cgi.fielddiscovery.classifier.model.FieldDescriptor;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Classifies a field from keywords in its name. Total: every input, including a missing name,
 * yields a classification.
 */
@Component
public class RuleBasedClassificationStrategy extends AbstractClassificationStrategy {

    public static final String MODEL_NAME = "Rule-based";

    private static final List<KeywordGroup> GROUPS = List.of(
            new KeywordGroup(DataCategory.PERSONAL_DATA, "PII", 0.85,
                    List.of("name", "email", "phone", "address", "ssn", "passport", "license")),
            new KeywordGroup(DataCategory.HEALTH_DATA, "PHI", 0.9,
                    List.of("medical", "health", "diagnosis", "prescription", "treatment", "patient")),
            new KeywordGroup(DataCategory.FINANCIAL_DATA, "Banking", 0.85,
                    List.of("payment", "card", "account", "balance", "transaction", "amount")),
            new KeywordGroup(DataCategory.TECHNICAL_DATA, "Credentials", 0.95,
                    List.of("password", "token", "key", "secret", "api", "credential"))
    );

    private static final double DEFAULT_CONFIDENCE = 0.6;

    @Override
    public String getName() {
        return "RuleBasedClassificationStrategy";
    }

    @Override
    public SemanticClassification classify(FieldDescriptor field) {
        String name = field != null && field.getName() != null ? field.getName().toLowerCase(Locale.ROOT) : "";

        for (KeywordGroup group : GROUPS) {
            for (String keyword : group.keywords) {
                if (name.contains(keyword)) {
                    log.debug("Field {} matched keyword '{}' -> {}/{}", name, keyword,
                            group.category.getLabel(), group.subcategory);
                    return createClassification(group.category, group.subcategory, group.confidence,
                            "Field name contains '" + keyword + "'", MODEL_NAME, false);
                }
            }
        }

        return createClassification(DataCategory.BUSINESS_DATA, "Internal", DEFAULT_CONFIDENCE,
                "No sensitive keyword in field name", MODEL_NAME, false);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private static final class KeywordGroup {
        private final DataCategory category;
        private final String subcategory;
        private final double confidence;
        private final List<String> keywords;

        private KeywordGroup(DataCategory category, String subcategory, double confidence, List<String> keywords) {
            this.category = category;
            this.subcategory = subcategory;
            this.confidence = confidence;
            this.keywords = keywords;
        }
    }
}
