package com.cgi.fielddiscovery.classifier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Semantic categories of the classification taxonomy, each with its subcategories.
 */
public enum DataCategory {
    PERSONAL_DATA("Personal Data", List.of("PII", "Quasi-Identifiers", "Behavioral", "Biometric")),
    HEALTH_DATA("Health Data", List.of("PHI", "Mental Health", "Genetic")),
    FINANCIAL_DATA("Financial Data", List.of("PCI", "Banking", "Investment")),
    BUSINESS_DATA("Business Data", List.of("Confidential", "Internal", "Public")),
    TECHNICAL_DATA("Technical Data", List.of("Credentials", "System", "Code"));

    private final String label;
    private final List<String> subcategories;

    DataCategory(String label, List<String> subcategories) {
        this.label = label;
        this.subcategories = subcategories;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public List<String> getSubcategories() {
        return subcategories;
    }

    /**
     * Resolves a category from its label, ignoring case and surrounding whitespace.
     *
     * @param label Category label, e.g. "Health Data"
     * @return Matching category, or empty if the label is unknown
     */
    public static Optional<DataCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim();
        return Arrays.stream(values())
                .filter(c -> c.label.equalsIgnoreCase(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
