package com.cgi.fielddiscovery.classifier.model;

import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Category, subcategory and confidence assigned to a field, with the reasoning behind it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticClassification {
    private DataCategory category;
    private String subcategory;
    private double confidence;
    private String reasoning;
    private boolean aiGenerated;

    /**
     * Model that produced the classification, null for rule-based results.
     */
    private String model;
}
