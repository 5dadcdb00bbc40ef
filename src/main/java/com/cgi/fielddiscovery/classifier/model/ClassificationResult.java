package com.cgi.fielddiscovery.classifier.model;

import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import com.cgi.fielddiscovery.classifier.model.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Full analysis of a single field: pattern matches, profile, semantic classification and risk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationResult {
    private String fieldName;

    @Builder.Default
    private List<PatternMatch> patterns = new ArrayList<>();

    private DataProfile dataProfile;
    private SemanticClassification classification;
    private RiskAssessment risk;
    private long processingTimeMs;

    @JsonIgnore
    public DataCategory getCategory() {
        return classification != null ? classification.getCategory() : null;
    }

    @JsonIgnore
    public RiskLevel getRiskLevel() {
        return risk != null ? risk.getRiskLevel() : null;
    }
}
