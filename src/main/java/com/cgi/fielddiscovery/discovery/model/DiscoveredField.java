package com.cgi.fielddiscovery.discovery.model;

import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted classification of one column, unique per (data source, schema, table, field).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveredField {
    private String id;
    private String dataSourceId;
    private String assetId;
    private String assetName;
    private String schema;
    private String tableName;
    private String fieldName;
    private String dataType;

    @Builder.Default
    private boolean nullable = true;

    private FieldClassification classification;
    private Sensitivity sensitivity;
    private String description;

    @Builder.Default
    private List<String> suggestedTags = new ArrayList<>();

    @Builder.Default
    private List<String> suggestedRules = new ArrayList<>();

    @Builder.Default
    private List<String> dataPatterns = new ArrayList<>();

    private String businessContext;
    private double confidence;

    @Builder.Default
    private FieldStatus status = FieldStatus.PENDING;

    @JsonProperty("isAiGenerated")
    private boolean aiGenerated;

    private String riskLevel;

    @Builder.Default
    private List<String> regulations = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private String retentionPolicy;
    private boolean encryptionRequired;

    private LocalDateTime detectedAt;
    private LocalDateTime reviewedAt;
    private String reviewedBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
