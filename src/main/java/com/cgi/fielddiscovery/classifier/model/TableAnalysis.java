package com.cgi.fielddiscovery.classifier.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Analysis of every field of one table. This is the unit stored in the result cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableAnalysis {
    private String schema;
    private String tableName;
    private String assetId;

    @Builder.Default
    private List<FieldAnalysis> fields = new ArrayList<>();

    /**
     * True when some or all fields were classified by the rule-based fallback instead of the AI provider.
     */
    private boolean degraded;
}
