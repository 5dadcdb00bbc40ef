package com.cgi.fielddiscovery.discovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryStats {
    private long totalFields;

    @Builder.Default
    private Map<String, Long> byStatus = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> byClassification = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> bySensitivity = new LinkedHashMap<>();

    private double averageConfidence;

    /**
     * Fields first detected during the last seven days.
     */
    private long recentDiscoveries;
}
