package com.cgi.fielddiscovery.discovery.model;

import com.cgi.fielddiscovery.discovery.model.enums.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One discovery run over a data source.
 * Status moves pending, processing, then completed or failed; progress never decreases.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoverySession {
    private String id;
    private String dataSourceId;

    @Builder.Default
    private List<String> targetSchemas = new ArrayList<>();

    @Builder.Default
    private List<String> targetTables = new ArrayList<>();

    @Builder.Default
    private SessionStatus status = SessionStatus.PENDING;

    private int progress;
    private int fieldsDiscovered;
    private int fieldsClassified;
    private int piiFieldsFound;
    private int phiFieldsFound;
    private int financialFieldsFound;

    /**
     * Number of table groups whose fields could not be persisted.
     */
    private int failedTableGroups;

    private String errorMessage;
    private String triggeredBy;
    private boolean forceRefresh;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;
    private Long durationMs;
}
