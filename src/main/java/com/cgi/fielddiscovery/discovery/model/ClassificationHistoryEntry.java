package com.cgi.fielddiscovery.discovery.model;

import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only audit record of a classification or status change.
 * Previous values are null for the first discovery of a field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationHistoryEntry {
    private String id;
    private String fieldId;
    private FieldClassification previousClassification;
    private FieldClassification newClassification;
    private Sensitivity previousSensitivity;
    private Sensitivity newSensitivity;
    private FieldStatus previousStatus;
    private FieldStatus newStatus;
    private String changeReason;
    private String changedBy;
    private LocalDateTime changedAt;
    private String sessionId;
}
