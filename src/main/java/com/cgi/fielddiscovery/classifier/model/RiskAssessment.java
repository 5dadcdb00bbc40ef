package com.cgi.fielddiscovery.classifier.model;

import com.cgi.fielddiscovery.classifier.model.enums.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the risk and compliance engine for one field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {
    private RiskLevel riskLevel;

    @Builder.Default
    private List<ComplianceFlag> complianceFlags = new ArrayList<>();

    @Builder.Default
    private List<String> regulations = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private List<String> accessRestrictions = new ArrayList<>();

    private String retentionPolicy;

    @Builder.Default
    private List<String> geoRestrictions = new ArrayList<>();

    private boolean encryptionRequired;
}
