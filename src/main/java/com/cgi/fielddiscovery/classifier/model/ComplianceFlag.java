package com.cgi.fielddiscovery.classifier.model;

import com.cgi.fielddiscovery.classifier.model.enums.ComplianceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceFlag {
    private String framework;
    private String requirement;

    @Builder.Default
    private ComplianceStatus status = ComplianceStatus.NEEDS_REVIEW;

    @Builder.Default
    private List<String> actions = new ArrayList<>();
}
