package com.cgi.fielddiscovery.classifier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a compliance flag.
 */
public enum ComplianceStatus {
    COMPLIANT("compliant"),
    NON_COMPLIANT("non-compliant"),
    NEEDS_REVIEW("needs-review");

    private final String value;

    ComplianceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
