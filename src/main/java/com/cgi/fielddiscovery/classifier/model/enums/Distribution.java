package com.cgi.fielddiscovery.classifier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Distribution label derived from the uniqueness ratio.
 */
public enum Distribution {
    UNIQUE("unique"),
    CATEGORICAL("categorical"),
    MIXED("mixed"),
    UNKNOWN("unknown");

    private final String value;

    Distribution(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
