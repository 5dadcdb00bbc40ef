package com.cgi.fielddiscovery.classifier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Format inferred from the first non-empty sample value.
 */
public enum ValueFormat {
    NUMERIC("numeric"),
    DATE("date"),
    EMAIL("email"),
    TEXT("text"),
    UNKNOWN("unknown");

    private final String value;

    ValueFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
