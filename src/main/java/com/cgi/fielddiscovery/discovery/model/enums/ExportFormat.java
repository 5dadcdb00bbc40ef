package com.cgi.fielddiscovery.discovery.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output format of a field export.
 */
public enum ExportFormat {
    JSON("json"),
    CSV("csv"),
    SQL("sql"),
    MARKDOWN("markdown");

    private final String value;

    ExportFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a constant from its stored or wire value, ignoring case.
     *
     * @param value Stored value
     * @return Matching constant
     * @throws IllegalArgumentException If the value is unknown
     */
    @JsonCreator
    public static ExportFormat fromValue(String value) {
        for (ExportFormat candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown export format: " + value);
    }
}
