package com.cgi.fielddiscovery.discovery.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sensitivity level of a discovered field.
 */
public enum Sensitivity {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String value;

    Sensitivity(String value) {
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
    public static Sensitivity fromValue(String value) {
        for (Sensitivity candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown sensitivity: " + value);
    }
}
