package com.cgi.fielddiscovery.discovery.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review status of a discovered field.
 */
public enum FieldStatus {
    PENDING("pending"),
    ACCEPTED("accepted"),
    REJECTED("rejected"),
    NEEDS_REVIEW("needs-review");

    private final String value;

    FieldStatus(String value) {
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
    public static FieldStatus fromValue(String value) {
        for (FieldStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown field status: " + value);
    }
}
