package com.cgi.fielddiscovery.discovery.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of a discovered field.
 */
public enum FieldClassification {
    PII("PII"),
    PHI("PHI"),
    FINANCIAL("Financial"),
    GENERAL("General");

    private final String value;

    FieldClassification(String value) {
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
    public static FieldClassification fromValue(String value) {
        for (FieldClassification candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown field classification: " + value);
    }

    /**
     * Sensitivity a field of this classification gets when nothing more specific is known.
     *
     * @return Default sensitivity
     */
    public Sensitivity defaultSensitivity() {
        switch (this) {
            case PHI:
                return Sensitivity.CRITICAL;
            case PII:
            case FINANCIAL:
                return Sensitivity.HIGH;
            default:
                return Sensitivity.LOW;
        }
    }
}
