package com.cgi.fielddiscovery.classifier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk tier produced by the risk and compliance engine.
 */
public enum RiskLevel {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeastHigh() {
        return this == CRITICAL || this == HIGH;
    }

    public static RiskLevel fromValue(String value) {
        for (RiskLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown risk level: " + value);
    }
}
