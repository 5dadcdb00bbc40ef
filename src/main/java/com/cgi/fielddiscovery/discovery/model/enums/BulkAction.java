package com.cgi.fielddiscovery.discovery.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review action applied to many fields at once.
 */
public enum BulkAction {
    ACCEPT("accept"),
    REJECT("reject");

    private final String value;

    BulkAction(String value) {
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
    public static BulkAction fromValue(String value) {
        for (BulkAction candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown bulk action: " + value);
    }

    public FieldStatus targetStatus() {
        return this == ACCEPT ? FieldStatus.ACCEPTED : FieldStatus.REJECTED;
    }

    public String historyReason() {
        return this == ACCEPT ? "Bulk accept" : "Bulk reject";
    }
}
