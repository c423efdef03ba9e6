package com.pathwaygraph.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Standard disposition options at the end of a pathway.
 */
public enum DispositionType {
    DISCHARGE("Discharge"),
    OBSERVATION("Observation"),
    INPATIENT("Inpatient"),
    ICU("ICU"),
    TRANSFER("Transfer");

    private final String value;

    DispositionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a disposition from its JSON value (case-insensitive).
     *
     * @param value disposition value, e.g. "Observation"
     * @return matching disposition
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static DispositionType fromValue(String value) {
        for (DispositionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown disposition type: " + value);
    }
}
