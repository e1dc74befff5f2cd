package org.carball.querymon.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Latency severity of a single observed call. Declaration order is significant:
 * {@code NORMAL < WARNING < CRITICAL}.
 */
public enum Severity {
    NORMAL("normal"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isSlow() {
        return this != NORMAL;
    }

    @JsonCreator
    public static Severity fromLabel(String label) {
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(label)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + label);
    }
}
