package org.carball.querymon.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.carball.querymon.model.query.Severity;

/**
 * Minimum severity mirrored to the console by the slow query logger.
 */
public enum ConsoleLogLevel {
    ALL,
    WARNING,
    CRITICAL;

    public boolean accepts(Severity severity) {
        switch (this) {
            case ALL:
                return true;
            case WARNING:
                return severity.isSlow();
            case CRITICAL:
            default:
                return severity == Severity.CRITICAL;
        }
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ConsoleLogLevel fromLabel(String label) {
        for (ConsoleLogLevel level : values()) {
            if (level.name().equalsIgnoreCase(label)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Invalid console log level: " + label + ". Use: all, warning or critical");
    }
}
