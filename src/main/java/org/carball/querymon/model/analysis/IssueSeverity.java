package org.carball.querymon.model.analysis;

/**
 * Ranked most severe first; {@link #ordinal()} is the sort key.
 */
public enum IssueSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public String getDisplayName() {
        return name().toLowerCase();
    }
}
