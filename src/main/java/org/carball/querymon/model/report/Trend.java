package org.carball.querymon.model.report;

public enum Trend {
    IMPROVING,
    DEGRADING,
    STABLE;

    /**
     * Classifies a percentage change where lower values are better.
     */
    public static Trend fromChange(double changePercentage, double tolerancePercent) {
        if (changePercentage < -tolerancePercent) {
            return IMPROVING;
        }
        if (changePercentage > tolerancePercent) {
            return DEGRADING;
        }
        return STABLE;
    }
}
