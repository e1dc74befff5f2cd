package org.carball.querymon.config;

/**
 * Warning and critical latency limits, in milliseconds, for one threshold layer.
 */
public record ThresholdLimit(long warning, long critical) {

    public static ThresholdLimit of(long warning, long critical) {
        return new ThresholdLimit(warning, critical);
    }

    public ThresholdLimit scaled(double multiplier) {
        return new ThresholdLimit(Math.round(warning * multiplier), Math.round(critical * multiplier));
    }
}
