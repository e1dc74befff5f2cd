package org.carball.querymon.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Slf4j
public class AnalyzerConfig {

    /** Repetitions of one signature inside the window that count as N+1. */
    @Builder.Default
    int n1Threshold = 10;

    /** Sliding window for N+1 detection, in milliseconds. */
    @Builder.Default
    long n1TimeWindow = 1000;

    /** Average duration above which pattern analysis suggests indexes or caching. */
    @Builder.Default
    long slowQueryThreshold = 100;

    /** Cache hit rate floor, in percent. */
    @Builder.Default
    double poorCacheHitRateThreshold = 30;

    /** Error rate ceiling, in percent. */
    @Builder.Default
    double highErrorRateThreshold = 5;

    @Builder.Default
    boolean autoDetect = true;

    /** Interval between automatic analysis runs, in milliseconds. */
    @Builder.Default
    long analysisInterval = 60_000;

    public static AnalyzerConfig defaults() {
        return AnalyzerConfig.builder().build();
    }

    public void validate() {
        if (n1Threshold <= 0) {
            throw new IllegalArgumentException("n1Threshold must be positive, was " + n1Threshold);
        }
        if (n1TimeWindow <= 0) {
            throw new IllegalArgumentException("n1TimeWindow must be positive, was " + n1TimeWindow);
        }
        if (analysisInterval <= 0) {
            throw new IllegalArgumentException("analysisInterval must be positive, was " + analysisInterval);
        }
        if (poorCacheHitRateThreshold < 0 || poorCacheHitRateThreshold > 100) {
            log.warn("Poor cache hit rate threshold ({}) should be a percentage between 0 and 100",
                    poorCacheHitRateThreshold);
        }
        if (highErrorRateThreshold < 0 || highErrorRateThreshold > 100) {
            log.warn("High error rate threshold ({}) should be a percentage between 0 and 100",
                    highErrorRateThreshold);
        }
    }
}
