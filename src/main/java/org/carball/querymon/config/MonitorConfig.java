package org.carball.querymon.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Buffer capacities of the query monitor. Overflow silently evicts the oldest entries.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MonitorConfig {

    @Builder.Default
    int maxMetrics = 10_000;

    @Builder.Default
    int maxSlowQueries = 1_000;

    @Builder.Default
    String environment = "development";

    public static MonitorConfig defaults() {
        return MonitorConfig.builder().build();
    }

    public void validate() {
        if (maxMetrics <= 0) {
            throw new IllegalArgumentException("maxMetrics must be positive, was " + maxMetrics);
        }
        if (maxSlowQueries <= 0) {
            throw new IllegalArgumentException("maxSlowQueries must be positive, was " + maxSlowQueries);
        }
        if (environment == null || environment.isBlank()) {
            throw new IllegalArgumentException("environment must not be blank");
        }
    }
}
