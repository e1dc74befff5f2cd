package org.carball.querymon.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Layered latency limits. Lookup order is model, then action, then global.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Slf4j
public class PerformanceThresholds {

    @Builder.Default
    long warning = 1000;

    @Builder.Default
    long critical = 3000;

    @Singular("modelThreshold")
    Map<String, ThresholdLimit> modelThresholds;

    @Singular("actionThreshold")
    Map<String, ThresholdLimit> actionThresholds;

    /**
     * Global limits only: warning at 1s, critical at 3s.
     */
    public static PerformanceThresholds defaults() {
        return PerformanceThresholds.builder().build();
    }

    public ThresholdLimit getGlobal() {
        return ThresholdLimit.of(warning, critical);
    }

    /**
     * Rejects negative limits and logs a warning when a layer's warning limit is not
     * below its critical limit, or when two layers overlap so that a longer call can be
     * classified less severely than a shorter one.
     */
    public void validate() {
        checkLimit("global", getGlobal());
        modelThresholds.forEach((model, limit) -> checkLimit("model '" + model + "'", limit));
        actionThresholds.forEach((action, limit) -> checkLimit("action '" + action + "'", limit));

        modelThresholds.forEach((model, modelLimit) -> {
            actionThresholds.forEach((action, actionLimit) ->
                    checkOrdering("model '" + model + "'", modelLimit, "action '" + action + "'", actionLimit));
            checkOrdering("model '" + model + "'", modelLimit, "global", getGlobal());
        });
        actionThresholds.forEach((action, actionLimit) ->
                checkOrdering("action '" + action + "'", actionLimit, "global", getGlobal()));

        log.debug("Using thresholds - Warning: {}ms, Critical: {}ms, Model overrides: {}, Action overrides: {}",
                warning, critical, modelThresholds.size(), actionThresholds.size());
    }

    private static void checkLimit(String layer, ThresholdLimit limit) {
        if (limit.warning() < 0 || limit.critical() < 0) {
            throw new IllegalArgumentException("Threshold limits for " + layer + " must not be negative: " + limit);
        }
        if (limit.warning() >= limit.critical()) {
            log.warn("Warning threshold ({}) for {} should be lower than critical threshold ({})",
                    limit.warning(), layer, limit.critical());
        }
    }

    // The upper layer decides from its warning limit on, so a lower layer that is already
    // critical below that point is followed by a drop to WARNING.
    private static void checkOrdering(String upper, ThresholdLimit upperLimit, String lower, ThresholdLimit lowerLimit) {
        if (upperLimit.warning() < upperLimit.critical() && lowerLimit.critical() < upperLimit.warning()) {
            log.warn("Thresholds for {} and {} invert severity: {}ms is CRITICAL but {}ms is only WARNING",
                    upper, lower, lowerLimit.critical(), upperLimit.warning());
        }
    }

    public String getConfigurationSummary() {
        return String.format("Warning: %dms | Critical: %dms | Model overrides: %d | Action overrides: %d",
                warning, critical, modelThresholds.size(), actionThresholds.size());
    }
}
