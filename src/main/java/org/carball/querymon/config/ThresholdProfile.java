package org.carball.querymon.config;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named threshold presets. {@code balanced} carries the per-model and per-action
 * limits tuned for the application's hot entities; the others scale them.
 */
@Getter
public enum ThresholdProfile {

    STRICT("strict", "Flag queries early - half the balanced limits", 0.5),

    BALANCED("balanced", "Default limits for most deployments", 1.0),

    RELAXED("relaxed", "Tolerate slower queries - double the balanced limits", 2.0),

    GLOBAL_ONLY("global-only", "Only the global 1s/3s limits, no per-model or per-action overrides", 1.0) {
        @Override
        public PerformanceThresholds buildThresholds() {
            return PerformanceThresholds.defaults();
        }
    };

    private final String name;
    private final String description;
    private final double multiplier;

    ThresholdProfile(String name, String description, double multiplier) {
        this.name = name;
        this.description = description;
        this.multiplier = multiplier;
    }

    public PerformanceThresholds buildThresholds() {
        Map<String, ThresholdLimit> models = new LinkedHashMap<>();
        models.put("User", ThresholdLimit.of(500, 1500));
        models.put("Task", ThresholdLimit.of(500, 1500));
        models.put("Project", ThresholdLimit.of(800, 2000));
        models.put("Message", ThresholdLimit.of(300, 1000));

        Map<String, ThresholdLimit> actions = new LinkedHashMap<>();
        actions.put("findMany", ThresholdLimit.of(800, 2000));
        actions.put("findUnique", ThresholdLimit.of(200, 500));
        actions.put("findFirst", ThresholdLimit.of(300, 800));
        actions.put("create", ThresholdLimit.of(400, 1000));
        actions.put("update", ThresholdLimit.of(400, 1000));
        actions.put("delete", ThresholdLimit.of(300, 800));
        actions.put("count", ThresholdLimit.of(500, 1500));
        actions.put("aggregate", ThresholdLimit.of(1000, 3000));

        PerformanceThresholds.PerformanceThresholdsBuilder builder = PerformanceThresholds.builder()
                .warning(Math.round(1000 * multiplier))
                .critical(Math.round(3000 * multiplier));
        models.forEach((model, limit) -> builder.modelThreshold(model, limit.scaled(multiplier)));
        actions.forEach((action, limit) -> builder.actionThreshold(action, limit.scaled(multiplier)));
        return builder.build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static ThresholdProfile fromName(String name) {
        for (ThresholdProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown threshold profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (ThresholdProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder("Available Threshold Profiles:\n\n");
        for (ThresholdProfile profile : values()) {
            help.append(String.format("  %-14s %s\n", profile.getName(), profile.getDescription()));
        }
        return help.toString();
    }
}
