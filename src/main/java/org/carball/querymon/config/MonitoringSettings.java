package org.carball.querymon.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Complete engine configuration, as read from a YAML file.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MonitoringSettings {

    @Builder.Default
    PerformanceThresholds thresholds = ThresholdProfile.BALANCED.buildThresholds();

    @Builder.Default
    MonitorConfig monitor = MonitorConfig.defaults();

    @Builder.Default
    LoggerConfig logger = LoggerConfig.defaults();

    @Builder.Default
    AnalyzerConfig analyzer = AnalyzerConfig.defaults();

    public static MonitoringSettings defaults() {
        return MonitoringSettings.builder().build();
    }

    public void validate() {
        thresholds.validate();
        monitor.validate();
        logger.validate();
        analyzer.validate();
    }

    public String getConfigurationSummary() {
        return String.format("%s | Buffers: %d/%d | Log dir: %s | Console: %s | N+1: %d in %dms",
                thresholds.getConfigurationSummary(), monitor.getMaxMetrics(), monitor.getMaxSlowQueries(),
                logger.getLogDirectory(), logger.getConsoleLogLevel().getLabel(),
                analyzer.getN1Threshold(), analyzer.getN1TimeWindow());
    }
}
