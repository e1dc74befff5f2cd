package org.carball.querymon.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private static final Map<String, String> ENVIRONMENT_KEYS = new LinkedHashMap<>();

    static {
        ENVIRONMENT_KEYS.put("QUERYMON_WARNING_MS", "thresholds.warning");
        ENVIRONMENT_KEYS.put("QUERYMON_CRITICAL_MS", "thresholds.critical");
        ENVIRONMENT_KEYS.put("QUERYMON_MAX_METRICS", "monitor.max-metrics");
        ENVIRONMENT_KEYS.put("QUERYMON_MAX_SLOW_QUERIES", "monitor.max-slow-queries");
        ENVIRONMENT_KEYS.put("QUERYMON_ENVIRONMENT", "monitor.environment");
        ENVIRONMENT_KEYS.put("QUERYMON_LOG_DIRECTORY", "logger.directory");
        ENVIRONMENT_KEYS.put("QUERYMON_MAX_LOG_FILES", "logger.max-log-files");
        ENVIRONMENT_KEYS.put("QUERYMON_MAX_LOG_SIZE_BYTES", "logger.max-log-size-bytes");
        ENVIRONMENT_KEYS.put("QUERYMON_CONSOLE_LOG_LEVEL", "logger.console-level");
        ENVIRONMENT_KEYS.put("QUERYMON_N1_THRESHOLD", "analyzer.n1-threshold");
        ENVIRONMENT_KEYS.put("QUERYMON_AUTO_DETECT", "analyzer.auto-detect");
        ENVIRONMENT_KEYS.put("QUERYMON_ANALYSIS_INTERVAL", "analyzer.interval");
    }

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public MonitoringSettings loadConfiguration(String[] args) {
        return loadConfiguration(MonitoringSettings.defaults(), args);
    }

    /**
     * Loads a YAML settings file, then overlays env vars and CLI args.
     */
    public MonitoringSettings loadConfiguration(Path settingsFile, String[] args) throws IOException {
        return loadConfiguration(readSettingsFile(settingsFile), args);
    }

    /**
     * Starts from a threshold profile instead of the default thresholds.
     */
    public MonitoringSettings loadConfigurationWithProfile(String profileName, String[] args) {
        ThresholdProfile profile = ThresholdProfile.fromName(profileName);
        MonitoringSettings base = MonitoringSettings.builder()
                .thresholds(profile.buildThresholds())
                .build();
        log.info("Using threshold profile '{}': {}", profile.getName(), profile.getDescription());
        return loadConfiguration(base, args);
    }

    public MonitoringSettings readSettingsFile(Path settingsFile) throws IOException {
        if (!Files.exists(settingsFile)) {
            throw new IOException("Settings file not found: " + settingsFile);
        }
        log.debug("Reading settings from {}", settingsFile);
        MonitoringSettings settings = yamlMapper.readValue(settingsFile.toFile(), MonitoringSettings.class);
        return settings != null ? settings : MonitoringSettings.defaults();
    }

    private MonitoringSettings loadConfiguration(MonitoringSettings base, String[] args) {
        log.debug("Loading configuration");

        SettingsBuilders builders = new SettingsBuilders(base);

        // 1. Apply environment variables
        applyEnvironmentVariables(builders);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builders, args);

        MonitoringSettings settings = builders.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    private void applyEnvironmentVariables(SettingsBuilders builders) {
        ENVIRONMENT_KEYS.forEach((variable, key) -> {
            String value = environment.get(variable);
            if (value != null) {
                applyOverride(builders, key, value, variable);
            }
        });
    }

    private void applyCLIArguments(SettingsBuilders builders, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (!arg.startsWith("--thresholds.") && !arg.startsWith("--monitor.")
                    && !arg.startsWith("--logger.") && !arg.startsWith("--analyzer.")) {
                continue;
            }
            applyOverride(builders, arg.substring(2), args[i + 1], arg);
            i++;
        }
    }

    private void applyOverride(SettingsBuilders builders, String key, String value, String source) {
        try {
            switch (key) {
                case "thresholds.warning":
                    builders.thresholds.warning(Long.parseLong(value));
                    break;
                case "thresholds.critical":
                    builders.thresholds.critical(Long.parseLong(value));
                    break;
                case "monitor.max-metrics":
                    builders.monitor.maxMetrics(Integer.parseInt(value));
                    break;
                case "monitor.max-slow-queries":
                    builders.monitor.maxSlowQueries(Integer.parseInt(value));
                    break;
                case "monitor.environment":
                    builders.monitor.environment(value);
                    break;
                case "logger.directory":
                    builders.logger.logDirectory(value);
                    break;
                case "logger.max-log-files":
                    builders.logger.maxLogFiles(Integer.parseInt(value));
                    break;
                case "logger.max-log-size-bytes":
                    builders.logger.maxLogSizeBytes(Long.parseLong(value));
                    break;
                case "logger.console-level":
                    builders.logger.consoleLogLevel(ConsoleLogLevel.fromLabel(value));
                    break;
                case "logger.console-logging":
                    builders.logger.enableConsoleLogging(Boolean.parseBoolean(value));
                    break;
                case "logger.file-logging":
                    builders.logger.enableFileLogging(Boolean.parseBoolean(value));
                    break;
                case "logger.rotate-daily":
                    builders.logger.rotateDaily(Boolean.parseBoolean(value));
                    break;
                case "logger.flush-interval-ms":
                    builders.logger.flushIntervalMs(Long.parseLong(value));
                    break;
                case "analyzer.n1-threshold":
                    builders.analyzer.n1Threshold(Integer.parseInt(value));
                    break;
                case "analyzer.n1-time-window":
                    builders.analyzer.n1TimeWindow(Long.parseLong(value));
                    break;
                case "analyzer.slow-query-threshold":
                    builders.analyzer.slowQueryThreshold(Long.parseLong(value));
                    break;
                case "analyzer.cache-hit-rate-threshold":
                    builders.analyzer.poorCacheHitRateThreshold(Double.parseDouble(value));
                    break;
                case "analyzer.error-rate-threshold":
                    builders.analyzer.highErrorRateThreshold(Double.parseDouble(value));
                    break;
                case "analyzer.auto-detect":
                    builders.analyzer.autoDetect(Boolean.parseBoolean(value));
                    break;
                case "analyzer.interval":
                    builders.analyzer.analysisInterval(Long.parseLong(value));
                    break;
                default:
                    log.warn("Ignoring unknown configuration option: {}", source);
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            log.warn("Invalid value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --thresholds.warning <ms>             Global warning threshold
              --thresholds.critical <ms>            Global critical threshold
              --monitor.max-metrics <num>           Metric buffer capacity
              --monitor.max-slow-queries <num>      Slow query buffer capacity
              --monitor.environment <name>          Environment recorded in log entries
              --logger.directory <path>             Slow query log directory
              --logger.max-log-files <num>          Log files kept before the oldest are deleted
              --logger.max-log-size-bytes <num>     Size that triggers rotation
              --logger.console-level <level>        all | warning | critical
              --logger.console-logging <bool>       Mirror slow queries to the console
              --logger.file-logging <bool>          Write slow queries to disk
              --logger.rotate-daily <bool>          One log file per UTC day
              --logger.flush-interval-ms <ms>       Background write interval
              --analyzer.n1-threshold <num>         Repetitions that count as N+1
              --analyzer.n1-time-window <ms>        N+1 sliding window
              --analyzer.slow-query-threshold <ms>  Average duration flagged by pattern analysis
              --analyzer.cache-hit-rate-threshold <pct>
              --analyzer.error-rate-threshold <pct>
              --analyzer.auto-detect <bool>         Run analysis on a timer
              --analyzer.interval <ms>              Analysis interval

            Environment Variables:
              QUERYMON_WARNING_MS, QUERYMON_CRITICAL_MS, QUERYMON_MAX_METRICS,
              QUERYMON_MAX_SLOW_QUERIES, QUERYMON_ENVIRONMENT, QUERYMON_LOG_DIRECTORY,
              QUERYMON_MAX_LOG_FILES, QUERYMON_MAX_LOG_SIZE_BYTES, QUERYMON_CONSOLE_LOG_LEVEL,
              QUERYMON_N1_THRESHOLD, QUERYMON_AUTO_DETECT, QUERYMON_ANALYSIS_INTERVAL

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file, profile or built-in defaults
            """;
    }

    private static final class SettingsBuilders {
        private final PerformanceThresholds.PerformanceThresholdsBuilder thresholds;
        private final MonitorConfig.MonitorConfigBuilder monitor;
        private final LoggerConfig.LoggerConfigBuilder logger;
        private final AnalyzerConfig.AnalyzerConfigBuilder analyzer;

        private SettingsBuilders(MonitoringSettings base) {
            this.thresholds = base.getThresholds().toBuilder();
            this.monitor = base.getMonitor().toBuilder();
            this.logger = base.getLogger().toBuilder();
            this.analyzer = base.getAnalyzer().toBuilder();
        }

        private MonitoringSettings build() {
            return MonitoringSettings.builder()
                    .thresholds(thresholds.build())
                    .monitor(monitor.build())
                    .logger(logger.build())
                    .analyzer(analyzer.build())
                    .build();
        }
    }
}
