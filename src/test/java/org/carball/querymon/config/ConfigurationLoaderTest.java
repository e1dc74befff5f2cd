package org.carball.querymon.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ConfigurationLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldLoadDefaultsWhenNothingIsSet() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        // When
        MonitoringSettings settings = loader.loadConfiguration(new String[]{});

        // Then
        assertThat(settings.getThresholds().getWarning()).isEqualTo(1000);
        assertThat(settings.getThresholds().getCritical()).isEqualTo(3000);
        assertThat(settings.getMonitor().getMaxMetrics()).isEqualTo(10_000);
        assertThat(settings.getMonitor().getMaxSlowQueries()).isEqualTo(1_000);
        assertThat(settings.getLogger().getMaxLogFiles()).isEqualTo(30);
        assertThat(settings.getLogger().getConsoleLogLevel()).isEqualTo(ConsoleLogLevel.CRITICAL);
        assertThat(settings.getAnalyzer().getN1Threshold()).isEqualTo(10);
        assertThat(settings.getAnalyzer().getAnalysisInterval()).isEqualTo(60_000);
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(message -> message.startsWith("Configuration loaded:"));
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of(
                "QUERYMON_WARNING_MS", "750",
                "QUERYMON_ENVIRONMENT", "staging",
                "QUERYMON_CONSOLE_LOG_LEVEL", "warning",
                "QUERYMON_AUTO_DETECT", "false"));

        // When
        MonitoringSettings settings = loader.loadConfiguration(new String[]{});

        // Then
        assertThat(settings.getThresholds().getWarning()).isEqualTo(750);
        assertThat(settings.getMonitor().getEnvironment()).isEqualTo("staging");
        assertThat(settings.getLogger().getConsoleLogLevel()).isEqualTo(ConsoleLogLevel.WARNING);
        assertThat(settings.getAnalyzer().isAutoDetect()).isFalse();
    }

    @Test
    void shouldPreferCliArgumentsOverEnvironment() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("QUERYMON_N1_THRESHOLD", "20"));
        String[] args = {"--analyzer.n1-threshold", "5", "--logger.directory", "/var/log/querymon"};

        // When
        MonitoringSettings settings = loader.loadConfiguration(args);

        // Then
        assertThat(settings.getAnalyzer().getN1Threshold()).isEqualTo(5);
        assertThat(settings.getLogger().getLogDirectory()).isEqualTo("/var/log/querymon");
    }

    @Test
    void shouldIgnoreInvalidValuesWithWarning() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("QUERYMON_MAX_METRICS", "lots"));

        // When
        MonitoringSettings settings = loader.loadConfiguration(new String[]{"--logger.console-level", "verbose"});

        // Then
        assertThat(settings.getMonitor().getMaxMetrics()).isEqualTo(10_000);
        assertThat(settings.getLogger().getConsoleLogLevel()).isEqualTo(ConsoleLogLevel.CRITICAL);
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .contains("Invalid value for QUERYMON_MAX_METRICS: lots",
                        "Invalid value for --logger.console-level: verbose");
    }

    @Test
    void shouldWarnAboutUnknownOptions() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        // When
        loader.loadConfiguration(new String[]{"--monitor.colour", "blue"});

        // Then
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .contains("Ignoring unknown configuration option: --monitor.colour");
    }

    @Test
    void shouldStartFromProfile() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        // When
        MonitoringSettings settings = loader.loadConfigurationWithProfile("strict",
                new String[]{"--thresholds.critical", "1200"});

        // Then
        assertThat(settings.getThresholds().getWarning()).isEqualTo(500);
        assertThat(settings.getThresholds().getCritical()).isEqualTo(1200);
        assertThat(settings.getThresholds().getModelThresholds()).containsKey("User");
    }

    @Test
    void shouldReadYamlSettingsFile() throws IOException {
        // Given
        Path file = tempDir.resolve("querymon.yml");
        Files.writeString(file, String.join("\n",
                "thresholds:",
                "  warning: 400",
                "  critical: 900",
                "  modelThresholds:",
                "    Order:",
                "      warning: 100",
                "      critical: 200",
                "monitor:",
                "  environment: production",
                "logger:",
                "  maxLogFiles: 7",
                "analyzer:",
                "  n1Threshold: 25",
                ""));
        ConfigurationLoader loader = new ConfigurationLoader(Map.of("QUERYMON_MAX_LOG_FILES", "9"));

        // When
        MonitoringSettings settings = loader.loadConfiguration(file, new String[]{});

        // Then
        assertThat(settings.getThresholds().getWarning()).isEqualTo(400);
        assertThat(settings.getThresholds().getModelThresholds().get("Order")).isEqualTo(ThresholdLimit.of(100, 200));
        assertThat(settings.getMonitor().getEnvironment()).isEqualTo("production");
        assertThat(settings.getMonitor().getMaxMetrics()).isEqualTo(10_000);
        assertThat(settings.getLogger().getMaxLogFiles()).isEqualTo(9);
        assertThat(settings.getAnalyzer().getN1Threshold()).isEqualTo(25);
    }

    @Test
    void shouldFailOnMissingSettingsFile() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());
        Path missing = tempDir.resolve("absent.yml");

        // When / Then
        assertThatThrownBy(() -> loader.loadConfiguration(missing, new String[]{}))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Settings file not found");
    }

    @Test
    void shouldRejectSettingsThatFailValidation() {
        // Given
        ConfigurationLoader loader = new ConfigurationLoader(Map.of());

        // When / Then
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--monitor.max-metrics", "0"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxMetrics must be positive");
    }
}
