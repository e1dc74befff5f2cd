package org.carball.querymon.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PerformanceThresholdsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(PerformanceThresholds.class);
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
    void shouldCreateDefaultThresholds() {
        // When
        PerformanceThresholds thresholds = PerformanceThresholds.defaults();

        // Then
        assertThat(thresholds.getWarning()).isEqualTo(1000);
        assertThat(thresholds.getCritical()).isEqualTo(3000);
        assertThat(thresholds.getModelThresholds()).isEmpty();
        assertThat(thresholds.getActionThresholds()).isEmpty();
        assertThat(thresholds.getGlobal()).isEqualTo(ThresholdLimit.of(1000, 3000));
    }

    @Test
    void shouldValidateValidThresholds() {
        // Given
        PerformanceThresholds thresholds = PerformanceThresholds.builder()
                .warning(500)
                .critical(2000)
                .modelThreshold("User", ThresholdLimit.of(100, 300))
                .build();

        // When
        thresholds.validate();

        // Then - only the DEBUG summary
        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void shouldWarnWhenGlobalWarningNotBelowCritical() {
        // Given
        PerformanceThresholds thresholds = PerformanceThresholds.builder()
                .warning(3000)
                .critical(3000)
                .build();

        // When
        thresholds.validate();

        // Then
        List<ILoggingEvent> warnings = logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .toList();
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getFormattedMessage())
                .contains("Warning threshold (3000) for global should be lower than critical threshold (3000)");
    }

    @Test
    void shouldNameTheOffendingLayerInWarnings() {
        // Given
        PerformanceThresholds thresholds = PerformanceThresholds.builder()
                .modelThreshold("Task", ThresholdLimit.of(900, 400))
                .actionThreshold("count", ThresholdLimit.of(700, 700))
                .build();

        // When
        thresholds.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(message -> message.contains("model 'Task'"))
                .anyMatch(message -> message.contains("action 'count'"));
    }

    @Test
    void shouldWarnWhenModelLayerOverlapsActionLayer() {
        // Given
        PerformanceThresholds thresholds = PerformanceThresholds.builder()
                .modelThreshold("Project", ThresholdLimit.of(800, 2000))
                .actionThreshold("findUnique", ThresholdLimit.of(200, 500))
                .actionThreshold("findMany", ThresholdLimit.of(800, 2000))
                .build();

        // When
        thresholds.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Thresholds for model 'Project' and action 'findUnique' invert severity: "
                        + "500ms is CRITICAL but 800ms is only WARNING");
    }

    @Test
    void shouldWarnWhenGlobalCriticalIsBelowAnOverrideWarning() {
        // Given
        PerformanceThresholds thresholds = PerformanceThresholds.builder()
                .warning(100)
                .critical(300)
                .actionThreshold("aggregate", ThresholdLimit.of(1000, 3000))
                .build();

        // When
        thresholds.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .singleElement()
                .satisfies(message -> assertThat(message).contains("action 'aggregate' and global"));
    }

    @Test
    void shouldRejectNegativeLimits() {
        // Given
        PerformanceThresholds thresholds = PerformanceThresholds.builder()
                .actionThreshold("findMany", ThresholdLimit.of(-1, 100))
                .build();

        // When / Then
        assertThatThrownBy(thresholds::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("action 'findMany'");
    }

    @Test
    void shouldSummarizeConfiguration() {
        // Given
        PerformanceThresholds thresholds = ThresholdProfile.BALANCED.buildThresholds();

        // When
        String summary = thresholds.getConfigurationSummary();

        // Then
        assertThat(summary).isEqualTo("Warning: 1000ms | Critical: 3000ms | Model overrides: 4 | Action overrides: 8");
    }
}
