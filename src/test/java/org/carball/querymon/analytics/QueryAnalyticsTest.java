package org.carball.querymon.analytics;

import org.carball.querymon.config.LoggerConfig;
import org.carball.querymon.config.MonitorConfig;
import org.carball.querymon.config.PerformanceThresholds;
import org.carball.querymon.logging.SlowQueryLogger;
import org.carball.querymon.model.analysis.IssueSeverity;
import org.carball.querymon.model.query.QueryMetric;
import org.carball.querymon.model.query.Severity;
import org.carball.querymon.model.report.AnalyticsReport;
import org.carball.querymon.model.report.OptimizationRecommendation;
import org.carball.querymon.model.report.PerformanceComparison;
import org.carball.querymon.model.report.QueryPattern;
import org.carball.querymon.model.report.SlowQueryInsights;
import org.carball.querymon.model.report.Trend;
import org.carball.querymon.model.stats.PerformanceStats;
import org.carball.querymon.model.stats.TimeRange;
import org.carball.querymon.monitor.QueryMonitor;
import org.carball.querymon.support.ManualTaskScheduler;
import org.carball.querymon.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.querymon.support.Records.call;
import static org.carball.querymon.support.Records.slowEntry;

public class QueryAnalyticsTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private QueryMonitor monitor;
    private SlowQueryLogger slowQueryLogger;
    private QueryAnalytics analytics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        monitor = new QueryMonitor(PerformanceThresholds.defaults(), MonitorConfig.defaults(), clock);
        slowQueryLogger = new SlowQueryLogger(LoggerConfig.builder()
                .logDirectory(tempDir.toString())
                .enableConsoleLogging(false)
                .build(), clock, new ManualTaskScheduler());
        analytics = new QueryAnalytics(monitor, slowQueryLogger, clock);
    }

    private List<QueryMetric> track(String model, String action, long... durations) {
        for (int i = 0; i < durations.length; i++) {
            monitor.track(call(model, action, durations[i], NOW.minusSeconds(durations.length - i)));
        }
        return monitor.getMetrics();
    }

    private static QueryPattern pattern(String model, String action, int occurrences, double average,
                                        double slowRate, Trend trend) {
        return QueryPattern.builder()
                .queryHash(model + "." + action + "{where}")
                .model(model)
                .action(action)
                .occurrences(occurrences)
                .averageExecutionTime(average)
                .slowQueryRate(slowRate)
                .trend(trend)
                .build();
    }

    @Test
    void shouldGroupByHashMostFrequentFirst() {
        // Given
        track("User", "findUnique", 10, 20);
        List<QueryMetric> metrics = track("Task", "findMany", 100, 200, 300, 1500);

        // When
        List<QueryPattern> patterns = analytics.analyzePatterns(metrics);

        // Then
        assertThat(patterns).extracting(QueryPattern::getQueryHash)
                .containsExactly("Task.findMany{where}", "User.findUnique{where}");
        QueryPattern tasks = patterns.get(0);
        assertThat(tasks.getOccurrences()).isEqualTo(4);
        assertThat(tasks.getAverageExecutionTime()).isEqualTo(525.0);
        assertThat(tasks.getMinExecutionTime()).isEqualTo(100);
        assertThat(tasks.getMaxExecutionTime()).isEqualTo(1500);
        assertThat(tasks.getSlowQueryRate()).isEqualTo(25.0);
    }

    @Test
    void shouldDetectTrendFromChronologicalHalves() {
        // Given
        track("Task", "findMany", 100, 100, 300, 300);
        track("User", "findMany", 300, 300, 100, 100);
        track("Message", "count", 100, 105, 100, 108);
        List<QueryMetric> metrics = track("Project", "findFirst", 50);

        // When
        List<QueryPattern> patterns = analytics.analyzePatterns(metrics);

        // Then
        assertThat(patterns).filteredOn(p -> p.getModel().equals("Task")).extracting(QueryPattern::getTrend)
                .containsExactly(Trend.DEGRADING);
        assertThat(patterns).filteredOn(p -> p.getModel().equals("User")).extracting(QueryPattern::getTrend)
                .containsExactly(Trend.IMPROVING);
        assertThat(patterns).filteredOn(p -> p.getModel().equals("Message")).extracting(QueryPattern::getTrend)
                .containsExactly(Trend.STABLE);
        assertThat(patterns).filteredOn(p -> p.getModel().equals("Project")).extracting(QueryPattern::getTrend)
                .containsExactly(Trend.STABLE);
    }

    @Test
    void shouldOrderRecommendationsBySeverity() {
        // Given
        List<QueryPattern> patterns = List.of(
                pattern("Task", "findMany", 20, 300, 10, Trend.DEGRADING),
                pattern("User", "count", 10, 2500, 60, Trend.STABLE),
                pattern("Report", "aggregate", 5, 6000, 100, Trend.STABLE));

        // When
        List<OptimizationRecommendation> recommendations = analytics.generateRecommendations(patterns, List.of());

        // Then
        assertThat(recommendations).extracting(OptimizationRecommendation::getSeverity)
                .containsExactly(IssueSeverity.CRITICAL, IssueSeverity.CRITICAL,
                        IssueSeverity.HIGH, IssueSeverity.HIGH, IssueSeverity.MEDIUM);
        assertThat(recommendations.get(0).getIssue()).isEqualTo("100.0% of Report.aggregate queries are slow");
        assertThat(recommendations.get(1).getIssue()).isEqualTo("Average execution time of 6000ms is too high");
        assertThat(recommendations.get(1).getEstimatedImpact()).isEqualTo("Could reduce response time by 5500ms");
        assertThat(recommendations.get(4).getIssue()).isEqualTo("Performance is degrading for Task.findMany");
    }

    @Test
    void shouldSkipDegradingPatternsWithFewSamples() {
        // Given
        List<QueryPattern> patterns = List.of(pattern("Task", "findMany", 10, 300, 10, Trend.DEGRADING));

        // Then
        assertThat(analytics.generateRecommendations(patterns, List.of())).isEmpty();
    }

    @Test
    void shouldAttachAtMostThreeExamples() {
        // Given
        List<QueryMetric> metrics = track("User", "count", 2500, 2600, 2700, 2800, 2900);
        List<QueryPattern> patterns = analytics.analyzePatterns(metrics);

        // When
        List<OptimizationRecommendation> recommendations = analytics.generateRecommendations(patterns, metrics);

        // Then
        assertThat(recommendations).isNotEmpty()
                .allSatisfy(recommendation -> assertThat(recommendation.getExamples()).hasSize(3));
    }

    @Test
    void shouldTailorHintsToActionAndModel() {
        // When
        String findMany = analytics.recommendationFor(pattern("Task", "findMany", 1, 0, 0, Trend.STABLE));
        String upsert = analytics.recommendationFor(pattern("User", "upsert", 1, 0, 0, Trend.STABLE));
        String groupBy = analytics.recommendationFor(pattern("Order", "groupBy", 1, 0, 0, Trend.STABLE));
        String other = analytics.recommendationFor(pattern("Order", "findUnique", 1, 0, 0, Trend.STABLE));

        // Then
        assertThat(findMany).startsWith("Add pagination with take/skip")
                .contains("Consider archiving old Task records")
                .endsWith("Enable query result caching; Review and optimize database schema");
        assertThat(upsert).startsWith("Review triggers and hooks").doesNotContain("archiving");
        assertThat(groupBy).startsWith("Ensure aggregated fields have indexes");
        assertThat(other).isEqualTo("Enable query result caching; Review and optimize database schema");
    }

    @Test
    void shouldUseConfiguredHighChurnModels() {
        // Given
        QueryAnalytics custom = new QueryAnalytics(monitor, slowQueryLogger, clock, Set.of("AuditLog"));

        // Then
        assertThat(custom.recommendationFor(pattern("AuditLog", "count", 1, 0, 0, Trend.STABLE)))
                .contains("Consider archiving old AuditLog records");
        assertThat(custom.recommendationFor(pattern("Task", "count", 1, 0, 0, Trend.STABLE)))
                .doesNotContain("archiving");
    }

    @Test
    void shouldSkipComparisonsWithoutPreviousValue() {
        // Given
        PerformanceStats current = PerformanceStats.builder()
                .totalQueries(200).slowQueries(10).averageExecutionTime(150)
                .p95ExecutionTime(400).p99ExecutionTime(900).build();
        PerformanceStats previous = PerformanceStats.builder()
                .totalQueries(100).slowQueries(0).averageExecutionTime(100)
                .p95ExecutionTime(500).p99ExecutionTime(900).build();

        // When
        List<PerformanceComparison> comparisons = analytics.comparePerformance(current, previous);

        // Then
        assertThat(comparisons).extracting(PerformanceComparison::metric)
                .containsExactly(QueryAnalytics.TOTAL_QUERIES, QueryAnalytics.AVERAGE_TIME,
                        QueryAnalytics.P95_TIME, QueryAnalytics.P99_TIME);
        assertThat(comparisons).extracting(PerformanceComparison::trend)
                .containsExactly(Trend.STABLE, Trend.DEGRADING, Trend.IMPROVING, Trend.STABLE);
        assertThat(comparisons.get(0).changePercentage()).isEqualTo(100.0);
        assertThat(comparisons.get(1).change()).isEqualTo(50.0);
    }

    @Test
    void shouldReportEmptyWindowWithAllTrends() {
        // When
        AnalyticsReport report = analytics.generateReport();

        // Then
        assertThat(report.getTimeRange()).isEqualTo(new TimeRange(NOW.minus(Duration.ofHours(24)), NOW));
        assertThat(report.getSummary().getTotalQueries()).isZero();
        assertThat(report.getTopPatterns()).isEmpty();
        assertThat(report.getComparisons()).isEmpty();
        assertThat(report.getTrends().queryCount().trend()).isEqualTo(Trend.STABLE);
        assertThat(report.getTrends().averageTime().changePercentage()).isZero();
        assertThat(report.getTrends().slowQueryRate().metric()).isEqualTo(QueryAnalytics.SLOW_QUERY_RATE);
    }

    @Test
    void shouldCompareReportWindowWithPreviousWindow() {
        // Given - previous hour
        for (int i = 0; i < 10; i++) {
            monitor.track(call("User", "findMany", 100, NOW.minus(Duration.ofMinutes(90)).plusSeconds(i)));
        }
        // current hour, slower and with slow calls
        for (int i = 0; i < 10; i++) {
            monitor.track(call("User", "findMany", i < 5 ? 100 : 1500, NOW.minus(Duration.ofMinutes(30)).plusSeconds(i)));
        }

        // When
        AnalyticsReport report = analytics.generateReport(TimeRange.endingAt(NOW, Duration.ofHours(1)));

        // Then
        assertThat(report.getSummary().getTotalQueries()).isEqualTo(10);
        assertThat(report.getTrends().averageTime().previous()).isEqualTo(100.0);
        assertThat(report.getTrends().averageTime().current()).isEqualTo(800.0);
        assertThat(report.getTrends().averageTime().trend()).isEqualTo(Trend.DEGRADING);
        assertThat(report.getTrends().slowQueryRate().current()).isEqualTo(50.0);
        assertThat(report.getProblematicPatterns()).extracting(QueryPattern::getQueryHash)
                .containsExactly("User.findMany{where}");
        assertThat(report.getHighlights().fastestQueries()).hasSize(5)
                .allSatisfy(metric -> assertThat(metric.getDurationMs()).isEqualTo(100));
        assertThat(report.getHighlights().recentRegressions()).extracting(QueryPattern::getQueryHash)
                .containsExactly("User.findMany{where}");
        assertThat(report.getHighlights().recentImprovements()).isEmpty();
        assertThat(report.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    void shouldCountCallAtWindowStartOnlyInCurrentWindow() {
        // Given
        TimeRange window = TimeRange.endingAt(NOW, Duration.ofHours(1));
        monitor.track(call("User", "findMany", 100, window.start()));
        monitor.track(call("User", "findMany", 300, NOW.minus(Duration.ofMinutes(90))));

        // When
        AnalyticsReport report = analytics.generateReport(window);

        // Then
        assertThat(window.previous().contains(window.start())).isFalse();
        assertThat(window.previous().length()).isEqualTo(window.length());
        assertThat(report.getTrends().queryCount().current()).isEqualTo(1.0);
        assertThat(report.getTrends().queryCount().previous()).isEqualTo(1.0);
        assertThat(report.getTrends().averageTime().previous()).isEqualTo(300.0);
    }

    @Test
    void shouldSummarizeSlowQueryLogByDay() {
        // Given
        slowQueryLogger.log(slowEntry("User", "findMany", 1500, Severity.WARNING, NOW.minus(Duration.ofDays(2))));
        slowQueryLogger.log(slowEntry("User", "count", 4500, Severity.CRITICAL, NOW.minus(Duration.ofDays(2))));
        slowQueryLogger.log(slowEntry("Task", "findMany", 1100, Severity.WARNING, NOW.minus(Duration.ofHours(1))));
        slowQueryLogger.log(slowEntry("Task", "findMany", 1300, Severity.WARNING, NOW.minus(Duration.ofDays(30))));
        slowQueryLogger.flush();

        // When
        SlowQueryInsights insights = analytics.getSlowQueryInsights(7);

        // Then
        assertThat(insights.days()).isEqualTo(7);
        assertThat(insights.totalSlowQueries()).isEqualTo(3);
        assertThat(insights.dailyBreakdown()).containsExactly(
                new SlowQueryInsights.DailyCount("2024-03-08", 2),
                new SlowQueryInsights.DailyCount("2024-03-10", 1));
        assertThat(insights.topSlowModels().get(0)).isEqualTo(new SlowQueryInsights.SlowGroup("User", 2, 3000.0));
        assertThat(insights.topSlowActions().get(0).name()).isEqualTo("findMany");
        assertThat(insights.topSlowActions().get(0).count()).isEqualTo(2);
    }

    @Test
    void shouldRejectNonPositiveDays() {
        assertThatThrownBy(() -> analytics.getSlowQueryInsights(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("days must be positive");
    }
}
