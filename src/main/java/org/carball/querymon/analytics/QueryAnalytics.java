package org.carball.querymon.analytics;

import lombok.extern.slf4j.Slf4j;
import org.carball.querymon.logging.SlowQueryLogger;
import org.carball.querymon.model.analysis.IssueSeverity;
import org.carball.querymon.model.query.QueryMetric;
import org.carball.querymon.model.query.SlowQueryLogEntry;
import org.carball.querymon.model.report.AnalyticsReport;
import org.carball.querymon.model.report.OptimizationRecommendation;
import org.carball.querymon.model.report.PerformanceComparison;
import org.carball.querymon.model.report.QueryPattern;
import org.carball.querymon.model.report.SlowQueryInsights;
import org.carball.querymon.model.report.Trend;
import org.carball.querymon.model.stats.PerformanceStats;
import org.carball.querymon.model.stats.TimeRange;
import org.carball.querymon.monitor.Percentiles;
import org.carball.querymon.monitor.QueryMonitor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Groups metrics by structural signature, ranks optimization recommendations and
 * compares the current window against the one before it. Everything is derived per call;
 * nothing is cached.
 */
@Slf4j
public class QueryAnalytics {

    public static final Set<String> DEFAULT_HIGH_CHURN_MODELS = Set.of("Task", "Message");

    private static final Duration DEFAULT_REPORT_WINDOW = Duration.ofHours(24);
    private static final double TREND_TOLERANCE_PERCENT = 10.0;
    private static final int TOP_PATTERNS = 10;
    private static final int TOP_RECOMMENDATIONS = 10;
    private static final int HIGHLIGHTS = 5;
    private static final int MAX_EXAMPLES = 3;
    private static final int TOP_SLOW_GROUPS = 10;

    static final String TOTAL_QUERIES = "Total Queries";
    static final String AVERAGE_TIME = "Average Execution Time (ms)";
    static final String P95_TIME = "P95 Execution Time (ms)";
    static final String P99_TIME = "P99 Execution Time (ms)";
    static final String SLOW_QUERIES = "Slow Queries";
    static final String SLOW_QUERY_RATE = "Slow Query Rate (%)";

    private final QueryMonitor monitor;
    private final SlowQueryLogger slowQueryLogger;
    private final Clock clock;
    private final Set<String> highChurnModels;

    public QueryAnalytics(QueryMonitor monitor, SlowQueryLogger slowQueryLogger, Clock clock) {
        this(monitor, slowQueryLogger, clock, DEFAULT_HIGH_CHURN_MODELS);
    }

    public QueryAnalytics(QueryMonitor monitor, SlowQueryLogger slowQueryLogger, Clock clock,
                          Set<String> highChurnModels) {
        this.monitor = monitor;
        this.slowQueryLogger = slowQueryLogger;
        this.clock = clock;
        this.highChurnModels = Set.copyOf(highChurnModels);
    }

    /**
     * Groups metrics by query hash, most frequent first. The trend compares the mean of
     * the chronologically second half of each group against the first half.
     */
    public List<QueryPattern> analyzePatterns(List<QueryMetric> metrics) {
        Map<String, List<QueryMetric>> byHash = new LinkedHashMap<>();
        for (QueryMetric metric : metrics) {
            byHash.computeIfAbsent(metric.getQueryHash(), k -> new ArrayList<>()).add(metric);
        }

        List<QueryPattern> patterns = new ArrayList<>();
        byHash.forEach((hash, group) -> {
            group.sort(Comparator.comparing(QueryMetric::getTimestamp));
            long[] durations = group.stream().mapToLong(QueryMetric::getDurationMs).sorted().toArray();
            long total = 0;
            for (long duration : durations) {
                total += duration;
            }
            long slowCount = group.stream().filter(QueryMetric::isSlow).count();

            patterns.add(QueryPattern.builder()
                    .queryHash(hash)
                    .model(group.get(0).getModel())
                    .action(group.get(0).getAction())
                    .occurrences(group.size())
                    .averageExecutionTime((double) total / group.size())
                    .minExecutionTime(durations[0])
                    .maxExecutionTime(durations[durations.length - 1])
                    .p95ExecutionTime(Percentiles.of(durations, 95))
                    .slowQueryRate((slowCount * 100.0) / group.size())
                    .trend(trendOf(group))
                    .build());
        });

        patterns.sort(Comparator.comparingInt(QueryPattern::getOccurrences).reversed());
        return patterns;
    }

    private static Trend trendOf(List<QueryMetric> chronological) {
        int midpoint = chronological.size() / 2;
        if (midpoint == 0) {
            return Trend.STABLE;
        }
        double firstHalf = averageDuration(chronological.subList(0, midpoint));
        double secondHalf = averageDuration(chronological.subList(midpoint, chronological.size()));
        if (firstHalf <= 0) {
            return Trend.STABLE;
        }
        return Trend.fromChange(((secondHalf - firstHalf) / firstHalf) * 100, TREND_TOLERANCE_PERCENT);
    }

    private static double averageDuration(List<QueryMetric> metrics) {
        return metrics.stream().mapToLong(QueryMetric::getDurationMs).average().orElse(0);
    }

    /**
     * Recommendations for patterns with a high slow rate, a high average, or a degrading
     * trend over enough samples. Most severe first.
     */
    public List<OptimizationRecommendation> generateRecommendations(List<QueryPattern> patterns,
                                                                    List<QueryMetric> metrics) {
        List<OptimizationRecommendation> recommendations = new ArrayList<>();

        for (QueryPattern pattern : patterns) {
            List<QueryMetric> examples = metrics.stream()
                    .filter(metric -> pattern.getQueryHash().equals(metric.getQueryHash()))
                    .limit(MAX_EXAMPLES)
                    .collect(Collectors.toList());
            String signature = pattern.getModel() + "." + pattern.getAction();

            if (pattern.getSlowQueryRate() > 50) {
                recommendations.add(OptimizationRecommendation.builder()
                        .severity(pattern.getSlowQueryRate() > 80 ? IssueSeverity.CRITICAL : IssueSeverity.HIGH)
                        .model(pattern.getModel())
                        .action(pattern.getAction())
                        .issue(String.format("%.1f%% of %s queries are slow", pattern.getSlowQueryRate(), signature))
                        .recommendation(recommendationFor(pattern))
                        .estimatedImpact("Reducing execution time could improve " + pattern.getOccurrences() + " queries")
                        .examples(examples)
                        .build());
            }

            if (pattern.getAverageExecutionTime() > 2000) {
                recommendations.add(OptimizationRecommendation.builder()
                        .severity(pattern.getAverageExecutionTime() > 5000 ? IssueSeverity.CRITICAL : IssueSeverity.HIGH)
                        .model(pattern.getModel())
                        .action(pattern.getAction())
                        .issue(String.format("Average execution time of %.0fms is too high", pattern.getAverageExecutionTime()))
                        .recommendation(recommendationFor(pattern))
                        .estimatedImpact(String.format("Could reduce response time by %.0fms",
                                pattern.getAverageExecutionTime() - 500))
                        .examples(examples)
                        .build());
            }

            if (pattern.getTrend() == Trend.DEGRADING && pattern.getOccurrences() > 10) {
                recommendations.add(OptimizationRecommendation.builder()
                        .severity(IssueSeverity.MEDIUM)
                        .model(pattern.getModel())
                        .action(pattern.getAction())
                        .issue("Performance is degrading for " + signature)
                        .recommendation("Investigate recent changes or data growth causing performance regression")
                        .estimatedImpact("Prevent further degradation")
                        .examples(examples)
                        .build());
            }
        }

        // stable sort keeps pattern order within a severity
        recommendations.sort(Comparator.comparingInt(recommendation -> recommendation.getSeverity().ordinal()));
        return recommendations;
    }

    String recommendationFor(QueryPattern pattern) {
        List<String> hints = new ArrayList<>();
        String action = pattern.getAction();

        if ("findMany".equals(action)) {
            hints.add("Add pagination with take/skip");
            hints.add("Add appropriate indexes on filter fields");
            hints.add("Consider cursor-based pagination for large datasets");
            hints.add("Review included relations and use select instead if possible");
        } else if ("count".equals(action)) {
            hints.add("Add indexes on where clause fields");
            hints.add("Consider caching count results");
            hints.add("Use approximate counts for large datasets");
        } else if (action.startsWith("create") || action.startsWith("update")
                || action.startsWith("upsert") || action.startsWith("delete")) {
            hints.add("Review triggers and hooks that may slow writes");
            hints.add("Consider batch operations for multiple records");
            hints.add("Check if relations are being loaded unnecessarily");
        } else if (action.contains("aggregate") || action.contains("groupBy")) {
            hints.add("Ensure aggregated fields have indexes");
            hints.add("Consider pre-calculating aggregates");
            hints.add("Use materialized views for complex aggregations");
        }

        if (highChurnModels.contains(pattern.getModel())) {
            hints.add("Consider archiving old " + pattern.getModel() + " records");
            hints.add("Add composite indexes for common " + pattern.getModel() + " queries");
        }

        hints.add("Enable query result caching");
        hints.add("Review and optimize database schema");
        return String.join("; ", hints);
    }

    /**
     * Compares the headline numbers of two windows. Metrics with no previous value are
     * left out.
     */
    public List<PerformanceComparison> comparePerformance(PerformanceStats current, PerformanceStats previous) {
        List<PerformanceComparison> comparisons = new ArrayList<>();
        addComparison(comparisons, TOTAL_QUERIES, PerformanceStats::getTotalQueries, current, previous, false);
        addComparison(comparisons, AVERAGE_TIME, PerformanceStats::getAverageExecutionTime, current, previous, true);
        addComparison(comparisons, P95_TIME, PerformanceStats::getP95ExecutionTime, current, previous, true);
        addComparison(comparisons, P99_TIME, PerformanceStats::getP99ExecutionTime, current, previous, true);
        addComparison(comparisons, SLOW_QUERIES, PerformanceStats::getSlowQueries, current, previous, true);
        return comparisons;
    }

    private static void addComparison(List<PerformanceComparison> comparisons, String metric,
                                      ToDoubleFunction<PerformanceStats> value,
                                      PerformanceStats current, PerformanceStats previous, boolean lowerIsBetter) {
        double previousValue = value.applyAsDouble(previous);
        if (previousValue == 0) {
            return;
        }
        comparisons.add(compare(metric, value.applyAsDouble(current), previousValue, lowerIsBetter));
    }

    // Query volume is neither better nor worse, so its trend stays stable.
    private static PerformanceComparison compare(String metric, double current, double previous, boolean lowerIsBetter) {
        double change = current - previous;
        double changePercentage = previous == 0 ? 0 : (change / previous) * 100;
        Trend trend = lowerIsBetter ? Trend.fromChange(changePercentage, TREND_TOLERANCE_PERCENT) : Trend.STABLE;
        return new PerformanceComparison(metric, current, previous, change, changePercentage, trend);
    }

    /**
     * Report over the last 24 hours.
     */
    public AnalyticsReport generateReport() {
        return generateReport(TimeRange.endingAt(clock.instant(), DEFAULT_REPORT_WINDOW));
    }

    public AnalyticsReport generateReport(TimeRange timeRange) {
        log.debug("Generating analytics report for {} to {}", timeRange.start(), timeRange.end());

        PerformanceStats currentStats = monitor.getStats(timeRange);
        PerformanceStats previousStats = monitor.getStats(timeRange.previous());
        List<QueryMetric> currentMetrics = monitor.getMetrics().stream()
                .filter(metric -> timeRange.contains(metric.getTimestamp()))
                .collect(Collectors.toList());

        List<QueryPattern> allPatterns = analyzePatterns(currentMetrics);
        List<QueryPattern> topPatterns = limit(allPatterns, TOP_PATTERNS);
        List<QueryPattern> problematicPatterns = allPatterns.stream()
                .filter(pattern -> pattern.getSlowQueryRate() > 30 || pattern.getAverageExecutionTime() > 1000)
                .limit(TOP_PATTERNS)
                .collect(Collectors.toList());
        List<OptimizationRecommendation> recommendations = generateRecommendations(allPatterns, currentMetrics);

        AnalyticsReport.Trends trends = new AnalyticsReport.Trends(
                compare(TOTAL_QUERIES, currentStats.getTotalQueries(), previousStats.getTotalQueries(), false),
                compare(AVERAGE_TIME, currentStats.getAverageExecutionTime(), previousStats.getAverageExecutionTime(), true),
                compare(SLOW_QUERY_RATE, currentStats.getSlowQueryRate(), previousStats.getSlowQueryRate(), true));

        Comparator<QueryPattern> byOccurrences = Comparator.comparingInt(QueryPattern::getOccurrences).reversed();
        AnalyticsReport.Highlights highlights = new AnalyticsReport.Highlights(
                currentMetrics.stream()
                        .sorted(Comparator.comparingLong(QueryMetric::getDurationMs))
                        .limit(HIGHLIGHTS)
                        .collect(Collectors.toList()),
                currentStats.getSlowestQueries(),
                limit(topPatterns, HIGHLIGHTS),
                allPatterns.stream()
                        .filter(pattern -> pattern.getTrend() == Trend.IMPROVING)
                        .sorted(byOccurrences)
                        .limit(HIGHLIGHTS)
                        .collect(Collectors.toList()),
                allPatterns.stream()
                        .filter(pattern -> pattern.getTrend() == Trend.DEGRADING)
                        .sorted(byOccurrences)
                        .limit(HIGHLIGHTS)
                        .collect(Collectors.toList()));

        return AnalyticsReport.builder()
                .timestamp(clock.instant())
                .timeRange(timeRange)
                .summary(currentStats)
                .topPatterns(topPatterns)
                .problematicPatterns(problematicPatterns)
                .recommendations(limit(recommendations, TOP_RECOMMENDATIONS))
                .comparisons(comparePerformance(currentStats, previousStats))
                .trends(trends)
                .highlights(highlights)
                .build();
    }

    private static <T> List<T> limit(List<T> items, int max) {
        return new ArrayList<>(items.subList(0, Math.min(max, items.size())));
    }

    /**
     * Slow query counts per UTC day, model and action over the last {@code days} days of
     * the durable log.
     */
    public SlowQueryInsights getSlowQueryInsights(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive, was " + days);
        }
        Instant end = clock.instant();
        List<SlowQueryLogEntry> entries = slowQueryLogger.getLogsInRange(end.minus(Duration.ofDays(days)), end);

        Map<String, Integer> daily = new TreeMap<>();
        for (SlowQueryLogEntry entry : entries) {
            String date = LocalDate.ofInstant(entry.getTimestamp(), ZoneOffset.UTC).toString();
            daily.merge(date, 1, Integer::sum);
        }
        List<SlowQueryInsights.DailyCount> dailyBreakdown = daily.entrySet().stream()
                .map(e -> new SlowQueryInsights.DailyCount(e.getKey(), e.getValue()))
                .collect(Collectors.toList());

        return new SlowQueryInsights(days, entries.size(), dailyBreakdown,
                slowGroups(entries, SlowQueryLogEntry::getModel),
                slowGroups(entries, SlowQueryLogEntry::getAction));
    }

    private static List<SlowQueryInsights.SlowGroup> slowGroups(List<SlowQueryLogEntry> entries,
                                                                Function<SlowQueryLogEntry, String> key) {
        // {count, totalTime}
        Map<String, long[]> groups = new LinkedHashMap<>();
        for (SlowQueryLogEntry entry : entries) {
            long[] acc = groups.computeIfAbsent(key.apply(entry), k -> new long[2]);
            acc[0]++;
            acc[1] += entry.getDurationMs();
        }

        return groups.entrySet().stream()
                .map(e -> new SlowQueryInsights.SlowGroup(e.getKey(), (int) e.getValue()[0],
                        (double) e.getValue()[1] / e.getValue()[0]))
                .sorted(Comparator.comparingInt(SlowQueryInsights.SlowGroup::count).reversed())
                .limit(TOP_SLOW_GROUPS)
                .collect(Collectors.toList());
    }
}
