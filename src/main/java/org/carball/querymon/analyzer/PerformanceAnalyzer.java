package org.carball.querymon.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querymon.config.AnalyzerConfig;
import org.carball.querymon.model.analysis.IssueImpact;
import org.carball.querymon.model.analysis.IssueSeverity;
import org.carball.querymon.model.analysis.IssueType;
import org.carball.querymon.model.analysis.ModelPerformance;
import org.carball.querymon.model.analysis.PerformanceIssue;
import org.carball.querymon.model.analysis.QueryPatternAnalysis;
import org.carball.querymon.model.analysis.RepeatedCallPattern;
import org.carball.querymon.model.query.QueryMetric;
import org.carball.querymon.model.query.SlowQueryLogEntry;
import org.carball.querymon.model.stats.PerformanceStats;
import org.carball.querymon.monitor.Percentiles;
import org.carball.querymon.monitor.QueryMonitor;
import org.carball.querymon.scheduling.ScheduledTask;
import org.carball.querymon.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rule-based issue detection over the monitor's current window.
 * <p>
 * Each run replaces the previous issue list wholesale. The analyzer only reads snapshots
 * from the monitor and never changes its state.
 */
@Slf4j
public class PerformanceAnalyzer {

    private static final int SLOW_QUERY_SAMPLE = 100;
    private static final int MAX_AFFECTED_RECORDS = 20;
    private static final int MAX_PATTERN_EXAMPLES = 10;

    static final List<String> N_PLUS_ONE_HINTS = List.of(
            "Fetch related data in a single query with an include clause",
            "Implement eager loading for associations",
            "Consider a batching data loader for this relationship",
            "Review the calling code for loops that trigger individual queries");

    static final List<String> SLOW_QUERY_HINTS = List.of(
            "Add database indexes on frequently queried columns",
            "Review where clauses for optimization opportunities",
            "Consider adding pagination for large result sets",
            "Use select to fetch only needed fields",
            "Implement caching for frequently accessed data");

    static final List<String> CACHE_HINTS = List.of(
            "Review and optimize cache TTL settings",
            "Implement cache warming for frequently accessed data",
            "Consider more aggressive caching strategies",
            "Use the cache-aside pattern for read-heavy operations",
            "Analyze query patterns to identify cacheable data");

    static final List<String> ERROR_HINTS = List.of(
            "Review error logs for common failure patterns",
            "Check database connection pool settings",
            "Implement retry logic for transient failures",
            "Add input validation to prevent invalid queries",
            "Monitor database health and connectivity");

    private final QueryMonitor monitor;
    private final Clock clock;
    private final TaskScheduler scheduler;

    private volatile AnalyzerConfig config;
    private volatile List<PerformanceIssue> issues = List.of();
    private ScheduledTask analysisTask;

    public PerformanceAnalyzer(QueryMonitor monitor, AnalyzerConfig config, Clock clock, TaskScheduler scheduler) {
        config.validate();
        this.monitor = monitor;
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Runs every detection rule and replaces the stored issues with the result.
     */
    public List<PerformanceIssue> runAnalysis() {
        log.debug("Running performance analysis");
        AnalyzerConfig current = config;
        Instant detectedAt = clock.instant();

        List<PerformanceIssue> found = new ArrayList<>();
        found.addAll(detectNPlusOne(current, detectedAt));
        found.addAll(detectSlowQueries(detectedAt));
        found.addAll(detectCacheIssues(current, detectedAt));
        found.addAll(detectErrorIssues(current, detectedAt));

        issues = List.copyOf(found);

        if (!found.isEmpty()) {
            log.warn("Performance analysis complete: {} issues detected (critical: {}, high: {}, medium: {}, low: {})",
                    found.size(),
                    countBySeverity(found, IssueSeverity.CRITICAL),
                    countBySeverity(found, IssueSeverity.HIGH),
                    countBySeverity(found, IssueSeverity.MEDIUM),
                    countBySeverity(found, IssueSeverity.LOW));
        }
        return issues;
    }

    private static long countBySeverity(List<PerformanceIssue> found, IssueSeverity severity) {
        return found.stream().filter(issue -> issue.getSeverity() == severity).count();
    }

    private List<PerformanceIssue> detectNPlusOne(AnalyzerConfig current, Instant detectedAt) {
        List<PerformanceIssue> found = new ArrayList<>();
        List<QueryMetric> metrics = null;

        for (RepeatedCallPattern pattern : monitor.detectRepeatedCalls(current.getN1TimeWindow())) {
            if (pattern.count() < current.getN1Threshold()) {
                continue;
            }
            if (metrics == null) {
                metrics = monitor.getMetrics();
            }

            IssueSeverity severity;
            if (pattern.count() >= 50) {
                severity = IssueSeverity.CRITICAL;
            } else if (pattern.count() >= 20) {
                severity = IssueSeverity.HIGH;
            } else {
                severity = IssueSeverity.MEDIUM;
            }

            String signature = pattern.signature();
            found.add(PerformanceIssue.builder()
                    .id(issueId(IssueType.N_PLUS_ONE, detectedAt, signature))
                    .type(IssueType.N_PLUS_ONE)
                    .severity(severity)
                    .title("N+1 Query Pattern Detected: " + signature)
                    .description(String.format("Query pattern \"%s\" executed %d times in %dms window, taking %dms total.",
                            signature, pattern.count(), current.getN1TimeWindow(), pattern.totalDuration()))
                    .affectedRecords(metrics.stream()
                            .filter(metric -> metric.getSignature().equals(signature))
                            .limit(MAX_PATTERN_EXAMPLES)
                            .collect(Collectors.toList()))
                    .impact(IssueImpact.of(pattern.count(), pattern.totalDuration()))
                    .recommendations(N_PLUS_ONE_HINTS)
                    .detectedAt(detectedAt)
                    .build());

            log.warn("N+1 query pattern detected: {} executed {} times ({}ms total)",
                    signature, pattern.count(), pattern.totalDuration());
        }
        return found;
    }

    private List<PerformanceIssue> detectSlowQueries(Instant detectedAt) {
        List<SlowQueryLogEntry> slowQueries = monitor.getSlowQueries(SLOW_QUERY_SAMPLE);
        if (slowQueries.isEmpty()) {
            return List.of();
        }

        Map<String, List<QueryMetric>> bySignature = new LinkedHashMap<>();
        for (SlowQueryLogEntry entry : slowQueries) {
            QueryMetric metric = entry.toMetric();
            bySignature.computeIfAbsent(metric.getSignature(), k -> new ArrayList<>()).add(metric);
        }

        List<PerformanceIssue> found = new ArrayList<>();
        bySignature.forEach((signature, records) -> {
            long totalDuration = records.stream().mapToLong(QueryMetric::getDurationMs).sum();
            long maxDuration = records.stream().mapToLong(QueryMetric::getDurationMs).max().orElse(0);
            double avgDuration = (double) totalDuration / records.size();

            IssueSeverity severity;
            if (maxDuration >= 5000) {
                severity = IssueSeverity.CRITICAL;
            } else if (avgDuration >= 1000) {
                severity = IssueSeverity.HIGH;
            } else if (avgDuration >= 500) {
                severity = IssueSeverity.MEDIUM;
            } else {
                severity = IssueSeverity.LOW;
            }

            found.add(PerformanceIssue.builder()
                    .id(issueId(IssueType.SLOW_QUERY, detectedAt, signature))
                    .type(IssueType.SLOW_QUERY)
                    .severity(severity)
                    .title("Slow Query Pattern: " + signature)
                    .description(String.format("Query pattern \"%s\" has %d slow execution(s) with average duration of %.2fms.",
                            signature, records.size(), avgDuration))
                    .affectedRecords(records.stream().limit(MAX_PATTERN_EXAMPLES).collect(Collectors.toList()))
                    .impact(IssueImpact.of(records.size(), totalDuration))
                    .recommendations(SLOW_QUERY_HINTS)
                    .detectedAt(detectedAt)
                    .build());
        });
        return found;
    }

    private List<PerformanceIssue> detectCacheIssues(AnalyzerConfig current, Instant detectedAt) {
        PerformanceStats stats = monitor.getStats();
        if (stats.getTotalQueries() == 0 || stats.getCacheHitRate() >= current.getPoorCacheHitRateThreshold()) {
            return List.of();
        }

        long totalDuration = Math.round(stats.getAverageExecutionTime() * stats.getTotalQueries());
        return List.of(PerformanceIssue.builder()
                .id(issueId(IssueType.POOR_CACHE_HIT_RATE, detectedAt, null))
                .type(IssueType.POOR_CACHE_HIT_RATE)
                .severity(stats.getCacheHitRate() < 10 ? IssueSeverity.HIGH : IssueSeverity.MEDIUM)
                .title("Poor Cache Hit Rate")
                .description(String.format("Cache hit rate is %.1f%%, which is below the %.0f%% threshold.",
                        stats.getCacheHitRate(), current.getPoorCacheHitRateThreshold()))
                .affectedRecords(monitor.getMetrics(MAX_AFFECTED_RECORDS))
                .impact(new IssueImpact(stats.getTotalQueries(), totalDuration, stats.getAverageExecutionTime()))
                .recommendations(CACHE_HINTS)
                .detectedAt(detectedAt)
                .build());
    }

    private List<PerformanceIssue> detectErrorIssues(AnalyzerConfig current, Instant detectedAt) {
        long total = monitor.getTotalTracked();
        if (total == 0) {
            return List.of();
        }

        long failed = monitor.getFailedCount();
        double errorRate = (failed * 100.0) / total;
        if (errorRate <= current.getHighErrorRateThreshold()) {
            return List.of();
        }

        return List.of(PerformanceIssue.builder()
                .id(issueId(IssueType.HIGH_ERROR_RATE, detectedAt, null))
                .type(IssueType.HIGH_ERROR_RATE)
                .severity(errorRate > 20 ? IssueSeverity.CRITICAL : IssueSeverity.HIGH)
                .title("High Query Error Rate")
                .description(String.format("Query error rate is %.1f%% (%d failures out of %d queries).",
                        errorRate, failed, total))
                .affectedRecords(monitor.getMetrics().stream()
                        .filter(metric -> metric.getError() != null)
                        .limit(MAX_AFFECTED_RECORDS)
                        .collect(Collectors.toList()))
                .impact(new IssueImpact(failed, 0, 0))
                .recommendations(ERROR_HINTS)
                .detectedAt(detectedAt)
                .build());
    }

    private static String issueId(IssueType type, Instant detectedAt, String signature) {
        String id = type.getIdPrefix() + "-" + detectedAt.toEpochMilli();
        return signature == null ? id : id + "-" + signature;
    }

    /**
     * Per {@code model.action} statistics over the buffered metrics, largest total
     * duration first.
     */
    public List<QueryPatternAnalysis> analyzeQueryPatterns() {
        AnalyzerConfig current = config;
        Map<String, List<QueryMetric>> bySignature = new LinkedHashMap<>();
        for (QueryMetric metric : monitor.getMetrics()) {
            bySignature.computeIfAbsent(metric.getSignature(), k -> new ArrayList<>()).add(metric);
        }

        List<QueryPatternAnalysis> analyses = new ArrayList<>();
        bySignature.forEach((signature, records) -> {
            long[] durations = records.stream().mapToLong(QueryMetric::getDurationMs).sorted().toArray();
            long totalDuration = 0;
            for (long duration : durations) {
                totalDuration += duration;
            }
            long cached = records.stream().filter(QueryMetric::isCached).count();
            long errors = records.stream().filter(metric -> metric.getError() != null).count();

            double avgDuration = (double) totalDuration / durations.length;
            double cacheHitRate = (cached * 100.0) / records.size();
            double errorRate = (errors * 100.0) / records.size();

            String recommendation = null;
            if (avgDuration > current.getSlowQueryThreshold()) {
                recommendation = "Consider adding indexes or implementing caching";
            } else if (cacheHitRate < current.getPoorCacheHitRateThreshold() && records.size() > 10) {
                recommendation = "Implement caching for this frequently accessed pattern";
            } else if (errorRate > current.getHighErrorRateThreshold()) {
                recommendation = "High error rate - review query logic and database state";
            }

            analyses.add(QueryPatternAnalysis.builder()
                    .pattern(signature)
                    .model(records.get(0).getModel())
                    .action(records.get(0).getAction())
                    .occurrences(records.size())
                    .totalDuration(totalDuration)
                    .avgDuration(avgDuration)
                    .minDuration(durations[0])
                    .maxDuration(durations[durations.length - 1])
                    .p95Duration(Percentiles.of(durations, 95))
                    .cacheHitRate(cacheHitRate)
                    .errorRate(errorRate)
                    .recommendation(recommendation)
                    .build());
        });

        analyses.sort(Comparator.comparingLong(QueryPatternAnalysis::getTotalDuration).reversed());
        return analyses;
    }

    /**
     * Per model totals with per action counts and averages, largest total duration first.
     */
    public List<ModelPerformance> analyzeModelPerformance() {
        Map<String, List<QueryMetric>> byModel = new LinkedHashMap<>();
        for (QueryMetric metric : monitor.getMetrics()) {
            byModel.computeIfAbsent(metric.getModel(), k -> new ArrayList<>()).add(metric);
        }

        List<ModelPerformance> performances = new ArrayList<>();
        byModel.forEach((model, records) -> {
            long totalDuration = records.stream().mapToLong(QueryMetric::getDurationMs).sum();
            Comparator<QueryMetric> byDuration = Comparator.comparingLong(QueryMetric::getDurationMs);

            Map<String, List<QueryMetric>> byAction = new LinkedHashMap<>();
            for (QueryMetric metric : records) {
                byAction.computeIfAbsent(metric.getAction(), k -> new ArrayList<>()).add(metric);
            }
            Map<String, ModelPerformance.ActionStats> actions = new LinkedHashMap<>();
            byAction.forEach((action, actionRecords) -> actions.put(action, new ModelPerformance.ActionStats(
                    actionRecords.size(),
                    actionRecords.stream().mapToLong(QueryMetric::getDurationMs).average().orElse(0))));

            performances.add(ModelPerformance.builder()
                    .model(model)
                    .queryCount(records.size())
                    .totalDuration(totalDuration)
                    .avgDuration((double) totalDuration / records.size())
                    .slowestQuery(records.stream().max(byDuration).orElse(null))
                    .fastestQuery(records.stream().min(byDuration).orElse(null))
                    .actions(actions)
                    .build());
        });

        performances.sort(Comparator.comparingLong(ModelPerformance::getTotalDuration).reversed());
        return performances;
    }

    public List<PerformanceIssue> getIssues() {
        return issues;
    }

    public List<PerformanceIssue> getIssues(IssueSeverity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .collect(Collectors.toList());
    }

    public void clearIssues() {
        issues = List.of();
    }

    /**
     * Replaces the configuration. Auto analysis is restarted with the new interval when
     * enabled, and stopped when disabled.
     */
    public synchronized void updateConfig(AnalyzerConfig newConfig) {
        newConfig.validate();
        this.config = newConfig;
        stopAutoAnalysis();
        if (newConfig.isAutoDetect()) {
            startAutoAnalysis();
        }
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    public synchronized void startAutoAnalysis() {
        if (analysisTask != null) {
            return;
        }
        long interval = config.getAnalysisInterval();
        analysisTask = scheduler.scheduleAtFixedRate("performance-analysis", this::runAnalysis,
                Duration.ofMillis(interval));
        log.info("Auto-analysis started (interval: {}ms)", interval);
    }

    public synchronized void stopAutoAnalysis() {
        if (analysisTask != null) {
            analysisTask.cancel();
            analysisTask = null;
            log.info("Auto-analysis stopped");
        }
    }

    public synchronized boolean isAutoAnalysisRunning() {
        return analysisTask != null;
    }
}
