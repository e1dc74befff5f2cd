package org.carball.querymon.monitor;

import lombok.extern.slf4j.Slf4j;
import org.carball.querymon.config.MonitorConfig;
import org.carball.querymon.config.PerformanceThresholds;
import org.carball.querymon.config.ThresholdLimit;
import org.carball.querymon.model.analysis.RepeatedCallPattern;
import org.carball.querymon.model.query.ExecutionRecord;
import org.carball.querymon.model.query.QueryMetric;
import org.carball.querymon.model.query.Severity;
import org.carball.querymon.model.query.SlowQueryLogEntry;
import org.carball.querymon.model.stats.PerformanceStats;
import org.carball.querymon.model.stats.RollupStats;
import org.carball.querymon.model.stats.TimeRange;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Collects query metrics in bounded in-memory buffers and computes statistics over them.
 * <p>
 * Both buffers are lossy: once full, every append evicts the oldest entry. Only the
 * failure counter and the tracked-call counter survive eviction, so the failure rate
 * stays accurate for the whole monitoring period.
 */
@Slf4j
public class QueryMonitor {

    private static final int SLOWEST_QUERY_COUNT = 10;

    private final MonitorConfig config;
    private final Clock clock;
    private final BoundedBuffer<QueryMetric> metrics;
    private final BoundedBuffer<SlowQueryLogEntry> slowQueries;
    private final List<SlowQueryListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong totalTracked = new AtomicLong();
    private final AtomicLong slowTracked = new AtomicLong();
    private final AtomicLong failedQueries = new AtomicLong();

    private volatile PerformanceThresholds thresholds;
    private volatile Instant startTime;

    public QueryMonitor() {
        this(PerformanceThresholds.defaults(), MonitorConfig.defaults(), Clock.systemUTC());
    }

    public QueryMonitor(PerformanceThresholds thresholds, MonitorConfig config, Clock clock) {
        thresholds.validate();
        config.validate();
        this.thresholds = thresholds;
        this.config = config;
        this.clock = clock;
        this.metrics = new BoundedBuffer<>(config.getMaxMetrics());
        this.slowQueries = new BoundedBuffer<>(config.getMaxSlowQueries());
        this.startTime = clock.instant();

        log.debug("Initialized QueryMonitor with thresholds: {}", thresholds.getConfigurationSummary());
    }

    /**
     * Records one observed call. Never throws: observation is best effort and must not
     * disturb the call being observed.
     */
    public void track(ExecutionRecord record) {
        if (record == null) {
            log.warn("Ignoring null execution record");
            return;
        }
        try {
            Severity severity = getSeverity(record.getModel(), record.getAction(), record.getDurationMs());
            String queryHash = QuerySignatures.hash(record.getModel(), record.getAction(), record.getClauses());
            QueryMetric metric = QueryMetric.from(record, queryHash, severity);

            metrics.add(metric);
            totalTracked.incrementAndGet();
            if (record.isFailed()) {
                failedQueries.incrementAndGet();
            }

            if (metric.isSlow()) {
                slowTracked.incrementAndGet();
                SlowQueryLogEntry entry = SlowQueryLogEntry.from(metric, config.getEnvironment());
                slowQueries.add(entry);
                notifyListeners(entry);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to track query {}.{}", record.getModel(), record.getAction(), e);
        }
    }

    /**
     * Counts a failed call for which no record could be built.
     */
    public void trackFailure() {
        failedQueries.incrementAndGet();
    }

    /**
     * Classifies a duration: model limits first, then action limits, then the global
     * limits. The first layer whose limit is reached decides.
     */
    public Severity getSeverity(String model, String action, long durationMs) {
        PerformanceThresholds current = thresholds;

        ThresholdLimit modelLimit = current.getModelThresholds().get(model);
        if (modelLimit != null) {
            Severity severity = classify(modelLimit, durationMs);
            if (severity.isSlow()) {
                return severity;
            }
        }

        ThresholdLimit actionLimit = current.getActionThresholds().get(action);
        if (actionLimit != null) {
            Severity severity = classify(actionLimit, durationMs);
            if (severity.isSlow()) {
                return severity;
            }
        }

        return classify(current.getGlobal(), durationMs);
    }

    private static Severity classify(ThresholdLimit limit, long durationMs) {
        if (durationMs >= limit.critical()) {
            return Severity.CRITICAL;
        }
        if (durationMs >= limit.warning()) {
            return Severity.WARNING;
        }
        return Severity.NORMAL;
    }

    /**
     * All buffered metrics, oldest first.
     */
    public List<QueryMetric> getMetrics() {
        return metrics.snapshot();
    }

    public List<QueryMetric> getMetrics(int limit) {
        return metrics.latest(limit);
    }

    public List<SlowQueryLogEntry> getSlowQueries() {
        return slowQueries.snapshot();
    }

    public List<SlowQueryLogEntry> getSlowQueries(int limit) {
        return slowQueries.latest(limit);
    }

    public PerformanceStats getStats() {
        return computeStats(metrics.snapshot(), startTime, clock.instant());
    }

    public PerformanceStats getStats(TimeRange timeRange) {
        List<QueryMetric> window = metrics.snapshot().stream()
                .filter(metric -> timeRange.contains(metric.getTimestamp()))
                .collect(Collectors.toList());
        return computeStats(window, timeRange.start(), timeRange.end());
    }

    private PerformanceStats computeStats(List<QueryMetric> window, Instant start, Instant end) {
        PerformanceStats.PerformanceStatsBuilder stats = PerformanceStats.builder()
                .startTime(start)
                .endTime(end)
                .durationMs(Duration.between(start, end).toMillis())
                .failedQueries(failedQueries.get());

        if (window.isEmpty()) {
            return stats.build();
        }

        long[] durations = window.stream().mapToLong(QueryMetric::getDurationMs).sorted().toArray();
        long totalTime = 0;
        for (long duration : durations) {
            totalTime += duration;
        }

        Map<String, long[]> byModel = new LinkedHashMap<>();
        Map<String, long[]> byAction = new LinkedHashMap<>();
        long slowCount = 0;
        long cachedCount = 0;

        for (QueryMetric metric : window) {
            accumulate(byModel, metric.getModel(), metric);
            accumulate(byAction, metric.getAction(), metric);
            if (metric.isSlow()) slowCount++;
            if (metric.isCached()) cachedCount++;
        }

        List<QueryMetric> slowest = window.stream()
                .sorted(Comparator.comparingLong(QueryMetric::getDurationMs).reversed())
                .limit(SLOWEST_QUERY_COUNT)
                .collect(Collectors.toList());

        return stats
                .totalQueries(window.size())
                .slowQueries(slowCount)
                .averageExecutionTime((double) totalTime / durations.length)
                .medianExecutionTime(Percentiles.of(durations, 50))
                .p95ExecutionTime(Percentiles.of(durations, 95))
                .p99ExecutionTime(Percentiles.of(durations, 99))
                .maxExecutionTime(durations[durations.length - 1])
                .minExecutionTime(durations[0])
                .cacheHitRate((cachedCount * 100.0) / window.size())
                .byModel(toRollups(byModel))
                .byAction(toRollups(byAction))
                .slowestQueries(slowest)
                .build();
    }

    // accumulator layout: {count, totalTime, slowCount}
    private static void accumulate(Map<String, long[]> groups, String key, QueryMetric metric) {
        long[] acc = groups.computeIfAbsent(key, k -> new long[3]);
        acc[0]++;
        acc[1] += metric.getDurationMs();
        if (metric.isSlow()) acc[2]++;
    }

    private static Map<String, RollupStats> toRollups(Map<String, long[]> groups) {
        Map<String, RollupStats> rollups = new LinkedHashMap<>();
        groups.forEach((key, acc) ->
                rollups.put(key, new RollupStats(acc[0], acc[1], (double) acc[1] / acc[0], acc[2])));
        return rollups;
    }

    /**
     * For each {@code model.action} signature, finds the densest burst of calls whose
     * timestamps fit inside {@code windowMs}. Sorted by burst size, largest first.
     */
    public List<RepeatedCallPattern> detectRepeatedCalls(long windowMs) {
        Map<String, List<QueryMetric>> bySignature = new LinkedHashMap<>();
        for (QueryMetric metric : metrics.snapshot()) {
            bySignature.computeIfAbsent(metric.getSignature(), k -> new ArrayList<>()).add(metric);
        }

        List<RepeatedCallPattern> patterns = new ArrayList<>();
        bySignature.forEach((signature, calls) -> {
            calls.sort(Comparator.comparing(QueryMetric::getTimestamp));

            int bestCount = 0;
            long bestDuration = 0;
            Instant bestStart = null;
            int windowStart = 0;
            long windowDuration = 0;

            for (int end = 0; end < calls.size(); end++) {
                windowDuration += calls.get(end).getDurationMs();
                Instant limit = calls.get(end).getTimestamp().minusMillis(windowMs);
                while (calls.get(windowStart).getTimestamp().isBefore(limit)) {
                    windowDuration -= calls.get(windowStart).getDurationMs();
                    windowStart++;
                }
                int count = end - windowStart + 1;
                if (count > bestCount) {
                    bestCount = count;
                    bestDuration = windowDuration;
                    bestStart = calls.get(windowStart).getTimestamp();
                }
            }

            patterns.add(new RepeatedCallPattern(signature, bestCount, bestDuration, bestStart));
        });

        patterns.sort(Comparator.comparingInt(RepeatedCallPattern::count).reversed());
        return patterns;
    }

    public void addSlowQueryListener(SlowQueryListener listener) {
        listeners.add(listener);
    }

    public void removeSlowQueryListener(SlowQueryListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(SlowQueryLogEntry entry) {
        for (SlowQueryListener listener : listeners) {
            try {
                listener.onSlowQuery(entry);
            } catch (RuntimeException e) {
                log.warn("Slow query listener {} failed", listener, e);
            }
        }
    }

    public void updateThresholds(PerformanceThresholds thresholds) {
        thresholds.validate();
        this.thresholds = thresholds;
        log.info("Thresholds updated: {}", thresholds.getConfigurationSummary());
    }

    public PerformanceThresholds getThresholds() {
        return thresholds;
    }

    public long getTotalTracked() {
        return totalTracked.get();
    }

    public long getSlowTracked() {
        return slowTracked.get();
    }

    public long getFailedCount() {
        return failedQueries.get();
    }

    public Instant getStartTime() {
        return startTime;
    }

    public MonitorConfig getConfig() {
        return config;
    }

    /**
     * Clears both buffers and all counters and restarts the stats period.
     */
    public void reset() {
        metrics.clear();
        slowQueries.clear();
        totalTracked.set(0);
        slowTracked.set(0);
        failedQueries.set(0);
        startTime = clock.instant();
        log.info("Query monitor reset");
    }
}
