package org.carball.querymon.model.stats;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.querymon.model.query.QueryMetric;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time statistics over a window of metrics. Derived on demand, never stored.
 */
@Value
@Builder
public class PerformanceStats {
    Instant startTime;
    Instant endTime;
    long durationMs;

    long totalQueries;
    long slowQueries;
    long failedQueries;

    double averageExecutionTime;
    long medianExecutionTime;
    long p95ExecutionTime;
    long p99ExecutionTime;
    long maxExecutionTime;
    long minExecutionTime;

    double cacheHitRate;

    @Singular("model")
    Map<String, RollupStats> byModel;
    @Singular("action")
    Map<String, RollupStats> byAction;
    @Singular
    List<QueryMetric> slowestQueries;

    public double getSlowQueryRate() {
        return totalQueries == 0 ? 0.0 : (slowQueries * 100.0) / totalQueries;
    }
}
