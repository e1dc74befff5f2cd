package org.carball.querymon.model.report;

import lombok.Builder;
import lombok.Value;

/**
 * Metrics aggregated by structural signature.
 */
@Value
@Builder
public class QueryPattern {
    String queryHash;
    String model;
    String action;
    int occurrences;
    double averageExecutionTime;
    long minExecutionTime;
    long maxExecutionTime;
    long p95ExecutionTime;
    double slowQueryRate;
    Trend trend;
}
