package org.carball.querymon.model.analysis;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryPatternAnalysis {
    String pattern;
    String model;
    String action;
    int occurrences;
    long totalDuration;
    double avgDuration;
    long minDuration;
    long maxDuration;
    long p95Duration;
    double cacheHitRate;
    double errorRate;
    String recommendation;
}
