package org.carball.querymon.model.analysis;

import lombok.Builder;
import lombok.Value;
import org.carball.querymon.model.query.QueryMetric;

import java.util.Map;

@Value
@Builder
public class ModelPerformance {
    String model;
    int queryCount;
    long totalDuration;
    double avgDuration;
    QueryMetric slowestQuery;
    QueryMetric fastestQuery;
    Map<String, ActionStats> actions;

    public record ActionStats(int count, double avgDuration) {}
}
