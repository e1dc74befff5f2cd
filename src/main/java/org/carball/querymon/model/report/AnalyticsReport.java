package org.carball.querymon.model.report;

import lombok.Builder;
import lombok.Value;
import org.carball.querymon.model.query.QueryMetric;
import org.carball.querymon.model.stats.PerformanceStats;
import org.carball.querymon.model.stats.TimeRange;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AnalyticsReport {
    Instant timestamp;
    TimeRange timeRange;
    PerformanceStats summary;

    List<QueryPattern> topPatterns;
    List<QueryPattern> problematicPatterns;
    List<OptimizationRecommendation> recommendations;
    List<PerformanceComparison> comparisons;

    Trends trends;
    Highlights highlights;

    public record Trends(
            PerformanceComparison queryCount,
            PerformanceComparison averageTime,
            PerformanceComparison slowQueryRate
    ) {}

    public record Highlights(
            List<QueryMetric> fastestQueries,
            List<QueryMetric> slowestQueries,
            List<QueryPattern> mostFrequentQueries,
            List<QueryPattern> recentImprovements,
            List<QueryPattern> recentRegressions
    ) {}
}
