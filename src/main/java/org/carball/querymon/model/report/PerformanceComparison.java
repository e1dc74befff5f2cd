package org.carball.querymon.model.report;

public record PerformanceComparison(
        String metric,
        double current,
        double previous,
        double change,
        double changePercentage,
        Trend trend
) {}
