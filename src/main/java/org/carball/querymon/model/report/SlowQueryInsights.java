package org.carball.querymon.model.report;

import java.util.List;

/**
 * Slow query trends read back from the durable log.
 */
public record SlowQueryInsights(
        int days,
        int totalSlowQueries,
        List<DailyCount> dailyBreakdown,
        List<SlowGroup> topSlowModels,
        List<SlowGroup> topSlowActions
) {

    public record DailyCount(String date, int count) {}

    public record SlowGroup(String name, int count, double avgTime) {}
}
