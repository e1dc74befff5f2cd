package org.carball.querymon.model.report;

import org.carball.querymon.model.query.SlowQueryLogEntry;

import java.util.Map;

/**
 * Counts over the slow query log of a single day.
 */
public record LogSummary(
        int totalSlowQueries,
        int criticalQueries,
        int warningQueries,
        SlowQueryLogEntry slowestQuery,
        Map<String, Integer> byModel,
        Map<String, Integer> byAction
) {}
