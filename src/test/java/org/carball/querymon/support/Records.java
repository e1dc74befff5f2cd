package org.carball.querymon.support;

import org.carball.querymon.model.query.ExecutionRecord;
import org.carball.querymon.model.query.QueryClause;
import org.carball.querymon.model.query.Severity;
import org.carball.querymon.model.query.SlowQueryLogEntry;

import java.time.Instant;

/**
 * Builders for synthetic records used across tests.
 */
public final class Records {

    private Records() {
    }

    public static ExecutionRecord call(String model, String action, long durationMs, Instant timestamp) {
        return ExecutionRecord.builder()
                .model(model)
                .action(action)
                .argsFingerprint("{}")
                .clause(QueryClause.WHERE)
                .durationMs(durationMs)
                .timestamp(timestamp)
                .build();
    }

    public static SlowQueryLogEntry slowEntry(String model, String action, long durationMs,
                                              Severity severity, Instant timestamp) {
        return SlowQueryLogEntry.builder()
                .model(model)
                .action(action)
                .queryHash(model + "." + action + "{where}")
                .durationMs(durationMs)
                .timestamp(timestamp)
                .argsFingerprint("{\"where\":{\"id\":1}}")
                .severity(severity)
                .environment("test")
                .build();
    }
}
