package org.carball.querymon.model.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A slow query as written to the durable log, one JSON object per line.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlowQueryLogEntry {
    String model;
    String action;
    String queryHash;
    long durationMs;
    Instant timestamp;
    String argsFingerprint;
    String sql;
    boolean cached;
    String error;
    Severity severity;
    String environment;

    public static SlowQueryLogEntry from(QueryMetric metric, String environment) {
        return SlowQueryLogEntry.builder()
                .model(metric.getModel())
                .action(metric.getAction())
                .queryHash(metric.getQueryHash())
                .durationMs(metric.getDurationMs())
                .timestamp(metric.getTimestamp())
                .argsFingerprint(metric.getArgsFingerprint())
                .sql(metric.getSql())
                .cached(metric.isCached())
                .error(metric.getError())
                .severity(metric.getSeverity())
                .environment(environment)
                .build();
    }

    /**
     * Converts back into a metric, for replaying historical entries.
     */
    public QueryMetric toMetric() {
        return QueryMetric.builder()
                .model(model)
                .action(action)
                .queryHash(queryHash)
                .durationMs(durationMs)
                .timestamp(timestamp)
                .argsFingerprint(argsFingerprint)
                .sql(sql)
                .cached(cached)
                .error(error)
                .severity(severity)
                .build();
    }

    @JsonIgnore
    public boolean isSlow() {
        return severity != null && severity.isSlow();
    }
}
