package org.carball.querymon.model.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * An execution record enriched with its structural hash and severity.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryMetric {
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

    public static QueryMetric from(ExecutionRecord record, String queryHash, Severity severity) {
        return QueryMetric.builder()
                .model(record.getModel())
                .action(record.getAction())
                .queryHash(queryHash)
                .durationMs(record.getDurationMs())
                .timestamp(record.getTimestamp())
                .argsFingerprint(record.getArgsFingerprint())
                .sql(record.getSql())
                .cached(record.isCached())
                .error(record.getError())
                .severity(severity)
                .build();
    }

    public boolean isSlow() {
        return severity.isSlow();
    }

    @JsonIgnore
    public String getSignature() {
        return model + "." + action;
    }
}
