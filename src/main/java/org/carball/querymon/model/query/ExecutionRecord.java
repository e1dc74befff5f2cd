package org.carball.querymon.model.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * One observed database call, as captured by the instrumentation layer.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionRecord {
    String model;
    String action;
    String argsFingerprint;
    String sql;
    @Singular
    Set<QueryClause> clauses;
    long durationMs;
    Instant timestamp;
    boolean cached;
    String error;

    public boolean isFailed() {
        return error != null;
    }

    public String getSignature() {
        return model + "." + action;
    }
}
