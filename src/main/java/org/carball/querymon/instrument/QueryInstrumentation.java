package org.carball.querymon.instrument;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.querymon.model.query.ExecutionRecord;
import org.carball.querymon.model.query.QueryClause;
import org.carball.querymon.monitor.QueryMonitor;
import org.carball.querymon.output.JsonSupport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Wraps database calls: times each one, builds an {@link ExecutionRecord} with redacted
 * arguments and hands it to the monitor. Recording is best effort; only the call's own
 * exception ever reaches the caller.
 */
@Slf4j
public class QueryInstrumentation {

    static final String UNKNOWN_MODEL = "Unknown";

    private final QueryMonitor monitor;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public QueryInstrumentation(QueryMonitor monitor, Clock clock) {
        this.monitor = monitor;
        this.clock = clock;
        this.objectMapper = JsonSupport.compactMapper();
    }

    /**
     * Runs {@code call} and records it. A failure of the call is recorded with its
     * message and then rethrown unchanged.
     */
    public <T, E extends Exception> T intercept(QueryInvocation invocation, QueryCall<T, E> call) throws E {
        Instant started = clock.instant();
        T result;
        try {
            result = call.proceed();
        } catch (Exception e) {
            long durationMs = elapsedSince(started);
            log.warn("Query failed: {}.{} after {}ms: {}",
                    invocation.getModel(), invocation.getAction(), durationMs, describe(e));
            record(invocation, started, durationMs, describe(e));
            throw e;
        }
        record(invocation, started, elapsedSince(started), null);
        return result;
    }

    private long elapsedSince(Instant started) {
        return Math.max(0, Duration.between(started, clock.instant()).toMillis());
    }

    private void record(QueryInvocation invocation, Instant started, long durationMs, String error) {
        try {
            ExecutionRecord record = ExecutionRecord.builder()
                    .model(invocation.getModel() != null ? invocation.getModel() : UNKNOWN_MODEL)
                    .action(invocation.getAction())
                    .argsFingerprint(fingerprint(invocation.getArgs()))
                    .sql(invocation.getSql())
                    .clauses(clausesOf(invocation.getArgs()))
                    .durationMs(durationMs)
                    .timestamp(started)
                    .cached(invocation.isCached())
                    .error(error)
                    .build();
            monitor.track(record);
        } catch (RuntimeException e) {
            log.warn("Failed to record query {}.{}", invocation.getModel(), invocation.getAction(), e);
        }
    }

    private String fingerprint(Map<String, Object> args) {
        try {
            return objectMapper.writeValueAsString(ArgumentSanitizer.sanitize(args));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize query arguments: {}", e.getOriginalMessage());
            return null;
        }
    }

    static Set<QueryClause> clausesOf(Map<String, Object> args) {
        Set<QueryClause> clauses = EnumSet.noneOf(QueryClause.class);
        for (QueryClause clause : QueryClause.values()) {
            if (args.get(clause.getArgumentKey()) != null) {
                clauses.add(clause);
            }
        }
        return clauses;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
