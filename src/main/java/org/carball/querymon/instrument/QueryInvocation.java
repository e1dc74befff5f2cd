package org.carball.querymon.instrument;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * What the database client hook knows about a call before it runs.
 */
@Value
@Builder
public class QueryInvocation {
    String model;
    String action;
    @Singular
    Map<String, Object> args;
    boolean cached;
    String sql;
}
