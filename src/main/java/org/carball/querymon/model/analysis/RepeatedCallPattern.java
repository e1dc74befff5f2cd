package org.carball.querymon.model.analysis;

import java.time.Instant;

/**
 * Densest burst of one {@code model.action} signature inside a sliding window.
 */
public record RepeatedCallPattern(String signature, int count, long totalDuration, Instant windowStart) {}
