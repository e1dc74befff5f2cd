package org.carball.querymon.model.stats;

/**
 * Per-model or per-action aggregate inside a stats snapshot.
 */
public record RollupStats(long count, long totalTime, double averageTime, long slowCount) {}
