package org.carball.querymon.model.analysis;

public record IssueImpact(long queryCount, long totalDuration, double avgDuration) {

    public static IssueImpact of(long queryCount, long totalDuration) {
        return new IssueImpact(queryCount, totalDuration,
                queryCount == 0 ? 0.0 : (double) totalDuration / queryCount);
    }
}
