package org.carball.querymon.model.analysis;

import lombok.Builder;
import lombok.Value;
import org.carball.querymon.model.query.QueryMetric;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class PerformanceIssue {
    String id;
    IssueType type;
    IssueSeverity severity;
    String title;
    String description;
    List<QueryMetric> affectedRecords;
    IssueImpact impact;
    List<String> recommendations;
    Instant detectedAt;
}
