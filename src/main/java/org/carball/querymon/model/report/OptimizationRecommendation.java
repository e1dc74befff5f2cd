package org.carball.querymon.model.report;

import lombok.Builder;
import lombok.Value;
import org.carball.querymon.model.analysis.IssueSeverity;
import org.carball.querymon.model.query.QueryMetric;

import java.util.List;

@Value
@Builder
public class OptimizationRecommendation {
    IssueSeverity severity;
    String model;
    String action;
    String issue;
    String recommendation;
    String estimatedImpact;
    List<QueryMetric> examples;
}
