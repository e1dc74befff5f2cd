package org.carball.querymon.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.querymon.model.analysis.IssueSeverity;
import org.carball.querymon.model.analysis.ModelPerformance;
import org.carball.querymon.model.analysis.PerformanceIssue;
import org.carball.querymon.model.query.QueryMetric;
import org.carball.querymon.model.report.AnalyticsReport;
import org.carball.querymon.model.report.OptimizationRecommendation;
import org.carball.querymon.model.report.PerformanceComparison;
import org.carball.querymon.model.report.QueryPattern;
import org.carball.querymon.model.report.SlowQueryInsights;
import org.carball.querymon.model.stats.PerformanceStats;
import org.carball.querymon.model.stats.RollupStats;

import java.util.List;
import java.util.Map;

/**
 * Renders an analytics report, the detected issues and optional log insights as JSON or
 * Markdown.
 */
@Slf4j
public class PerformanceReport {

    private final AnalyticsReport report;
    private final List<PerformanceIssue> issues;
    private final List<ModelPerformance> modelPerformance;
    private final SlowQueryInsights insights;
    private final ObjectMapper objectMapper;

    public PerformanceReport(AnalyticsReport report, List<PerformanceIssue> issues) {
        this(report, issues, List.of(), null);
    }

    public PerformanceReport(AnalyticsReport report, List<PerformanceIssue> issues,
                             List<ModelPerformance> modelPerformance, SlowQueryInsights insights) {
        this.report = report;
        this.issues = issues;
        this.modelPerformance = modelPerformance;
        this.insights = insights;
        this.objectMapper = JsonSupport.reportMapper();
    }

    public String toJson() {
        try {
            ReportData data = new ReportData();
            data.setReport(report);
            data.setIssues(issues);
            data.setModelPerformance(modelPerformance);
            data.setInsights(insights);
            return objectMapper.writeValueAsString(data);
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        PerformanceStats summary = report.getSummary();

        md.append("# Query Performance Report\n\n");
        md.append("**Generated:** ").append(report.getTimestamp()).append("  \n");
        md.append("**Window:** ").append(report.getTimeRange().start())
                .append(" to ").append(report.getTimeRange().end()).append("  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Total Queries | ").append(summary.getTotalQueries()).append(" |\n");
        md.append("| Slow Queries | ").append(summary.getSlowQueries())
                .append(String.format(" (%.1f%%)", summary.getSlowQueryRate())).append(" |\n");
        md.append("| Failed Queries | ").append(summary.getFailedQueries()).append(" |\n");
        md.append("| Average | ").append(String.format("%.1fms", summary.getAverageExecutionTime())).append(" |\n");
        md.append("| Median | ").append(summary.getMedianExecutionTime()).append("ms |\n");
        md.append("| P95 | ").append(summary.getP95ExecutionTime()).append("ms |\n");
        md.append("| P99 | ").append(summary.getP99ExecutionTime()).append("ms |\n");
        md.append("| Max | ").append(summary.getMaxExecutionTime()).append("ms |\n");
        md.append("| Cache Hit Rate | ").append(String.format("%.1f%%", summary.getCacheHitRate())).append(" |\n\n");

        // Trends
        md.append("## Trends\n\n");
        md.append("| Metric | Current | Previous | Change | Trend |\n");
        md.append("|--------|---------|----------|--------|-------|\n");
        AnalyticsReport.Trends trends = report.getTrends();
        appendComparison(md, trends.queryCount());
        appendComparison(md, trends.averageTime());
        appendComparison(md, trends.slowQueryRate());
        md.append("\n");

        // Issues
        md.append("## Detected Issues\n\n");
        if (issues.isEmpty()) {
            md.append("**No performance issues detected.**\n\n");
        }
        for (PerformanceIssue issue : issues) {
            md.append("### ").append(severityBadge(issue.getSeverity())).append(" ").append(issue.getTitle()).append("\n\n");
            md.append(issue.getDescription()).append("\n\n");
            md.append("- **Queries:** ").append(issue.getImpact().queryCount()).append("\n");
            md.append("- **Total Duration:** ").append(issue.getImpact().totalDuration()).append("ms\n");
            md.append("- **Average Duration:** ")
                    .append(String.format("%.1fms", issue.getImpact().avgDuration())).append("\n\n");
            md.append("**Recommendations:**\n");
            issue.getRecommendations().forEach(hint -> md.append("- ").append(hint).append("\n"));
            md.append("\n");
        }

        // Patterns
        md.append("## Top Query Patterns\n\n");
        appendPatternTable(md, report.getTopPatterns());

        if (!report.getProblematicPatterns().isEmpty()) {
            md.append("## Problematic Patterns\n\n");
            appendPatternTable(md, report.getProblematicPatterns());
        }

        // Recommendations
        md.append("## Optimization Recommendations\n\n");
        if (report.getRecommendations().isEmpty()) {
            md.append("**No optimization recommendations.**\n\n");
        }
        int recNum = 1;
        for (OptimizationRecommendation rec : report.getRecommendations()) {
            md.append("### ").append(recNum++).append(". ").append(rec.getModel()).append(".").append(rec.getAction())
                    .append(" (").append(rec.getSeverity().getDisplayName()).append(")\n\n");
            md.append("- **Issue:** ").append(rec.getIssue()).append("\n");
            md.append("- **Estimated Impact:** ").append(rec.getEstimatedImpact()).append("\n\n");
            for (String hint : rec.getRecommendation().split("; ")) {
                md.append("  - ").append(hint).append("\n");
            }
            md.append("\n");
        }

        // By model
        if (!summary.getByModel().isEmpty()) {
            md.append("## By Model\n\n");
            md.append("| Model | Count | Average | Slow |\n");
            md.append("|-------|-------|---------|------|\n");
            for (Map.Entry<String, RollupStats> entry : summary.getByModel().entrySet()) {
                RollupStats rollup = entry.getValue();
                md.append("| ").append(entry.getKey())
                        .append(" | ").append(rollup.count())
                        .append(" | ").append(String.format("%.1fms", rollup.averageTime()))
                        .append(" | ").append(rollup.slowCount()).append(" |\n");
            }
            md.append("\n");
        }

        if (!modelPerformance.isEmpty()) {
            md.append("## Model Load\n\n");
            md.append("| Model | Queries | Total | Slowest |\n");
            md.append("|-------|---------|-------|---------|\n");
            for (ModelPerformance performance : modelPerformance) {
                QueryMetric slowest = performance.getSlowestQuery();
                md.append("| ").append(performance.getModel())
                        .append(" | ").append(performance.getQueryCount())
                        .append(" | ").append(performance.getTotalDuration()).append("ms")
                        .append(" | ").append(slowest == null ? "-" : slowest.getAction() + " " + slowest.getDurationMs() + "ms")
                        .append(" |\n");
            }
            md.append("\n");
        }

        // Log insights
        if (insights != null) {
            md.append("## Slow Query Log (last ").append(insights.days()).append(" days)\n\n");
            md.append("**Total slow queries:** ").append(insights.totalSlowQueries()).append("\n\n");
            if (!insights.dailyBreakdown().isEmpty()) {
                md.append("| Date | Count |\n");
                md.append("|------|-------|\n");
                insights.dailyBreakdown().forEach(day ->
                        md.append("| ").append(day.date()).append(" | ").append(day.count()).append(" |\n"));
                md.append("\n");
            }
            if (!insights.topSlowModels().isEmpty()) {
                md.append("| Model | Count | Average |\n");
                md.append("|-------|-------|---------|\n");
                insights.topSlowModels().forEach(group ->
                        md.append("| ").append(group.name()).append(" | ").append(group.count())
                                .append(" | ").append(String.format("%.1fms", group.avgTime())).append(" |\n"));
                md.append("\n");
            }
        }

        md.append("---\n\n");
        md.append("*Generated by Query Monitor*\n");

        return md.toString();
    }

    private static void appendComparison(StringBuilder md, PerformanceComparison comparison) {
        md.append("| ").append(comparison.metric())
                .append(" | ").append(String.format("%.1f", comparison.current()))
                .append(" | ").append(String.format("%.1f", comparison.previous()))
                .append(" | ").append(String.format("%+.1f%%", comparison.changePercentage()))
                .append(" | ").append(comparison.trend().name().toLowerCase())
                .append(" |\n");
    }

    private static void appendPatternTable(StringBuilder md, List<QueryPattern> patterns) {
        if (patterns.isEmpty()) {
            md.append("*No queries recorded in this window.*\n\n");
            return;
        }
        md.append("| Signature | Count | Average | P95 | Slow Rate | Trend |\n");
        md.append("|-----------|-------|---------|-----|-----------|-------|\n");
        for (QueryPattern pattern : patterns) {
            md.append("| `").append(pattern.getQueryHash()).append("`")
                    .append(" | ").append(pattern.getOccurrences())
                    .append(" | ").append(String.format("%.1fms", pattern.getAverageExecutionTime()))
                    .append(" | ").append(pattern.getP95ExecutionTime()).append("ms")
                    .append(" | ").append(String.format("%.1f%%", pattern.getSlowQueryRate()))
                    .append(" | ").append(pattern.getTrend().name().toLowerCase())
                    .append(" |\n");
        }
        md.append("\n");
    }

    private static String severityBadge(IssueSeverity severity) {
        switch (severity) {
            case CRITICAL:
                return "🔴 **Critical**";
            case HIGH:
                return "🟠 **High**";
            case MEDIUM:
                return "🟡 **Medium**";
            default:
                return "🟢 **Low**";
        }
    }

    // Inner class for JSON structure
    @lombok.Data
    private static class ReportData {
        private AnalyticsReport report;
        private List<PerformanceIssue> issues;
        private List<ModelPerformance> modelPerformance;
        private SlowQueryInsights insights;
    }
}
