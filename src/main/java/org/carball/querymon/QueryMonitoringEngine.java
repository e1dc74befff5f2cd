package org.carball.querymon;

import lombok.extern.slf4j.Slf4j;
import org.carball.querymon.analytics.QueryAnalytics;
import org.carball.querymon.analyzer.PerformanceAnalyzer;
import org.carball.querymon.config.MonitoringSettings;
import org.carball.querymon.instrument.QueryInstrumentation;
import org.carball.querymon.logging.SlowQueryLogger;
import org.carball.querymon.model.analysis.PerformanceIssue;
import org.carball.querymon.model.report.AnalyticsReport;
import org.carball.querymon.model.report.LogSummary;
import org.carball.querymon.model.stats.PerformanceStats;
import org.carball.querymon.model.stats.TimeRange;
import org.carball.querymon.monitor.QueryMonitor;
import org.carball.querymon.scheduling.ExecutorTaskScheduler;
import org.carball.querymon.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.List;

/**
 * Wires the monitor, its consumers and the instrumentation hook from one set of settings.
 * One engine per process is assumed: two engines writing to the same log directory would
 * interleave rotations.
 */
@Slf4j
public class QueryMonitoringEngine implements AutoCloseable {

    private final MonitoringSettings settings;
    private final TaskScheduler scheduler;
    private final boolean ownsScheduler;

    private final QueryMonitor monitor;
    private final SlowQueryLogger slowQueryLogger;
    private final PerformanceAnalyzer analyzer;
    private final QueryAnalytics analytics;
    private final QueryInstrumentation instrumentation;

    private boolean started;

    public QueryMonitoringEngine(MonitoringSettings settings) {
        this(settings, Clock.systemUTC(), new ExecutorTaskScheduler(), true);
    }

    public QueryMonitoringEngine(MonitoringSettings settings, Clock clock, TaskScheduler scheduler) {
        this(settings, clock, scheduler, false);
    }

    private QueryMonitoringEngine(MonitoringSettings settings, Clock clock, TaskScheduler scheduler,
                                  boolean ownsScheduler) {
        settings.validate();
        this.settings = settings;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;

        this.monitor = new QueryMonitor(settings.getThresholds(), settings.getMonitor(), clock);
        this.slowQueryLogger = new SlowQueryLogger(settings.getLogger(), clock, scheduler);
        this.analyzer = new PerformanceAnalyzer(monitor, settings.getAnalyzer(), clock, scheduler);
        this.analytics = new QueryAnalytics(monitor, slowQueryLogger, clock);
        this.instrumentation = new QueryInstrumentation(monitor, clock);

        monitor.addSlowQueryListener(slowQueryLogger);
        log.info("Initialized query monitoring: {}", settings.getConfigurationSummary());
    }

    /**
     * Starts the log drain and, when auto detection is on, periodic analysis.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        slowQueryLogger.start();
        if (settings.getAnalyzer().isAutoDetect()) {
            analyzer.startAutoAnalysis();
        }
        started = true;
    }

    /**
     * Stops both timers and writes any queued slow queries.
     */
    @Override
    public synchronized void close() {
        analyzer.stopAutoAnalysis();
        slowQueryLogger.stop();
        if (ownsScheduler) {
            scheduler.close();
        }
        started = false;
        log.info("Query monitoring stopped");
    }

    public PerformanceStats getStats() {
        return monitor.getStats();
    }

    public PerformanceStats getStats(TimeRange timeRange) {
        return monitor.getStats(timeRange);
    }

    public List<PerformanceIssue> getIssues() {
        return analyzer.getIssues();
    }

    public AnalyticsReport generateReport() {
        return analytics.generateReport();
    }

    public AnalyticsReport generateReport(TimeRange timeRange) {
        return analytics.generateReport(timeRange);
    }

    public LogSummary getLogSummary() {
        return slowQueryLogger.getLogSummary();
    }

    public QueryInstrumentation getInstrumentation() {
        return instrumentation;
    }

    public QueryMonitor getMonitor() {
        return monitor;
    }

    public SlowQueryLogger getSlowQueryLogger() {
        return slowQueryLogger;
    }

    public PerformanceAnalyzer getAnalyzer() {
        return analyzer;
    }

    public QueryAnalytics getAnalytics() {
        return analytics;
    }

    public MonitoringSettings getSettings() {
        return settings;
    }
}
