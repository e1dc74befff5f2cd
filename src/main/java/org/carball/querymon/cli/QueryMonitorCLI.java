package org.carball.querymon.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.querymon.analytics.QueryAnalytics;
import org.carball.querymon.analyzer.PerformanceAnalyzer;
import org.carball.querymon.config.ConfigurationLoader;
import org.carball.querymon.config.LoggerConfig;
import org.carball.querymon.config.MonitorConfig;
import org.carball.querymon.config.MonitoringSettings;
import org.carball.querymon.config.OutputFormat;
import org.carball.querymon.config.ThresholdProfile;
import org.carball.querymon.logging.SlowQueryLogger;
import org.carball.querymon.model.analysis.PerformanceIssue;
import org.carball.querymon.model.query.ExecutionRecord;
import org.carball.querymon.model.query.SlowQueryLogEntry;
import org.carball.querymon.model.report.AnalyticsReport;
import org.carball.querymon.model.report.LogSummary;
import org.carball.querymon.model.report.SlowQueryInsights;
import org.carball.querymon.model.stats.TimeRange;
import org.carball.querymon.monitor.QueryMonitor;
import org.carball.querymon.monitor.QuerySignatures;
import org.carball.querymon.output.PerformanceReport;
import org.carball.querymon.scheduling.ExecutorTaskScheduler;
import org.carball.querymon.scheduling.TaskScheduler;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Offline tool over a slow query log directory: list files, summarize a day, show
 * multi-day insights, or replay history through the analyzer and write a report.
 */
@Slf4j
public class QueryMonitorCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║              Query Performance Monitor v%s                 ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private static final List<String> COMMANDS = List.of("files", "summary", "insights", "replay");
    private static final String DEFAULT_OUTPUT = "query-report.json";

    private final ConfigurationLoader configurationLoader;
    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;

    public QueryMonitorCLI(ConfigurationLoader configurationLoader, Clock clock, PrintStream out, PrintStream err) {
        this.configurationLoader = configurationLoader;
        this.clock = clock;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        QueryMonitorCLI cli = new QueryMonitorCLI(new ConfigurationLoader(), Clock.systemUTC(), System.out, System.err);
        System.exit(cli.run(args));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        out.printf(BANNER + "%n", VERSION);

        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            return args.length == 0 ? 1 : 0;
        }

        try {
            CliOptions options = parseArgs(args);
            MonitoringSettings settings = loadSettings(options, args);

            try (TaskScheduler scheduler = new ExecutorTaskScheduler()) {
                SlowQueryLogger logReader = new SlowQueryLogger(readerConfig(settings.getLogger()), clock, scheduler);

                switch (options.command) {
                    case "files":
                        listFiles(logReader);
                        break;
                    case "summary":
                        printLogSummary(options.date == null
                                ? logReader.getLogSummary()
                                : logReader.getLogSummary(options.date));
                        break;
                    case "insights":
                        QueryAnalytics analytics = new QueryAnalytics(
                                new QueryMonitor(settings.getThresholds(), settings.getMonitor(), clock), logReader, clock);
                        printInsights(analytics.getSlowQueryInsights(options.days));
                        break;
                    default:
                        replay(options, settings, logReader, scheduler);
                }
            }
            return 0;

        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("\nUsage: java -jar query-monitor.jar <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  files               List slow query log files, most recent first");
        out.println("  summary             Summarize one day of the slow query log");
        out.println("  insights            Slow query counts per day, model and action");
        out.println("  replay              Replay logged slow queries through the analyzer and write a report");
        out.println();
        out.println("Options:");
        out.println("  --log-dir           Slow query log directory (default: logs/slow-queries)");
        out.println("  --date              Day to summarize, YYYY-MM-DD (default: today, UTC)");
        out.println("  --days              Days of history for insights and replay (default: 7)");
        out.println("  --config            YAML settings file");
        out.println("  --profile           Threshold profile: " + ThresholdProfile.getAvailableProfiles());
        out.println("  --output, -o        Report file for replay (default: " + DEFAULT_OUTPUT + ")");
        out.println("  --format, -f        Report format: json|markdown|both (default: json)");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println(ThresholdProfile.getProfileHelp());
        out.println("Examples:");
        out.println("  java -jar query-monitor.jar summary --date 2024-05-01");
        out.println("  java -jar query-monitor.jar replay --days 3 --format both -o reports/weekly");
    }

    private CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.command = args[0];
        if (!COMMANDS.contains(options.command)) {
            throw new IllegalArgumentException("Unknown command: " + options.command
                    + ". Use one of: " + String.join(", ", COMMANDS));
        }

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--log-dir":
                    options.logDirectory = requireValue(args, ++i, "Log directory not specified");
                    break;

                case "--date":
                    String date = requireValue(args, ++i, "Date not specified");
                    try {
                        options.date = LocalDate.parse(date);
                    } catch (DateTimeParseException e) {
                        throw new IllegalArgumentException("Invalid date: " + date + ". Use YYYY-MM-DD");
                    }
                    break;

                case "--days":
                    String days = requireValue(args, ++i, "Number of days not specified");
                    try {
                        options.days = Integer.parseInt(days);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid number of days: " + days);
                    }
                    if (options.days <= 0) {
                        throw new IllegalArgumentException("Number of days must be positive");
                    }
                    break;

                case "--config":
                    options.configFile = Paths.get(requireValue(args, ++i, "Settings file not specified"));
                    break;

                case "--profile":
                    options.profile = requireValue(args, ++i, "Threshold profile not specified");
                    break;

                case "--output":
                case "-o":
                    options.outputFile = requireValue(args, ++i, "Output file not specified");
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        options.format = OutputFormat.valueOf(format.toUpperCase());
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                default:
                    if (isSettingsOverride(arg)) {
                        // applied by the configuration loader
                        requireValue(args, ++i, "Value not specified for " + arg);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return options;
    }

    private static boolean isSettingsOverride(String arg) {
        return arg.startsWith("--thresholds.") || arg.startsWith("--monitor.")
                || arg.startsWith("--logger.") || arg.startsWith("--analyzer.");
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private MonitoringSettings loadSettings(CliOptions options, String[] args) throws IOException {
        MonitoringSettings settings;
        if (options.configFile != null) {
            settings = configurationLoader.loadConfiguration(options.configFile, args);
        } else if (options.profile != null) {
            settings = configurationLoader.loadConfigurationWithProfile(options.profile, args);
        } else {
            settings = configurationLoader.loadConfiguration(args);
        }

        if (options.logDirectory != null) {
            settings = settings.toBuilder()
                    .logger(settings.getLogger().toBuilder().logDirectory(options.logDirectory).build())
                    .build();
        }
        return settings;
    }

    // Reading history must not echo every entry back to the console.
    private static LoggerConfig readerConfig(LoggerConfig config) {
        return config.toBuilder().enableConsoleLogging(false).build();
    }

    private void listFiles(SlowQueryLogger logReader) {
        List<String> files = logReader.getLogFiles();
        if (files.isEmpty()) {
            out.println("No slow query log files found in " + logReader.getConfig().getLogDirectory());
            return;
        }
        out.println("📁 " + files.size() + " log file(s) in " + logReader.getConfig().getLogDirectory() + ":");
        files.forEach(file -> out.println("   " + file));
    }

    private void printLogSummary(LogSummary summary) {
        out.println("\n" + "=".repeat(60));
        out.println("📊 SLOW QUERY LOG SUMMARY");
        out.println("=".repeat(60));

        out.println("\nSlow queries: " + summary.totalSlowQueries());
        out.println("  🔴 Critical: " + summary.criticalQueries());
        out.println("  🟡 Warning: " + summary.warningQueries());

        SlowQueryLogEntry slowest = summary.slowestQuery();
        if (slowest != null) {
            out.printf("%nSlowest: %s.%s (%dms at %s)%n",
                    slowest.getModel(), slowest.getAction(), slowest.getDurationMs(), slowest.getTimestamp());
        }

        printCounts("By model", summary.byModel());
        printCounts("By action", summary.byAction());
    }

    private void printCounts(String title, Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            return;
        }
        out.println("\n" + title + ":");
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> out.printf("  %-20s %d%n", entry.getKey(), entry.getValue()));
    }

    private void printInsights(SlowQueryInsights insights) {
        out.println("\n" + "=".repeat(60));
        out.println("📈 SLOW QUERY INSIGHTS (last " + insights.days() + " days)");
        out.println("=".repeat(60));

        out.println("\nTotal slow queries: " + insights.totalSlowQueries());

        if (!insights.dailyBreakdown().isEmpty()) {
            out.println("\nDaily breakdown:");
            insights.dailyBreakdown().forEach(day -> out.printf("  %s  %d%n", day.date(), day.count()));
        }
        if (!insights.topSlowModels().isEmpty()) {
            out.println("\nTop slow models:");
            insights.topSlowModels().forEach(group ->
                    out.printf("  %-20s %5d  avg %.1fms%n", group.name(), group.count(), group.avgTime()));
        }
        if (!insights.topSlowActions().isEmpty()) {
            out.println("\nTop slow actions:");
            insights.topSlowActions().forEach(group ->
                    out.printf("  %-20s %5d  avg %.1fms%n", group.name(), group.count(), group.avgTime()));
        }
    }

    private void replay(CliOptions options, MonitoringSettings settings, SlowQueryLogger logReader,
                        TaskScheduler scheduler) throws IOException {
        TimeRange window = TimeRange.endingAt(clock.instant(), Duration.ofDays(options.days));

        out.print("📥 Reading slow query log... ");
        List<SlowQueryLogEntry> entries = logReader.getLogsInRange(window.start(), window.end());
        out.println("✓ (" + entries.size() + " entries)");

        // large enough to hold the whole replayed history
        int capacity = Math.max(settings.getMonitor().getMaxMetrics(), entries.size());
        MonitorConfig monitorConfig = settings.getMonitor().toBuilder()
                .maxMetrics(capacity)
                .maxSlowQueries(Math.max(settings.getMonitor().getMaxSlowQueries(), entries.size()))
                .build();
        QueryMonitor monitor = new QueryMonitor(settings.getThresholds(), monitorConfig, clock);

        out.print("🔁 Replaying through the analyzer... ");
        entries.stream()
                .sorted(Comparator.comparing(SlowQueryLogEntry::getTimestamp))
                .map(QueryMonitorCLI::toRecord)
                .forEach(monitor::track);

        PerformanceAnalyzer analyzer = new PerformanceAnalyzer(monitor, settings.getAnalyzer(), clock, scheduler);
        List<PerformanceIssue> issues = analyzer.runAnalysis();
        QueryAnalytics analytics = new QueryAnalytics(monitor, logReader, clock);
        AnalyticsReport report = analytics.generateReport(window);
        SlowQueryInsights insights = analytics.getSlowQueryInsights(options.days);
        out.println("✓");

        out.print("📝 Writing report... ");
        List<String> written = writeReport(
                new PerformanceReport(report, issues, analyzer.analyzeModelPerformance(), insights), options);
        out.println("✓");

        out.println("\n✅ Replay complete!");
        out.println("   Entries replayed: " + entries.size());
        out.println("   Issues detected: " + issues.size());
        out.println("   Recommendations: " + report.getRecommendations().size());
        out.println("   Output file(s):");
        written.forEach(file -> out.println("     - " + file));
    }

    static ExecutionRecord toRecord(SlowQueryLogEntry entry) {
        return ExecutionRecord.builder()
                .model(entry.getModel())
                .action(entry.getAction())
                .argsFingerprint(entry.getArgsFingerprint())
                .sql(entry.getSql())
                .clauses(QuerySignatures.clausesOf(entry.getQueryHash()))
                .durationMs(entry.getDurationMs())
                .timestamp(entry.getTimestamp())
                .cached(entry.isCached())
                .error(entry.getError())
                .build();
    }

    private List<String> writeReport(PerformanceReport report, CliOptions options) throws IOException {
        String baseFileName = removeFileExtension(options.outputFile);
        List<String> written = new ArrayList<>();

        if (options.format == OutputFormat.JSON || options.format == OutputFormat.BOTH) {
            String jsonFile = baseFileName + ".json";
            writeFile(Paths.get(jsonFile), report.toJson());
            written.add(jsonFile);
        }
        if (options.format == OutputFormat.MARKDOWN || options.format == OutputFormat.BOTH) {
            String markdownFile = baseFileName + ".md";
            writeFile(Paths.get(markdownFile), report.toMarkdown());
            written.add(markdownFile);
        }
        return written;
    }

    private static void writeFile(Path file, String content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            throw new IllegalArgumentException("Output directory does not exist: " + parent);
        }
        Files.writeString(file, content);
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static final class CliOptions {
        private String command;
        private String logDirectory;
        private LocalDate date;
        private int days = 7;
        private Path configFile;
        private String profile;
        private String outputFile = DEFAULT_OUTPUT;
        private OutputFormat format = OutputFormat.JSON;
    }
}
