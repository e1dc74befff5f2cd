package org.carball.querymon.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.querymon.config.LoggerConfig;
import org.carball.querymon.model.query.Severity;
import org.carball.querymon.model.query.SlowQueryLogEntry;
import org.carball.querymon.model.report.LogSummary;
import org.carball.querymon.monitor.SlowQueryListener;
import org.carball.querymon.output.JsonSupport;
import org.carball.querymon.scheduling.ScheduledTask;
import org.carball.querymon.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Durable sink for slow queries. Entries are queued by {@link #log} and appended as
 * newline-delimited JSON by a background drain, so callers never wait on disk I/O.
 * <p>
 * Active file: {@code slow-queries-<YYYY-MM-DD>.ndjson} (UTC day) when daily rotation is
 * on, otherwise {@code slow-queries.ndjson}. Oversized files are archived as
 * {@code <name>-<epochMillis>.ndjson}.
 */
@Slf4j
public class SlowQueryLogger implements SlowQueryListener {

    static final String FILE_PREFIX = "slow-queries";
    static final String FILE_SUFFIX = ".ndjson";

    private static final Logger CONSOLE = LoggerFactory.getLogger("querymon.slow-queries");

    private final LoggerConfig config;
    private final Clock clock;
    private final TaskScheduler scheduler;
    private final ObjectMapper objectMapper;
    private final Path logDirectory;

    private final Deque<SlowQueryLogEntry> writeQueue = new ArrayDeque<>();
    private final ReentrantLock drainLock = new ReentrantLock();
    private volatile ScheduledTask drainTask;

    public SlowQueryLogger(LoggerConfig config, Clock clock, TaskScheduler scheduler) {
        config.validate();
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
        this.objectMapper = JsonSupport.compactMapper();
        this.logDirectory = config.getLogPath();
    }

    @Override
    public void onSlowQuery(SlowQueryLogEntry entry) {
        log(entry);
    }

    /**
     * Mirrors the entry to the console and queues it for the next drain. Performs no I/O.
     */
    public void log(SlowQueryLogEntry entry) {
        if (config.isEnableConsoleLogging()) {
            logToConsole(entry);
        }
        if (config.isEnableFileLogging()) {
            synchronized (writeQueue) {
                writeQueue.addLast(entry);
            }
        }
    }

    private void logToConsole(SlowQueryLogEntry entry) {
        Severity severity = entry.getSeverity();
        if (severity == null || !config.getConsoleLogLevel().accepts(severity)) {
            return;
        }

        String message = String.format("[SLOW QUERY] %s.%s | Time: %dms | Severity: %s | Timestamp: %s",
                entry.getModel(), entry.getAction(), entry.getDurationMs(),
                severity.name(), entry.getTimestamp());

        if (severity == Severity.CRITICAL) {
            CONSOLE.error(message);
        } else {
            CONSOLE.warn(message);
        }

        if (entry.getSql() != null) {
            CONSOLE.info("  SQL: {}", entry.getSql());
        }
        if (entry.getArgsFingerprint() != null) {
            CONSOLE.info("  Params: {}", entry.getArgsFingerprint());
        }
    }

    /**
     * Writes every queued entry now. Returns immediately when another drain is running.
     */
    public void flush() {
        if (!drainLock.tryLock()) {
            log.debug("Drain already in progress, skipping");
            return;
        }
        try {
            drainOnce();
        } finally {
            drainLock.unlock();
        }
    }

    /**
     * Waits for any running drain, then writes until the queue is empty or a write fails.
     */
    private void drainRemaining() {
        drainLock.lock();
        try {
            while (getQueueSize() > 0) {
                if (!drainOnce()) {
                    log.warn("{} slow query log entries left unwritten", getQueueSize());
                    return;
                }
            }
        } finally {
            drainLock.unlock();
        }
    }

    // Caller holds drainLock. Returns false when the batch was requeued.
    private boolean drainOnce() {
        List<SlowQueryLogEntry> batch;
        synchronized (writeQueue) {
            batch = new ArrayList<>(writeQueue);
            writeQueue.clear();
        }
        if (batch.isEmpty()) {
            return true;
        }

        try {
            Path logFile = writeBatch(batch);
            rotateIfNeeded(logFile);
            return true;
        } catch (IOException e) {
            log.error("Failed to write {} slow query log entries, requeueing", batch.size(), e);
            requeue(batch);
            return false;
        }
    }

    private Path writeBatch(List<SlowQueryLogEntry> batch) throws IOException {
        Files.createDirectories(logDirectory);

        StringBuilder lines = new StringBuilder();
        for (SlowQueryLogEntry entry : batch) {
            lines.append(objectMapper.writeValueAsString(entry)).append('\n');
        }

        Path logFile = getCurrentLogFile();
        Files.writeString(logFile, lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        log.debug("Wrote {} entries to {}", batch.size(), logFile);
        return logFile;
    }

    private void requeue(List<SlowQueryLogEntry> batch) {
        synchronized (writeQueue) {
            for (int i = batch.size() - 1; i >= 0; i--) {
                writeQueue.addFirst(batch.get(i));
            }
        }
    }

    // The batch is already on disk here, so rotation failures are logged without requeueing.
    private void rotateIfNeeded(Path logFile) {
        try {
            if (Files.size(logFile) <= config.getMaxLogSizeBytes()) {
                return;
            }

            Path archive = archivePathFor(logFile);
            Files.move(logFile, archive);
            Files.createFile(logFile);
            log.info("Rotated log file: {}", archive);

            enforceRetention(logFile);
        } catch (IOException e) {
            log.error("Failed to rotate log file {}", logFile, e);
        }
    }

    private Path archivePathFor(Path logFile) {
        String fileName = logFile.getFileName().toString();
        String baseName = fileName.substring(0, fileName.length() - FILE_SUFFIX.length());
        String stamp = baseName + "-" + clock.millis();

        Path archive = logDirectory.resolve(stamp + FILE_SUFFIX);
        int collision = 1;
        while (Files.exists(archive)) {
            archive = logDirectory.resolve(stamp + "-" + collision++ + FILE_SUFFIX);
        }
        return archive;
    }

    /**
     * Deletes the least recently modified log files until at most {@code maxLogFiles}
     * remain. The active file is never deleted.
     */
    private void enforceRetention(Path activeFile) throws IOException {
        List<Path> files = listLogFiles();
        int excess = files.size() - config.getMaxLogFiles();
        if (excess <= 0) {
            return;
        }

        Map<Path, FileTime> modified = new LinkedHashMap<>();
        for (Path file : files) {
            modified.put(file, Files.getLastModifiedTime(file));
        }
        files.sort(Comparator.<Path, FileTime>comparing(modified::get)
                .thenComparing(path -> path.getFileName().toString()));

        for (Path file : files) {
            if (excess <= 0) {
                break;
            }
            if (file.equals(activeFile)) {
                continue;
            }
            Files.deleteIfExists(file);
            excess--;
            log.info("Deleted old log file: {}", file);
        }
    }

    private List<Path> listLogFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(logDirectory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logDirectory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        return files;
    }

    public Path getCurrentLogFile() {
        if (config.isRotateDaily()) {
            return dailyLogFile(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
        }
        return logDirectory.resolve(FILE_PREFIX + FILE_SUFFIX);
    }

    private Path dailyLogFile(LocalDate date) {
        return logDirectory.resolve(FILE_PREFIX + "-" + date + FILE_SUFFIX);
    }

    /**
     * Entries in the active log file.
     */
    public List<SlowQueryLogEntry> readLogs() {
        return readFile(getCurrentLogFile());
    }

    /**
     * Entries in the daily log file for {@code date}, excluding archives.
     */
    public List<SlowQueryLogEntry> readLogs(LocalDate date) {
        return readFile(dailyLogFile(date));
    }

    private List<SlowQueryLogEntry> readFile(Path file) {
        List<SlowQueryLogEntry> entries = new ArrayList<>();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return entries;
        } catch (IOException e) {
            log.warn("Failed to read log file {}: {}", file, e.getMessage());
            return entries;
        }

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, SlowQueryLogEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed line {} in {}: {}", i + 1, file.getFileName(), e.getOriginalMessage());
            }
        }
        return entries;
    }

    /**
     * Names of all log files, active and archived, most recent first.
     */
    public List<String> getLogFiles() {
        try {
            return listLogFiles().stream()
                    .map(path -> path.getFileName().toString())
                    .sorted(Comparator.reverseOrder())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list log directory {}: {}", logDirectory, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Entries from every log file whose timestamp falls in {@code [start, end]}, newest first.
     */
    public List<SlowQueryLogEntry> getLogsInRange(Instant start, Instant end) {
        List<SlowQueryLogEntry> entries = new ArrayList<>();
        for (String fileName : getLogFiles()) {
            for (SlowQueryLogEntry entry : readFile(logDirectory.resolve(fileName))) {
                Instant timestamp = entry.getTimestamp();
                if (timestamp != null && !timestamp.isBefore(start) && !timestamp.isAfter(end)) {
                    entries.add(entry);
                }
            }
        }
        entries.sort(Comparator.comparing(SlowQueryLogEntry::getTimestamp).reversed());
        return entries;
    }

    public LogSummary getLogSummary() {
        return summarize(readLogs());
    }

    public LogSummary getLogSummary(LocalDate date) {
        return summarize(readLogs(date));
    }

    private static LogSummary summarize(List<SlowQueryLogEntry> entries) {
        Map<String, Integer> byModel = new LinkedHashMap<>();
        Map<String, Integer> byAction = new LinkedHashMap<>();
        SlowQueryLogEntry slowest = null;
        int critical = 0;
        int warning = 0;

        for (SlowQueryLogEntry entry : entries) {
            byModel.merge(entry.getModel(), 1, Integer::sum);
            byAction.merge(entry.getAction(), 1, Integer::sum);
            if (slowest == null || entry.getDurationMs() > slowest.getDurationMs()) {
                slowest = entry;
            }
            if (entry.getSeverity() == Severity.CRITICAL) {
                critical++;
            } else if (entry.getSeverity() == Severity.WARNING) {
                warning++;
            }
        }

        return new LogSummary(entries.size(), critical, warning, slowest, byModel, byAction);
    }

    /**
     * Starts the periodic drain. No-op when file logging is disabled or already started.
     */
    public synchronized void start() {
        if (!config.isEnableFileLogging() || drainTask != null) {
            return;
        }
        drainTask = scheduler.scheduleAtFixedRate("slow-query-log-drain", this::flush,
                Duration.ofMillis(config.getFlushIntervalMs()));
        log.info("Slow query logging to {} (flush every {}ms)", logDirectory, config.getFlushIntervalMs());
    }

    /**
     * Cancels the periodic drain and writes whatever is still queued, waiting for a drain
     * that is already running.
     */
    public synchronized void stop() {
        if (drainTask != null) {
            drainTask.cancel();
            drainTask = null;
        }
        drainRemaining();
    }

    public int getQueueSize() {
        synchronized (writeQueue) {
            return writeQueue.size();
        }
    }

    public LoggerConfig getConfig() {
        return config;
    }
}
