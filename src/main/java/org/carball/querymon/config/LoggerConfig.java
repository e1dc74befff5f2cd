package org.carball.querymon.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.file.Path;
import java.nio.file.Paths;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class LoggerConfig {

    @Builder.Default
    boolean enableFileLogging = true;

    @Builder.Default
    String logDirectory = Paths.get("logs", "slow-queries").toString();

    // 30 days of daily files
    @Builder.Default
    int maxLogFiles = 30;

    @Builder.Default
    long maxLogSizeBytes = 10L * 1024 * 1024;

    @Builder.Default
    boolean enableConsoleLogging = true;

    @Builder.Default
    ConsoleLogLevel consoleLogLevel = ConsoleLogLevel.CRITICAL;

    @Builder.Default
    boolean rotateDaily = true;

    @Builder.Default
    long flushIntervalMs = 10_000;

    public static LoggerConfig defaults() {
        return LoggerConfig.builder().build();
    }

    @JsonIgnore
    public Path getLogPath() {
        return Paths.get(logDirectory);
    }

    public void validate() {
        if (logDirectory == null || logDirectory.isBlank()) {
            throw new IllegalArgumentException("logDirectory must not be blank");
        }
        if (maxLogFiles <= 0) {
            throw new IllegalArgumentException("maxLogFiles must be positive, was " + maxLogFiles);
        }
        if (maxLogSizeBytes <= 0) {
            throw new IllegalArgumentException("maxLogSizeBytes must be positive, was " + maxLogSizeBytes);
        }
        if (flushIntervalMs <= 0) {
            throw new IllegalArgumentException("flushIntervalMs must be positive, was " + flushIntervalMs);
        }
        if (consoleLogLevel == null) {
            throw new IllegalArgumentException("consoleLogLevel must be one of all, warning, critical");
        }
    }
}
