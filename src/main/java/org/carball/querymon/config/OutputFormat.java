package org.carball.querymon.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
