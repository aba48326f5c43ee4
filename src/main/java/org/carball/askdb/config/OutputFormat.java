package org.carball.askdb.config;

public enum OutputFormat {
    JSON,
    MARKDOWN
}
