package org.filemetrics.metrics;

public enum LogLevel {
    DEBUG, INFO, WARN, ERROR, FATAL
}
