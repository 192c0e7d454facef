package com.stepflow.core.model;

/**
 * Severity of a durable execution log entry.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR
}
