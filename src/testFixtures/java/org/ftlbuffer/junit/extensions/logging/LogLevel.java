package org.ftlbuffer.junit.extensions.logging;

/**
 * The log levels the {@link LogWatchExtension} can watch.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
