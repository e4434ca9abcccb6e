package org.ftlbuffer.cli;

/**
 * How a command prints its results.
 */
public enum OutputFormat {
    TEXT,
    JSON
}
