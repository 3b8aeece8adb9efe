package com.autoreports.core;

import org.apache.logging.log4j.Level;

/**
 * Severity of a problem met during a run; ERROR and CRITICAL make the run notify-worthy.
 */
public enum IssueSeverity {
    WARNING(Level.WARN),
    ERROR(Level.ERROR),
    CRITICAL(Level.FATAL);

    private final Level level;

    IssueSeverity(Level level) {
        this.level = level;
    }

    public Level level() {
        return level;
    }

    public boolean notifies() {
        return this != WARNING;
    }
}
