package com.autoreports.sync.schedule;

/**
 * Raised when a job definition cannot be produced from its declarative spec.
 */
public class TaskDefinitionException extends Exception {

    public TaskDefinitionException(String message) {
        super(message);
    }

    public TaskDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
