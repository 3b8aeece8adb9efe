package com.autoreports.sync.schedule;

/**
 * One validation failure of a declarative trigger entry. {@code index} is 1-based.
 */
public record TriggerViolation(int index, String field, String message) {

    @Override
    public String toString() {
        return "trigger " + index + ": " + field + " " + message;
    }
}
