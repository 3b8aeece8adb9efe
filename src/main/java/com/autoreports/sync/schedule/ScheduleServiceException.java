package com.autoreports.sync.schedule;

public class ScheduleServiceException extends Exception {

    public ScheduleServiceException(String message) {
        super(message);
    }

    public ScheduleServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
