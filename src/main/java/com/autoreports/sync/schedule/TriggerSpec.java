package com.autoreports.sync.schedule;

import lombok.Builder;

import java.util.List;

/**
 * One trigger entry of a declarative spec file, as written. {@code null} means the key was absent;
 * an explicit empty list stays empty.
 */
@Builder(toBuilder = true)
public final class TriggerSpec {
    public final String triggerType;
    public final String startDate;
    public final String startTime;
    public final Integer interval;
    public final List<String> daysOfWeek;
    /** Day numbers as text, plus the literal {@code Last}. */
    public final List<String> daysOfMonth;
    public final List<String> months;
    public final String repeatEvery;
    public final String repeatDuration;
    public final Boolean enabled;
}
