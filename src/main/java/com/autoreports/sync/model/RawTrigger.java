package com.autoreports.sync.model;

import lombok.Builder;

/**
 * One trigger as read back from the scheduler, in native form: bitmask recurrence fields and raw boundary text.
 * Fields the trigger kind does not carry stay {@code null} (or {@code 0} for masks).
 */
@Builder(toBuilder = true)
public final class RawTrigger {
    public final Integer typeCode;
    public final String startBoundary;
    public final Boolean enabled;
    public final Integer daysInterval;
    public final Integer weeksInterval;
    public final int daysOfWeekMask;
    public final int daysOfMonthMask;
    public final boolean runOnLastDay;
    public final int monthsOfYearMask;
    public final String repetitionInterval;
    public final String repetitionDuration;
    public final Boolean stopAtDurationEnd;
}
