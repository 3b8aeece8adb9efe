package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;

import java.time.LocalDateTime;

public final class WeeklyTrigger extends ScheduleTrigger {
    public final int weeksInterval;
    public final int daysOfWeekMask;

    public WeeklyTrigger(LocalDateTime localStart, String startBoundary, boolean enabled,
                         String repetitionInterval, String repetitionDuration,
                         int weeksInterval, int daysOfWeekMask) {
        super(localStart, startBoundary, enabled, repetitionInterval, repetitionDuration);
        this.weeksInterval = weeksInterval;
        this.daysOfWeekMask = daysOfWeekMask;
    }

    @Override
    public TriggerType type() {
        return TriggerType.WEEKLY;
    }

    @Override
    protected void fillRecurrence(RawTrigger.RawTriggerBuilder builder) {
        builder.weeksInterval(weeksInterval).daysOfWeekMask(daysOfWeekMask);
    }
}
