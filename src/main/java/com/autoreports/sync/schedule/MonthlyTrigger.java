package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;

import java.time.LocalDateTime;

public final class MonthlyTrigger extends ScheduleTrigger {
    public final int daysOfMonthMask;
    public final boolean runOnLastDay;
    public final int monthsOfYearMask;

    public MonthlyTrigger(LocalDateTime localStart, String startBoundary, boolean enabled,
                          String repetitionInterval, String repetitionDuration,
                          int daysOfMonthMask, boolean runOnLastDay, int monthsOfYearMask) {
        super(localStart, startBoundary, enabled, repetitionInterval, repetitionDuration);
        this.daysOfMonthMask = daysOfMonthMask;
        this.runOnLastDay = runOnLastDay;
        this.monthsOfYearMask = monthsOfYearMask;
    }

    @Override
    public TriggerType type() {
        return TriggerType.MONTHLY;
    }

    @Override
    protected void fillRecurrence(RawTrigger.RawTriggerBuilder builder) {
        builder.daysOfMonthMask(daysOfMonthMask)
                .runOnLastDay(runOnLastDay)
                .monthsOfYearMask(monthsOfYearMask);
    }
}
