package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;

import java.time.LocalDateTime;

public final class DailyTrigger extends ScheduleTrigger {
    public final int daysInterval;

    public DailyTrigger(LocalDateTime localStart, String startBoundary, boolean enabled,
                        String repetitionInterval, String repetitionDuration, int daysInterval) {
        super(localStart, startBoundary, enabled, repetitionInterval, repetitionDuration);
        this.daysInterval = daysInterval;
    }

    @Override
    public TriggerType type() {
        return TriggerType.DAILY;
    }

    @Override
    protected void fillRecurrence(RawTrigger.RawTriggerBuilder builder) {
        builder.daysInterval(daysInterval);
    }
}
