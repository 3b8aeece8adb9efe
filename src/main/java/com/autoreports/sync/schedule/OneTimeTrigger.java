package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;

import java.time.LocalDateTime;

public final class OneTimeTrigger extends ScheduleTrigger {

    public OneTimeTrigger(LocalDateTime localStart, String startBoundary, boolean enabled,
                          String repetitionInterval, String repetitionDuration) {
        super(localStart, startBoundary, enabled, repetitionInterval, repetitionDuration);
    }

    @Override
    public TriggerType type() {
        return TriggerType.ONE_TIME;
    }

    @Override
    protected void fillRecurrence(RawTrigger.RawTriggerBuilder builder) {
        // no recurrence fields
    }
}
