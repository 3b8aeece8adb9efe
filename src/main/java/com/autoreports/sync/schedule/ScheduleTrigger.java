package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;

import java.time.LocalDateTime;

/**
 * One native trigger ready for registration. Subclasses add the recurrence fields of their kind.
 */
public abstract class ScheduleTrigger {
    public final LocalDateTime localStart;
    public final String startBoundary;
    public final boolean enabled;
    public final String repetitionInterval;
    public final String repetitionDuration;

    protected ScheduleTrigger(
            LocalDateTime localStart,
            String startBoundary,
            boolean enabled,
            String repetitionInterval,
            String repetitionDuration
    ) {
        this.localStart = localStart;
        this.startBoundary = startBoundary;
        this.enabled = enabled;
        this.repetitionInterval = repetitionInterval;
        this.repetitionDuration = repetitionDuration;
    }

    public abstract TriggerType type();

    public boolean hasRepetition() {
        return repetitionInterval != null && !repetitionInterval.isBlank();
    }

    /**
     * Native read-back shape of this trigger, as the scheduler would report it.
     */
    public RawTrigger toRawTrigger() {
        RawTrigger.RawTriggerBuilder builder = RawTrigger.builder()
                .typeCode(type().code())
                .startBoundary(startBoundary)
                .enabled(enabled);
        if (hasRepetition()) {
            builder.repetitionInterval(repetitionInterval)
                    .repetitionDuration(repetitionDuration)
                    .stopAtDurationEnd(Boolean.FALSE);
        }
        fillRecurrence(builder);
        return builder.build();
    }

    protected abstract void fillRecurrence(RawTrigger.RawTriggerBuilder builder);
}
