package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;
import com.autoreports.sync.model.RecordField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TriggerNormalizerTest {
    private final TriggerNormalizer normalizer = new TriggerNormalizer(-1);

    @Test
    void singleWeeklyTriggerIsNotPrefixed() {
        RawTrigger weekly = RawTrigger.builder()
                .typeCode(3)
                .startBoundary("2026-10-20T09:00:00")
                .enabled(true)
                .weeksInterval(1)
                .daysOfWeekMask(0x02 | 0x20)
                .build();

        Map<RecordField, String> out = normalizer.normalize(List.of(weekly));

        assertEquals("weekly", out.get(RecordField.SCHEDULE_TYPE));
        assertEquals("Enabled", out.get(RecordField.TASK_TRIGGER_STATUS));
        assertEquals("2026-10-20 08:00:00", out.get(RecordField.SCHEDULE_START_DATE));
        assertEquals("1", out.get(RecordField.SCHEDULE_WEEKS_INTERVAL));
        assertEquals("Monday, Friday", out.get(RecordField.SCHEDULE_WEEK_DAYS));
        assertNull(out.get(RecordField.SCHEDULE_DAYS_INTERVAL));
        assertNull(out.get(RecordField.SCHEDULE_MONTH_DAYS));
        assertEquals(TriggerNormalizer.TRIGGER_FIELDS.size(), out.size());
    }

    @Test
    void severalTriggersArePrefixedAndEmptyValuesDropped() {
        RawTrigger daily = RawTrigger.builder()
                .typeCode(2)
                .startBoundary("2026-01-01T06:30:00")
                .enabled(true)
                .daysInterval(2)
                .repetitionInterval("PT1H")
                .repetitionDuration("PT12H")
                .stopAtDurationEnd(false)
                .build();
        RawTrigger monthly = RawTrigger.builder()
                .typeCode(4)
                .startBoundary("2026-01-01T10:00:00")
                .enabled(false)
                .daysOfMonthMask(0x01)
                .runOnLastDay(true)
                .monthsOfYearMask(0xFFF)
                .build();

        Map<RecordField, String> out = normalizer.normalize(List.of(daily, monthly));

        assertEquals("Trigger 1: daily, Trigger 2: monthly", out.get(RecordField.SCHEDULE_TYPE));
        assertEquals("Trigger 1: Enabled, Trigger 2: Disabled", out.get(RecordField.TASK_TRIGGER_STATUS));
        assertEquals("Trigger 1: 2", out.get(RecordField.SCHEDULE_DAYS_INTERVAL));
        assertEquals("Trigger 2: 1, Last", out.get(RecordField.SCHEDULE_MONTH_DAYS));
        assertEquals("Trigger 2: All months", out.get(RecordField.SCHEDULE_MONTHS));
        assertEquals("Trigger 1: PT1H", out.get(RecordField.SCHEDULE_REPEAT_EVERY));
        assertEquals("Trigger 1: false", out.get(RecordField.SCHEDULE_REPEAT_UNTIL_TIME));
        assertEquals("Trigger 1: PT12H", out.get(RecordField.SCHEDULE_REPEAT_UNTIL_DURATION));
    }

    @Test
    void noTriggersYieldAllNulls() {
        Map<RecordField, String> out = normalizer.normalize(List.of());
        for (RecordField field : TriggerNormalizer.TRIGGER_FIELDS) {
            assertNull(out.get(field));
        }
    }

    @Test
    void unknownTypeCodeIsLabelledByNumber() {
        RawTrigger odd = RawTrigger.builder().typeCode(9).build();
        assertEquals("type 9", normalizer.normalize(List.of(odd)).get(RecordField.SCHEDULE_TYPE));
    }

    @Test
    void unparseableBoundaryIsKeptVerbatim() {
        assertEquals("soon", normalizer.formatBoundary("soon"));
        assertNull(normalizer.formatBoundary(" "));
        assertEquals("2026-03-01 23:00:00", normalizer.formatBoundary("2026-03-02T00:00:00+03:00"));
    }
}
