package com.autoreports.sync.schedule;

import com.autoreports.sync.model.RawTrigger;
import com.autoreports.sync.model.RecordField;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Flattens scheduler read-back triggers into the canonical {@code task_schedule_*} fields.
 * With several triggers every value is prefixed {@code "Trigger n: "}; empty values are dropped
 * and the rest joined with {@code ", "}.
 */
public final class TriggerNormalizer {
    public static final List<RecordField> TRIGGER_FIELDS = List.of(
            RecordField.SCHEDULE_TYPE,
            RecordField.TASK_TRIGGER_STATUS,
            RecordField.SCHEDULE_START_DATE,
            RecordField.SCHEDULE_DAYS_INTERVAL,
            RecordField.SCHEDULE_WEEKS_INTERVAL,
            RecordField.SCHEDULE_WEEK_DAYS,
            RecordField.SCHEDULE_MONTHS,
            RecordField.SCHEDULE_MONTH_DAYS,
            RecordField.SCHEDULE_REPEAT_EVERY,
            RecordField.SCHEDULE_REPEAT_UNTIL_TIME,
            RecordField.SCHEDULE_REPEAT_UNTIL_DURATION
    );

    static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final int readOffsetHours;

    public TriggerNormalizer(int readOffsetHours) {
        this.readOffsetHours = readOffsetHours;
    }

    /**
     * @return every canonical field, mapped to its joined value or {@code null}
     */
    public Map<RecordField, String> normalize(List<RawTrigger> triggers) {
        Map<RecordField, List<String>> collected = new EnumMap<>(RecordField.class);
        for (RecordField field : TRIGGER_FIELDS) {
            collected.put(field, new ArrayList<>());
        }
        List<RawTrigger> safe = triggers == null ? List.of() : triggers;
        boolean prefixed = safe.size() > 1;
        for (int i = 0; i < safe.size(); i++) {
            RawTrigger trigger = safe.get(i);
            if (trigger == null) {
                continue;
            }
            String prefix = prefixed ? "Trigger " + (i + 1) + ": " : "";
            Map<RecordField, String> values = describe(trigger);
            for (Map.Entry<RecordField, String> entry : values.entrySet()) {
                String value = entry.getValue();
                if (value != null && !value.isBlank()) {
                    collected.get(entry.getKey()).add(prefix + value);
                }
            }
        }

        Map<RecordField, String> out = new EnumMap<>(RecordField.class);
        for (RecordField field : TRIGGER_FIELDS) {
            List<String> values = collected.get(field);
            out.put(field, values.isEmpty() ? null : String.join(", ", values));
        }
        return out;
    }

    private Map<RecordField, String> describe(RawTrigger trigger) {
        Map<RecordField, String> values = new EnumMap<>(RecordField.class);
        TriggerType type = TriggerType.fromCode(trigger.typeCode);
        values.put(RecordField.SCHEDULE_TYPE, type == null
                ? (trigger.typeCode == null ? null : "type " + trigger.typeCode)
                : type.label());
        values.put(RecordField.TASK_TRIGGER_STATUS, trigger.enabled == null
                ? null
                : (trigger.enabled ? "Enabled" : "Disabled"));
        values.put(RecordField.SCHEDULE_START_DATE, formatBoundary(trigger.startBoundary));
        values.put(RecordField.SCHEDULE_DAYS_INTERVAL, trigger.daysInterval == null ? null : String.valueOf(trigger.daysInterval));
        values.put(RecordField.SCHEDULE_WEEKS_INTERVAL, trigger.weeksInterval == null ? null : String.valueOf(trigger.weeksInterval));
        values.put(RecordField.SCHEDULE_WEEK_DAYS, weekdayNames(trigger.daysOfWeekMask));
        values.put(RecordField.SCHEDULE_MONTHS, monthNames(trigger.monthsOfYearMask));
        values.put(RecordField.SCHEDULE_MONTH_DAYS, monthDays(trigger.daysOfMonthMask, trigger.runOnLastDay));
        values.put(RecordField.SCHEDULE_REPEAT_EVERY, trigger.repetitionInterval);
        values.put(RecordField.SCHEDULE_REPEAT_UNTIL_TIME, trigger.stopAtDurationEnd == null ? null : String.valueOf(trigger.stopAtDurationEnd));
        values.put(RecordField.SCHEDULE_REPEAT_UNTIL_DURATION, trigger.repetitionDuration);
        return values;
    }

    /**
     * Applies the read offset and renders {@code yyyy-MM-dd HH:mm:ss}. Unparseable input is returned unchanged.
     */
    public String formatBoundary(String raw) {
        LocalDateTime parsed = parseBoundary(raw);
        if (parsed == null) {
            return raw == null || raw.isBlank() ? null : raw.trim();
        }
        return shift(parsed).format(DISPLAY_FORMAT);
    }

    public LocalDateTime shift(LocalDateTime value) {
        return value == null ? null : value.plusHours(readOffsetHours);
    }

    static LocalDateTime parseBoundary(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        if (text.length() < 19) {
            return null;
        }
        try {
            return LocalDateTime.parse(text.substring(0, 19).replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String weekdayNames(int mask) {
        if (mask == 0) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (int ordinal : BitmaskSetCodec.decode(mask, BitmaskField.WEEKDAY)) {
            names.add(CalendarNames.weekdayName(ordinal));
        }
        return String.join(", ", names);
    }

    private static String monthNames(int mask) {
        if (mask == 0) {
            return null;
        }
        if (BitmaskSetCodec.isFull(mask, BitmaskField.MONTH)) {
            return CalendarNames.ALL_MONTHS;
        }
        List<String> names = new ArrayList<>();
        for (int ordinal : BitmaskSetCodec.decode(mask, BitmaskField.MONTH)) {
            names.add(CalendarNames.monthName(ordinal));
        }
        return String.join(", ", names);
    }

    private static String monthDays(int mask, boolean lastDay) {
        List<String> days = new ArrayList<>();
        SortedSet<Integer> ordinals = BitmaskSetCodec.decode(mask, BitmaskField.MONTH_DAY);
        for (int ordinal : ordinals) {
            if (ordinal != 0) {
                days.add(String.valueOf(ordinal));
            }
        }
        if (lastDay) {
            days.add(CalendarNames.LAST_DAY);
        }
        return days.isEmpty() ? null : String.join(", ", days);
    }
}
