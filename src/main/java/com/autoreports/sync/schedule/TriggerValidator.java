package com.autoreports.sync.schedule;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks one trigger entry independently of how it is later built. Every violation names
 * the trigger index and the offending field.
 */
public final class TriggerValidator {
    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern TIME = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final DateTimeFormatter STRICT_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    public List<TriggerViolation> validate(TriggerSpec spec, int index) {
        List<TriggerViolation> out = new ArrayList<>();

        TriggerType type = null;
        if (spec.triggerType == null) {
            out.add(new TriggerViolation(index, "trigger_type", "is required"));
        } else {
            type = TriggerType.fromText(spec.triggerType);
            if (type == null) {
                out.add(new TriggerViolation(index, "trigger_type", "is not recognized: " + spec.triggerType));
            }
        }

        checkDate(spec.startDate, index, out);
        checkTime(spec.startTime, index, out);

        if (spec.interval != null && spec.interval < 1) {
            out.add(new TriggerViolation(index, "interval", "must be at least 1: " + spec.interval));
        }

        boolean hasWeekday = false;
        if (spec.daysOfWeek != null) {
            for (String day : spec.daysOfWeek) {
                if (CalendarNames.weekdayOrdinal(day) < 0) {
                    out.add(new TriggerViolation(index, "days_of_week", "has unknown day name: " + day));
                } else {
                    hasWeekday = true;
                }
            }
        }

        boolean hasMonthDay = false;
        boolean lastDay = false;
        if (spec.daysOfMonth != null) {
            for (String day : spec.daysOfMonth) {
                if (CalendarNames.isLastDay(day)) {
                    lastDay = true;
                    continue;
                }
                Integer value = parseIntOrNull(day);
                if (value == null || value < 1 || value > 31) {
                    out.add(new TriggerViolation(index, "days_of_month", "must be 1-31 or Last: " + day));
                } else {
                    hasMonthDay = true;
                }
            }
        }

        boolean hasMonth = false;
        boolean allMonths = false;
        if (spec.months != null) {
            for (String month : spec.months) {
                if (CalendarNames.isAllMonths(month)) {
                    allMonths = true;
                } else if (CalendarNames.monthOrdinal(month) < 0) {
                    out.add(new TriggerViolation(index, "months", "has unknown month name: " + month));
                } else {
                    hasMonth = true;
                }
            }
        }

        if (type == TriggerType.WEEKLY && !hasWeekday) {
            out.add(new TriggerViolation(index, "days_of_week", "must not be empty for a weekly trigger"));
        }
        if (type == TriggerType.MONTHLY) {
            if (!hasMonthDay && !lastDay) {
                out.add(new TriggerViolation(index, "days_of_month", "must not be empty for a monthly trigger"));
            }
            if (!hasMonth && !allMonths) {
                out.add(new TriggerViolation(index, "months", "must not be empty for a monthly trigger"));
            }
        }

        checkDuration("repeat_every", spec.repeatEvery, index, out);
        checkDuration("repeat_duration", spec.repeatDuration, index, out);
        if (spec.repeatDuration != null && spec.repeatEvery == null) {
            out.add(new TriggerViolation(index, "repeat_every", "is required when repeat_duration is set"));
        }
        return out;
    }

    private static void checkDate(String raw, int index, List<TriggerViolation> out) {
        if (raw == null) {
            out.add(new TriggerViolation(index, "start_date", "is required"));
            return;
        }
        if (!DATE.matcher(raw).matches()) {
            out.add(new TriggerViolation(index, "start_date", "must match YYYY-MM-DD: " + raw));
            return;
        }
        try {
            LocalDate.parse(raw, STRICT_DATE);
        } catch (DateTimeParseException e) {
            out.add(new TriggerViolation(index, "start_date", "is not a calendar date: " + raw));
        }
    }

    private static void checkTime(String raw, int index, List<TriggerViolation> out) {
        if (raw == null) {
            out.add(new TriggerViolation(index, "start_time", "is required"));
            return;
        }
        Matcher m = TIME.matcher(raw);
        if (!m.matches()) {
            out.add(new TriggerViolation(index, "start_time", "must match HH:MM: " + raw));
            return;
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) {
            out.add(new TriggerViolation(index, "start_time", "is not a clock time: " + raw));
        }
    }

    private static void checkDuration(String field, String raw, int index, List<TriggerViolation> out) {
        String iso = TaskSpecReader.toIsoDuration(raw);
        if (iso == null) {
            return;
        }
        try {
            Duration parsed = Duration.parse(iso);
            if (parsed.isNegative() || parsed.isZero()) {
                out.add(new TriggerViolation(index, field, "must be positive: " + raw));
            }
        } catch (DateTimeParseException e) {
            out.add(new TriggerViolation(index, field, "is not a duration: " + raw));
        }
    }

    private static Integer parseIntOrNull(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (RuntimeException e) {
            return null;
        }
    }
}
