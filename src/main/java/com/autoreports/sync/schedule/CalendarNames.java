package com.autoreports.sync.schedule;

import java.util.List;
import java.util.Locale;

/**
 * English day and month names used in declarative specs and in normalized output.
 */
public final class CalendarNames {
    public static final String LAST_DAY = "Last";
    public static final String ALL_MONTHS = "All months";

    public static final List<String> WEEKDAYS = List.of(
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday");

    public static final List<String> MONTHS = List.of(
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December");

    private CalendarNames() {
    }

    /** ISO weekday ordinal (Monday=1) for a name, or -1. */
    public static int weekdayOrdinal(String name) {
        return indexOf(WEEKDAYS, name);
    }

    /** Month ordinal (January=1) for a name, or -1. */
    public static int monthOrdinal(String name) {
        return indexOf(MONTHS, name);
    }

    public static String weekdayName(int ordinal) {
        return WEEKDAYS.get(ordinal - 1);
    }

    public static String monthName(int ordinal) {
        return MONTHS.get(ordinal - 1);
    }

    public static boolean isLastDay(String token) {
        return token != null && LAST_DAY.equalsIgnoreCase(token.trim());
    }

    public static boolean isAllMonths(String token) {
        return token != null && ALL_MONTHS.equalsIgnoreCase(token.trim());
    }

    private static int indexOf(List<String> names, String name) {
        if (name == null) {
            return -1;
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).toLowerCase(Locale.ROOT).equals(wanted)) {
                return i + 1;
            }
        }
        return -1;
    }
}
