package com.autoreports.sync.schedule;

/**
 * Recurrence fields the scheduler stores as bitmasks.
 */
public enum BitmaskField {
    /** ISO ordinals 1 (Monday) to 7 (Sunday). */
    WEEKDAY(1, 7),
    /** Day of month 1..31; 0 stands for "unset". */
    MONTH_DAY(1, 31),
    /** Month 1..12. */
    MONTH(1, 12);

    private static final int[] WEEKDAY_BITS = {
            0x02, // Monday
            0x04, // Tuesday
            0x08, // Wednesday
            0x10, // Thursday
            0x20, // Friday
            0x40, // Saturday
            0x01  // Sunday
    };

    private final int min;
    private final int max;

    BitmaskField(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public boolean inDomain(int ordinal) {
        return ordinal >= min && ordinal <= max;
    }

    int bitOf(int ordinal) {
        if (this == WEEKDAY) {
            return WEEKDAY_BITS[ordinal - 1];
        }
        return 1 << (ordinal - 1);
    }

    int fullMask() {
        int mask = 0;
        for (int i = min; i <= max; i++) {
            mask |= bitOf(i);
        }
        return mask;
    }
}
