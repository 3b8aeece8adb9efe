package com.autoreports.sync.schedule;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Converts ordinal sets to scheduler bitmasks and back.
 */
public final class BitmaskSetCodec {

    private BitmaskSetCodec() {
    }

    /**
     * Encodes {@code ordinals} into the field's bitmask. An empty set (or the month-day unset ordinal 0) encodes to 0.
     *
     * @throws IllegalArgumentException when an ordinal lies outside the field's domain
     */
    public static int encode(Collection<Integer> ordinals, BitmaskField field) {
        if (ordinals == null || ordinals.isEmpty()) {
            return 0;
        }
        int mask = 0;
        for (Integer ordinal : ordinals) {
            if (ordinal == null) {
                throw new IllegalArgumentException(field + " ordinal must not be null");
            }
            if (field == BitmaskField.MONTH_DAY && ordinal == 0) {
                continue;
            }
            if (!field.inDomain(ordinal)) {
                throw new IllegalArgumentException(field + " ordinal out of range: " + ordinal);
            }
            mask |= field.bitOf(ordinal);
        }
        return mask;
    }

    /**
     * Decodes a bitmask into sorted ordinals. 0 decodes to {@code {0}} for month days and to the empty set otherwise.
     *
     * @throws IllegalArgumentException when bits outside the field's domain are set
     */
    public static SortedSet<Integer> decode(int mask, BitmaskField field) {
        SortedSet<Integer> out = new TreeSet<>();
        if (mask == 0) {
            if (field == BitmaskField.MONTH_DAY) {
                out.add(0);
            }
            return Collections.unmodifiableSortedSet(out);
        }
        if ((mask & ~field.fullMask()) != 0) {
            throw new IllegalArgumentException(field + " mask has bits outside domain: 0x" + Integer.toHexString(mask));
        }
        for (int i = field.min(); i <= field.max(); i++) {
            if ((mask & field.bitOf(i)) != 0) {
                out.add(i);
            }
        }
        return Collections.unmodifiableSortedSet(out);
    }

    public static boolean isFull(int mask, BitmaskField field) {
        return mask == field.fullMask();
    }
}
