package com.autoreports.sync.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Naming convention of task identifiers: one of a fixed set of prefixes and a fixed total length,
 * for example {@code REQ000000000001}.
 */
public final class IdentifierConvention {
    public final List<String> prefixes;
    public final int length;

    public IdentifierConvention(List<String> prefixes, int length) {
        List<String> normalized = new ArrayList<>();
        if (prefixes != null) {
            for (String prefix : prefixes) {
                if (prefix != null && !prefix.trim().isEmpty()) {
                    normalized.add(prefix.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("identifier prefixes must not be empty");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("identifier length must be positive: " + length);
        }
        this.prefixes = List.copyOf(normalized);
        this.length = length;
    }

    public boolean matches(String candidate) {
        if (candidate == null || candidate.length() != length) {
            return false;
        }
        for (String prefix : prefixes) {
            if (candidate.startsWith(prefix)) {
                return candidate.substring(prefix.length()).chars().allMatch(Character::isLetterOrDigit);
            }
        }
        return false;
    }
}
