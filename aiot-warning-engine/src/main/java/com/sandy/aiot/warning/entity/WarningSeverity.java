package com.sandy.aiot.warning.entity;

import java.util.Locale;

public enum WarningSeverity {
    MINOR,
    MODERATE,
    MAJOR,
    CRITICAL;

    /** Lenient parse for config values ("major", "Major"); unknown or blank -> MODERATE. */
    public static WarningSeverity parse(String s) {
        if (s == null || s.isBlank()) return MODERATE;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MODERATE;
        }
    }
}
