package com.schemaflow.checker.config;

import java.util.Locale;

/**
 * What the chain composer does when a key already produced by an earlier stage is produced again.
 */
public enum ProducedKeyPolicy {
    /** The later declaration silently replaces the earlier one (last writer wins). */
    OVERWRITE,
    /** Emit TYPE_CONFLICT when the two declared types are not mutually compatible; the later one still wins. */
    FLAG_CONFLICT;

    /** Case-insensitive lookup; blank or unknown names yield {@code defaultValue}. */
    public static ProducedKeyPolicy fromName(String name, ProducedKeyPolicy defaultValue) {
        if (name == null || name.isBlank()) {
            return defaultValue;
        }
        try {
            return ProducedKeyPolicy.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }
}
