package com.draftpilot.orchestrator.model;

import java.util.Locale;

/** Cost versus quality trade-off chosen at submission time. */
public enum QualityPreference {
    FAST,       // cheapest backends first
    BALANCED,   // mid-priced backends first
    QUALITY;    // strongest backends first

    /** Lenient parse: accepts any case, blank means {@link #BALANCED}. */
    public static QualityPreference fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown quality preference '" + value + "' (expected fast, balanced or quality)", e);
        }
    }
}
