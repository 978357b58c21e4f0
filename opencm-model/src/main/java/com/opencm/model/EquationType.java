package com.opencm.model;

import java.util.Locale;

/**
 * Functional form of a structural equation. The expression itself is opaque text; this only labels it.
 */
public enum EquationType {
    LINEAR,
    POLYNOMIAL,
    EXPONENTIAL,
    LOGISTIC,
    INTERACTION,
    SYNERGY,
    CUSTOM,
    UNKNOWN;

    public static final EquationType DEFAULT = LINEAR;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EquationType fromValue(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        for (EquationType t : values()) {
            if (t != UNKNOWN && t.toValue().equals(value)) return t;
        }
        return UNKNOWN;
    }
}
