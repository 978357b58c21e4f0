package com.opencm.model;

import java.util.Locale;

/**
 * Relationship kind of an edge. JSON uses the lowercase name; unknown values map to {@link #UNKNOWN}
 * (tolerated by validation with a warning).
 */
public enum EdgeType {
    CAUSES,
    CORRELATES,
    MEDIATES,
    MODERATES,
    INHIBITS,
    UNKNOWN;

    public static final EdgeType DEFAULT = CAUSES;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EdgeType fromValue(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        for (EdgeType t : values()) {
            if (t != UNKNOWN && t.toValue().equals(value)) return t;
        }
        return UNKNOWN;
    }
}
