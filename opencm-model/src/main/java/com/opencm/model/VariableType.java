package com.opencm.model;

import java.util.Locale;

/**
 * Kind of a model variable. JSON uses the lowercase name ({@code "continuous"}, ...);
 * unknown values map to {@link #UNKNOWN}.
 */
public enum VariableType {
    CONTINUOUS,
    DISCRETE,
    BINARY,
    /** Takes one of the labels in {@link Variable#getCategories()}. */
    CATEGORICAL,
    /** Used when a document contains an unrecognized kind string. */
    UNKNOWN;

    /** Kind used when a variable declares none. */
    public static final VariableType DEFAULT = CONTINUOUS;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the kind for the given wire value; null or blank yields {@link #DEFAULT}. */
    public static VariableType fromValue(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        for (VariableType t : values()) {
            if (t != UNKNOWN && t.toValue().equals(value)) return t;
        }
        return UNKNOWN;
    }
}
