package com.opencm.model;

import java.util.Locale;

/**
 * Known subject-area tags for a model. The model keeps its domain as free text
 * ({@link CausalModel#getDomain()}); this enum only tells known tags from unknown ones.
 */
public enum ModelDomain {
    STRATEGY,
    MARKETING,
    FINANCE,
    OPERATIONS,
    ORGANIZATION,
    TECHNOLOGY,
    ECONOMICS,
    PSYCHOLOGY,
    HEALTHCARE,
    SUPPLY_CHAIN,
    GENERAL,
    UNKNOWN;

    public static final ModelDomain DEFAULT = GENERAL;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Exact (case-sensitive) match on the lowercase wire value; anything else is {@link #UNKNOWN}. */
    public static ModelDomain fromValue(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        for (ModelDomain d : values()) {
            if (d != UNKNOWN && d.toValue().equals(value)) return d;
        }
        return UNKNOWN;
    }
}
