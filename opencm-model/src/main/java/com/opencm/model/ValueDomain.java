package com.opencm.model;

/**
 * Numeric range of a variable as an ordered pair. Validation requires {@code min < max};
 * the pair itself does not enforce it.
 */
public record ValueDomain(double min, double max) {

    /** Range used when a variable declares none: [0, 1]. */
    public static final ValueDomain UNIT = new ValueDomain(0.0, 1.0);

    public boolean isOrdered() {
        return min < max;
    }
}
