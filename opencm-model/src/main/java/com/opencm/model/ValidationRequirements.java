package com.opencm.model;

import java.util.List;
import java.util.Objects;

/** Data requirements for fitting the model: minimum sample size, required variables, suggested datasets. */
public final class ValidationRequirements {

    public static final int DEFAULT_MIN_DATA_POINTS = 20;

    private final int minDataPoints;
    private final List<String> requiredVariables;
    private final List<String> suggestedDatasets;

    public ValidationRequirements(int minDataPoints, List<String> requiredVariables, List<String> suggestedDatasets) {
        this.minDataPoints = minDataPoints;
        this.requiredVariables = requiredVariables != null ? List.copyOf(requiredVariables) : List.of();
        this.suggestedDatasets = suggestedDatasets != null ? List.copyOf(suggestedDatasets) : List.of();
    }

    public int getMinDataPoints() {
        return minDataPoints;
    }

    public List<String> getRequiredVariables() {
        return requiredVariables;
    }

    public List<String> getSuggestedDatasets() {
        return suggestedDatasets;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationRequirements that = (ValidationRequirements) o;
        return minDataPoints == that.minDataPoints
                && requiredVariables.equals(that.requiredVariables)
                && suggestedDatasets.equals(that.suggestedDatasets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minDataPoints, requiredVariables, suggestedDatasets);
    }
}
