package com.opencm.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A variable (node) of a structural causal model: kind, numeric range, unit, observability,
 * and for categorical variables the list of category labels.
 */
public final class Variable {

    private final String name;
    private final VariableType type;
    private final ValueDomain domain;
    private final String unit;
    private final String description;
    private final boolean observed;
    private final Double defaultValue;
    private final List<String> categories;

    public Variable(
            String name,
            VariableType type,
            ValueDomain domain,
            String unit,
            String description,
            boolean observed,
            Double defaultValue,
            List<String> categories) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type != null ? type : VariableType.DEFAULT;
        this.domain = domain != null ? domain : ValueDomain.UNIT;
        this.unit = unit != null ? unit : "";
        this.description = description != null ? description : "";
        this.observed = observed;
        this.defaultValue = defaultValue;
        this.categories = categories != null && !categories.isEmpty() ? List.copyOf(categories) : null;
    }

    /** Continuous, observed variable on [0, 1] with no unit. */
    public static Variable of(String name) {
        return builder(name).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public VariableType getType() {
        return type;
    }

    public ValueDomain getDomain() {
        return domain;
    }

    /** Business unit label ($, %, units, index); empty when not given. */
    public String getUnit() {
        return unit;
    }

    public String getDescription() {
        return description;
    }

    public boolean isObserved() {
        return observed;
    }

    /** Starting value if known. */
    public Optional<Double> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    /** Category labels; present only when at least one is declared (an empty list counts as absent). */
    public Optional<List<String>> getCategories() {
        return Optional.ofNullable(categories);
    }

    public Builder toBuilder() {
        return new Builder(name)
                .type(type)
                .domain(domain)
                .unit(unit)
                .description(description)
                .observed(observed)
                .defaultValue(defaultValue)
                .categories(categories);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Variable that = (Variable) o;
        return observed == that.observed
                && name.equals(that.name)
                && type == that.type
                && domain.equals(that.domain)
                && unit.equals(that.unit)
                && description.equals(that.description)
                && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(categories, that.categories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, domain, unit, description, observed, defaultValue, categories);
    }

    @Override
    public String toString() {
        return "Variable{" + name + ", " + type.toValue() + ", [" + domain.min() + ", " + domain.max() + "]}";
    }

    public static final class Builder {
        private final String name;
        private VariableType type = VariableType.DEFAULT;
        private ValueDomain domain = ValueDomain.UNIT;
        private String unit = "";
        private String description = "";
        private boolean observed = true;
        private Double defaultValue;
        private List<String> categories;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder type(VariableType type) {
            this.type = type;
            return this;
        }

        public Builder domain(ValueDomain domain) {
            this.domain = domain;
            return this;
        }

        public Builder domain(double min, double max) {
            this.domain = new ValueDomain(min, max);
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder observed(boolean observed) {
            this.observed = observed;
            return this;
        }

        public Builder defaultValue(Double defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = categories;
            return this;
        }

        public Variable build() {
            return new Variable(name, type, domain, unit, description, observed, defaultValue, categories);
        }
    }
}
