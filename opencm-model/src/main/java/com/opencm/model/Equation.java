package com.opencm.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structural equation for one target variable. The expression is stored as text and never evaluated.
 */
public final class Equation {

    public static final String DEFAULT_NOISE_DISTRIBUTION = "normal";
    public static final Map<String, Double> DEFAULT_NOISE_PARAMS = defaultNoiseParams();

    private final String target;
    private final EquationType type;
    private final String typeValue;
    private final String expression;
    private final String noiseDistribution;
    private final Map<String, Double> noiseParams;

    public Equation(
            String target,
            EquationType type,
            String expression,
            String noiseDistribution,
            Map<String, Double> noiseParams) {
        this(target, type, null, expression, noiseDistribution, noiseParams);
    }

    private Equation(
            String target,
            EquationType type,
            String typeValue,
            String expression,
            String noiseDistribution,
            Map<String, Double> noiseParams) {
        this.target = Objects.requireNonNull(target, "target");
        this.type = type != null ? type : EquationType.DEFAULT;
        this.typeValue = typeValue != null ? typeValue : this.type.toValue();
        this.expression = expression != null ? expression : "";
        this.noiseDistribution = noiseDistribution != null ? noiseDistribution : DEFAULT_NOISE_DISTRIBUTION;
        this.noiseParams = noiseParams != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(noiseParams))
                : DEFAULT_NOISE_PARAMS;
    }

    /** Linear equation with normal(0, 0.05) noise. */
    public static Equation linear(String target, String expression) {
        return new Equation(target, EquationType.LINEAR, expression, DEFAULT_NOISE_DISTRIBUTION, DEFAULT_NOISE_PARAMS);
    }

    public String getTarget() {
        return target;
    }

    public EquationType getType() {
        return type;
    }

    /** Kind as written in the file; differs from {@code getType().toValue()} only for {@link EquationType#UNKNOWN}. */
    public String getTypeValue() {
        return typeValue;
    }

    /** e.g. {@code 0.6 - 0.15*SupplierPower - 0.20*BuyerPower}. */
    public String getExpression() {
        return expression;
    }

    public String getNoiseDistribution() {
        return noiseDistribution;
    }

    /** Noise parameters by name, in declaration order. */
    public Map<String, Double> getNoiseParams() {
        return noiseParams;
    }

    /**
     * True when the equation carries nothing beyond its expression: linear, normal noise and the
     * default noise parameters. Such an equation is written as a bare expression string.
     */
    public boolean isSimpleForm() {
        return type == EquationType.LINEAR
                && DEFAULT_NOISE_DISTRIBUTION.equals(noiseDistribution)
                && DEFAULT_NOISE_PARAMS.equals(noiseParams);
    }

    /** Copy whose kind is parsed from wire text; unrecognized text is kept verbatim next to {@link EquationType#UNKNOWN}. */
    public Equation withTypeValue(String value) {
        EquationType parsed = EquationType.fromValue(value);
        return new Equation(target, parsed, parsed == EquationType.UNKNOWN ? value : null,
                expression, noiseDistribution, noiseParams);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Equation that = (Equation) o;
        return target.equals(that.target)
                && type == that.type
                && typeValue.equals(that.typeValue)
                && expression.equals(that.expression)
                && noiseDistribution.equals(that.noiseDistribution)
                && noiseParams.equals(that.noiseParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, type, typeValue, expression, noiseDistribution, noiseParams);
    }

    @Override
    public String toString() {
        return target + " := " + expression + " [" + typeValue + ", " + noiseDistribution + noiseParams + "]";
    }

    private static Map<String, Double> defaultNoiseParams() {
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("mean", 0.0);
        params.put("std", 0.05);
        return Collections.unmodifiableMap(params);
    }
}
