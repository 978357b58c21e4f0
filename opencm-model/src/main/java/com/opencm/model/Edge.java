package com.opencm.model;

import java.util.Objects;

/**
 * Directed, typed, weighted relationship between two variables of the same model.
 * Endpoints are variable names; whether they resolve is checked by validation, not here.
 */
public final class Edge {

    public static final double DEFAULT_STRENGTH = 0.5;
    public static final double DEFAULT_CONFIDENCE = 1.0;

    private final String source;
    private final String target;
    private final EdgeType type;
    private final String typeValue;
    private final double strength;
    private final String description;
    private final double confidence;
    private final boolean learned;

    public Edge(
            String source,
            String target,
            EdgeType type,
            double strength,
            String description,
            double confidence,
            boolean learned) {
        this(source, target, type, null, strength, description, confidence, learned);
    }

    private Edge(
            String source,
            String target,
            EdgeType type,
            String typeValue,
            double strength,
            String description,
            double confidence,
            boolean learned) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.type = type != null ? type : EdgeType.DEFAULT;
        this.typeValue = typeValue != null ? typeValue : this.type.toValue();
        this.strength = strength;
        this.description = description != null ? description : "";
        this.confidence = confidence;
        this.learned = learned;
    }

    /** A "causes" edge with the given strength and all other fields defaulted. */
    public static Edge causes(String source, String target, double strength) {
        return new Edge(source, target, EdgeType.CAUSES, strength, "", DEFAULT_CONFIDENCE, false);
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public EdgeType getType() {
        return type;
    }

    /** Kind as written in the file; differs from {@code getType().toValue()} only for {@link EdgeType#UNKNOWN}. */
    public String getTypeValue() {
        return typeValue;
    }

    /** Causal strength in [-1, 1]; negative values mean the source suppresses the target. */
    public double getStrength() {
        return strength;
    }

    public String getDescription() {
        return description;
    }

    /** Confidence in the edge, nominally in [0, 1]. Not range-checked. */
    public double getConfidence() {
        return confidence;
    }

    /** Whether the edge was learned from data rather than declared by an author. */
    public boolean isLearned() {
        return learned;
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    public Edge withStrength(double strength) {
        return new Edge(source, target, type, typeValue, strength, description, confidence, learned);
    }

    public Edge withType(EdgeType type) {
        return new Edge(source, target, type, strength, description, confidence, learned);
    }

    /** Copy whose kind is parsed from wire text; unrecognized text is kept verbatim next to {@link EdgeType#UNKNOWN}. */
    public Edge withTypeValue(String value) {
        EdgeType parsed = EdgeType.fromValue(value);
        return new Edge(source, target, parsed, parsed == EdgeType.UNKNOWN ? value : null,
                strength, description, confidence, learned);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge that = (Edge) o;
        return Double.compare(strength, that.strength) == 0
                && Double.compare(confidence, that.confidence) == 0
                && learned == that.learned
                && source.equals(that.source)
                && target.equals(that.target)
                && type == that.type
                && typeValue.equals(that.typeValue)
                && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, type, typeValue, strength, description, confidence, learned);
    }

    @Override
    public String toString() {
        return source + " -" + typeValue + "(" + strength + ")-> " + target;
    }
}
