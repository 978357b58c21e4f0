package com.opencm.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Complete in-memory representation of an OpenCM model: identity, variables by name, edges,
 * structural equations by target, assumptions, and optional validation requirements and metadata.
 * <p>
 * Instances are immutable. Construction does not check that edges and equations reference declared
 * variables or that the graph is acyclic; a model built by hand must be validated before it is trusted.
 * The origin path is provenance only and does not take part in {@link #equals(Object)}.
 */
public final class CausalModel {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_DOMAIN = "general";

    private final String id;
    private final String name;
    private final String version;
    private final String domain;
    private final String description;
    private final Map<String, Variable> variables;
    private final List<Edge> edges;
    private final Map<String, Equation> equations;
    private final boolean allowCycles;
    private final List<String> assumptions;
    private final ValidationRequirements validation;
    private final ModelMetadata metadata;
    private final Path origin;

    private CausalModel(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.name = Objects.requireNonNull(b.name, "name");
        this.version = b.version != null ? b.version : DEFAULT_VERSION;
        this.domain = b.domain != null ? b.domain : DEFAULT_DOMAIN;
        this.description = b.description != null ? b.description : "";
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(b.variables));
        this.edges = List.copyOf(b.edges);
        this.equations = Collections.unmodifiableMap(new LinkedHashMap<>(b.equations));
        this.allowCycles = b.allowCycles;
        this.assumptions = List.copyOf(b.assumptions);
        this.validation = b.validation;
        this.metadata = b.metadata;
        this.origin = b.origin;
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    /** Model id; valid ids match {@code ^[a-z][a-z0-9_]*$}. */
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Semantic version of the model itself (not of the file format). */
    public String getVersion() {
        return version;
    }

    /** Domain tag, e.g. {@code finance}. See {@link ModelDomain} for the known tags. */
    public String getDomain() {
        return domain;
    }

    public String getDescription() {
        return description;
    }

    /** Variables by name, in declaration order. */
    public Map<String, Variable> getVariables() {
        return variables;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    /** Structural equations by target variable name, in declaration order. */
    public Map<String, Equation> getEquations() {
        return equations;
    }

    /** Whether the edge graph may contain directed cycles (requires an iterative solver downstream). */
    public boolean isAllowCycles() {
        return allowCycles;
    }

    public List<String> getAssumptions() {
        return assumptions;
    }

    public Optional<ValidationRequirements> getValidation() {
        return Optional.ofNullable(validation);
    }

    public Optional<ModelMetadata> getMetadata() {
        return Optional.ofNullable(metadata);
    }

    /** File the model was loaded from, if any. */
    public Optional<Path> getOrigin() {
        return Optional.ofNullable(origin);
    }

    public Set<String> variableNames() {
        return variables.keySet();
    }

    public int nodeCount() {
        return variables.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /** One-line summary, e.g. {@code Porter Five Forces (strategy) - 6 vars, 5 edges}. */
    public String summary() {
        return name + " (" + domain + ") - " + nodeCount() + " vars, " + edgeCount() + " edges";
    }

    public Builder toBuilder() {
        Builder b = new Builder(id, name)
                .version(version)
                .domain(domain)
                .description(description)
                .allowCycles(allowCycles)
                .assumptions(assumptions)
                .validation(validation)
                .metadata(metadata)
                .origin(origin);
        variables.values().forEach(b::variable);
        edges.forEach(b::edge);
        equations.values().forEach(b::equation);
        return b;
    }

    /** Returns a copy with the given variable added or replacing the one of the same name. */
    public CausalModel withVariable(Variable variable) {
        return toBuilder().variable(variable).build();
    }

    public CausalModel withEdges(List<Edge> edges) {
        return toBuilder().clearEdges().edges(edges).build();
    }

    public CausalModel withOrigin(Path origin) {
        return toBuilder().origin(origin).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CausalModel that = (CausalModel) o;
        return allowCycles == that.allowCycles
                && id.equals(that.id)
                && name.equals(that.name)
                && version.equals(that.version)
                && domain.equals(that.domain)
                && description.equals(that.description)
                && variables.equals(that.variables)
                && edges.equals(that.edges)
                && equations.equals(that.equations)
                && assumptions.equals(that.assumptions)
                && Objects.equals(validation, that.validation)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, version, domain, description, variables, edges, equations,
                allowCycles, assumptions, validation, metadata);
    }

    @Override
    public String toString() {
        return "CausalModel{" + id + ": " + summary() + "}";
    }

    public static final class Builder {
        private final String id;
        private final String name;
        private String version = DEFAULT_VERSION;
        private String domain = DEFAULT_DOMAIN;
        private String description = "";
        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Map<String, Equation> equations = new LinkedHashMap<>();
        private boolean allowCycles;
        private List<String> assumptions = List.of();
        private ValidationRequirements validation;
        private ModelMetadata metadata;
        private Path origin;

        private Builder(String id, String name) {
            this.id = Objects.requireNonNull(id, "id");
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Adds the variable under its name, replacing any previous one with that name. */
        public Builder variable(Variable variable) {
            Objects.requireNonNull(variable, "variable");
            variables.put(variable.getName(), variable);
            return this;
        }

        public Builder edge(Edge edge) {
            edges.add(Objects.requireNonNull(edge, "edge"));
            return this;
        }

        public Builder edges(List<Edge> edges) {
            edges.forEach(this::edge);
            return this;
        }

        private Builder clearEdges() {
            edges.clear();
            return this;
        }

        /** Adds the equation under its target, replacing any previous one for that target. */
        public Builder equation(Equation equation) {
            Objects.requireNonNull(equation, "equation");
            equations.put(equation.getTarget(), equation);
            return this;
        }

        public Builder allowCycles(boolean allowCycles) {
            this.allowCycles = allowCycles;
            return this;
        }

        public Builder assumptions(List<String> assumptions) {
            this.assumptions = assumptions != null ? assumptions : List.of();
            return this;
        }

        public Builder validation(ValidationRequirements validation) {
            this.validation = validation;
            return this;
        }

        public Builder metadata(ModelMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder origin(Path origin) {
            this.origin = origin;
            return this;
        }

        public CausalModel build() {
            return new CausalModel(this);
        }
    }
}
