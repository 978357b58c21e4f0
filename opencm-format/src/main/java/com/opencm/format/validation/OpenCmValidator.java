package com.opencm.format.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencm.config.OpenCmConfig;
import com.opencm.format.OpenCmFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates an OpenCM JSON tree and returns a fresh {@link ValidationResult}; it never throws for
 * malformed content. Instances hold only the supported format version and may be shared.
 * <p>
 * Checks, in order:
 * <ol>
 *   <li>required top-level fields (if any is missing, validation stops here); version mismatch warns</li>
 *   <li>model section: id and name required, id pattern; unknown domain warns</li>
 *   <li>variables: at least one; valid kind; domain is {@code [min, max]} with min &lt; max</li>
 *   <li>edges: endpoints declared, no self-loops, strength in [-1, 1]; unknown kind warns</li>
 *   <li>structural equations: target declared; unknown kind warns. Expressions are not inspected</li>
 *   <li>acyclicity unless {@code model.allow_cycles}, reporting at most {@value #MAX_REPORTED_CYCLES} cycles</li>
 *   <li>assumptions: an empty list warns</li>
 * </ol>
 */
public final class OpenCmValidator {

    private static final Logger log = LoggerFactory.getLogger(OpenCmValidator.class);

    public static final int MAX_REPORTED_CYCLES = 3;

    private static final String DEFAULT_VARIABLE_TYPE = "continuous";
    private static final String DEFAULT_EDGE_TYPE = "causes";
    private static final String DEFAULT_EQUATION_TYPE = "linear";

    private final String supportedVersion;

    public OpenCmValidator() {
        this(OpenCmFormat.VERSION);
    }

    /** @param supportedVersion format version documents are compared against; null = {@link OpenCmFormat#VERSION} */
    public OpenCmValidator(String supportedVersion) {
        this.supportedVersion = supportedVersion != null ? supportedVersion : OpenCmFormat.VERSION;
    }

    public static OpenCmValidator forConfig(OpenCmConfig config) {
        return new OpenCmValidator(config.getSupportedVersion());
    }

    public String getSupportedVersion() {
        return supportedVersion;
    }

    public ValidationResult validate(JsonNode document) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (document == null || !document.isObject()) {
            errors.add("OpenCM document must be a JSON object, got: " + describe(document));
            return ValidationResult.of(errors, warnings);
        }

        checkRequiredFields(document, errors, warnings);
        if (!errors.isEmpty()) {
            log.debug("Validation stopped at required fields: {} errors", errors.size());
            return ValidationResult.of(errors, warnings);
        }

        JsonNode model = document.get(OpenCmFormat.KEY_MODEL);
        checkModelSection(model, errors, warnings);

        JsonNode variables = document.get(OpenCmFormat.KEY_VARIABLES);
        Set<String> variableNames = checkVariables(variables, errors);

        JsonNode edges = document.get(OpenCmFormat.KEY_EDGES);
        checkEdges(edges, variableNames, errors, warnings);

        JsonNode equations = document.get(OpenCmFormat.KEY_EQUATIONS);
        if (equations != null && !equations.isNull() && !(equations.isContainerNode() && equations.isEmpty())) {
            checkEquations(equations, variableNames, errors, warnings);
        }

        boolean allowCycles = model.path("allow_cycles").booleanValue();
        if (!allowCycles) {
            checkAcyclicity(edges, errors);
        } else {
            warnings.add("Cyclic graph allowed; ensure an iterative solver is used");
        }

        checkAssumptions(document.get(OpenCmFormat.KEY_ASSUMPTIONS), errors, warnings);

        log.debug("Validation complete: {} errors, {} warnings", errors.size(), warnings.size());
        return ValidationResult.of(errors, warnings);
    }

    private void checkRequiredFields(JsonNode document, List<String> errors, List<String> warnings) {
        for (String field : OpenCmFormat.REQUIRED_KEYS) {
            if (!document.has(field)) {
                errors.add("Missing required field: '" + field + "'");
            }
        }
        JsonNode version = document.get(OpenCmFormat.KEY_VERSION);
        if (version != null && !(version.isTextual() && version.asText().equals(supportedVersion))) {
            warnings.add("Model uses OpenCM version " + describe(version) + ", current is " + supportedVersion);
        }
    }

    private static void checkModelSection(JsonNode model, List<String> errors, List<String> warnings) {
        if (!model.isObject()) {
            errors.add("Section 'model' must be an object, got: " + describe(model));
            return;
        }
        for (String field : List.of("id", "name")) {
            if (!model.has(field)) {
                errors.add("Missing required model field: 'model." + field + "'");
            }
        }
        JsonNode id = model.get("id");
        if (id != null && !(id.isTextual() && OpenCmFormat.MODEL_ID_PATTERN.matcher(id.asText()).matches())) {
            errors.add("model.id must be lowercase alphanumeric with underscores, got: '" + describe(id) + "'");
        }
        JsonNode domain = model.get("domain");
        if (domain != null && !(domain.isTextual() && OpenCmFormat.DOMAINS.contains(domain.asText()))) {
            warnings.add("Unknown domain '" + describe(domain) + "' - valid: " + OpenCmFormat.DOMAINS);
        }
        JsonNode allowCycles = model.get("allow_cycles");
        if (allowCycles != null && !allowCycles.isNull() && !allowCycles.isBoolean()) {
            errors.add("model.allow_cycles must be true or false, got: " + allowCycles);
        }
    }

    private static Set<String> checkVariables(JsonNode variables, List<String> errors) {
        Set<String> names = new LinkedHashSet<>();
        if (!variables.isObject()) {
            errors.add("Section 'variables' must be an object, got: " + describe(variables));
            return names;
        }
        if (variables.isEmpty()) {
            errors.add("Model must have at least one variable");
            return names;
        }
        Iterator<Map.Entry<String, JsonNode>> it = variables.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            JsonNode def = entry.getValue();
            names.add(name);
            if (!def.isObject()) {
                errors.add("Variable '" + name + "' must be an object, got: " + describe(def));
                continue;
            }

            JsonNode type = def.get("type");
            String typeValue = type == null ? DEFAULT_VARIABLE_TYPE : type.isTextual() ? type.asText() : null;
            if (typeValue == null || !OpenCmFormat.VARIABLE_TYPES.contains(typeValue)) {
                errors.add("Variable '" + name + "' has invalid type '" + describe(type) + "' - valid: "
                        + OpenCmFormat.VARIABLE_TYPES);
            }

            JsonNode domain = def.get("domain");
            if (domain != null && !domain.isNull()) {
                if (!domain.isArray() || domain.size() != 2 || !domain.get(0).isNumber() || !domain.get(1).isNumber()) {
                    errors.add("Variable '" + name + "' domain must be [min, max], got: " + domain);
                } else if (!(domain.get(0).asDouble() < domain.get(1).asDouble())) {
                    errors.add("Variable '" + name + "' domain min (" + domain.get(0) + ") must be < max ("
                            + domain.get(1) + ")");
                }
            }
        }
        return names;
    }

    private static void checkEdges(JsonNode edges, Set<String> variableNames, List<String> errors, List<String> warnings) {
        if (!edges.isArray()) {
            errors.add("Section 'edges' must be a list, got: " + describe(edges));
            return;
        }
        for (int i = 0; i < edges.size(); i++) {
            JsonNode edge = edges.get(i);
            if (!edge.isObject()) {
                errors.add("Edge " + i + " must be an object");
                continue;
            }

            String source = checkEndpoint(i, "source", edge.get("source"), variableNames, errors);
            String target = checkEndpoint(i, "target", edge.get("target"), variableNames, errors);
            if (source != null && source.equals(target)) {
                errors.add("Edge " + i + " is a self-loop (" + source + " -> " + source + ")");
            }

            JsonNode type = edge.get("type");
            String typeValue = type == null ? DEFAULT_EDGE_TYPE : type.isTextual() ? type.asText() : null;
            if (typeValue == null || !OpenCmFormat.EDGE_TYPES.contains(typeValue)) {
                warnings.add("Edge " + i + " has unknown type '" + describe(type) + "' - valid: " + OpenCmFormat.EDGE_TYPES);
            }

            JsonNode strength = edge.get("strength");
            if (strength != null) {
                double value = strength.asDouble();
                if (!strength.isNumber() || !(value >= -1.0 && value <= 1.0)) {
                    errors.add("Edge " + i + " strength must be in [-1, 1], got: " + strength);
                }
            }
        }
    }

    /** Returns the endpoint name when it is a non-empty string, otherwise null; records reference errors. */
    private static String checkEndpoint(int index, String role, JsonNode node, Set<String> variableNames, List<String> errors) {
        if (node == null || node.isNull() || (node.isTextual() && node.asText().isEmpty())) {
            errors.add("Edge " + index + " missing '" + role + "'");
            return null;
        }
        if (!node.isTextual()) {
            errors.add("Edge " + index + " " + role + " must be a variable name, got: " + node);
            return null;
        }
        String name = node.asText();
        if (!variableNames.contains(name)) {
            errors.add("Edge " + index + " " + role + " '" + name + "' not in variables");
        }
        return name;
    }

    private static void checkEquations(JsonNode equations, Set<String> variableNames, List<String> errors, List<String> warnings) {
        if (!equations.isObject()) {
            errors.add("Section 'structural_equations' must be an object, got: " + describe(equations));
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = equations.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String target = entry.getKey();
            JsonNode equation = entry.getValue();
            if (!variableNames.contains(target)) {
                errors.add("Equation target '" + target + "' not in variables");
            }
            if (equation.isTextual()) {
                continue;
            }
            if (!equation.isObject()) {
                errors.add("Equation for '" + target + "' must be an expression string or an object, got: " + describe(equation));
                continue;
            }
            JsonNode type = equation.get("type");
            String typeValue = type == null ? DEFAULT_EQUATION_TYPE : type.isTextual() ? type.asText() : null;
            if (typeValue == null || !OpenCmFormat.EQUATION_TYPES.contains(typeValue)) {
                warnings.add("Equation for '" + target + "' has unknown type '" + describe(type) + "'");
            }
        }
    }

    private static void checkAcyclicity(JsonNode edges, List<String> errors) {
        if (!edges.isArray()) return;
        CycleDetector graph = new CycleDetector();
        for (JsonNode edge : edges) {
            JsonNode source = edge.get("source");
            JsonNode target = edge.get("target");
            if (source != null && target != null && source.isTextual() && target.isTextual()) {
                graph.arc(source.asText(), target.asText());
            }
        }
        List<List<String>> cycles = graph.findCycles(MAX_REPORTED_CYCLES);
        if (!cycles.isEmpty()) {
            String listed = cycles.stream()
                    .map(cycle -> String.join(" -> ", cycle))
                    .collect(Collectors.joining("; "));
            errors.add("Graph contains cycles: " + listed);
        }
    }

    private static void checkAssumptions(JsonNode assumptions, List<String> errors, List<String> warnings) {
        if (assumptions != null && !assumptions.isNull() && !assumptions.isArray()) {
            errors.add("Section 'assumptions' must be a list of strings, got: " + describe(assumptions));
            return;
        }
        if (assumptions == null || assumptions.isNull() || assumptions.isEmpty()) {
            warnings.add("No assumptions listed; models should be transparent about their assumptions");
        }
    }

    /** Text form of a value for messages: strings unquoted, anything else as JSON. */
    private static String describe(JsonNode node) {
        if (node == null) return "null";
        return node.isTextual() ? node.asText() : node.toString();
    }
}
