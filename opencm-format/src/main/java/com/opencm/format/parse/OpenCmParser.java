package com.opencm.format.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencm.format.OpenCmFormat;
import com.opencm.format.OpenCmFormatException;
import com.opencm.format.OpenCmJson;
import com.opencm.model.CausalModel;
import com.opencm.model.Edge;
import com.opencm.model.EdgeType;
import com.opencm.model.Equation;
import com.opencm.model.EquationType;
import com.opencm.model.ModelMetadata;
import com.opencm.model.ValidationRequirements;
import com.opencm.model.ValueDomain;
import com.opencm.model.Variable;
import com.opencm.model.VariableType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a validated OpenCM JSON tree into a {@link CausalModel}, filling the documented default for
 * every absent optional field.
 * <p>
 * The parser does not validate. Run {@link com.opencm.format.validation.OpenCmValidator} first;
 * the only failure here is {@link OpenCmFormatException} for a field present with the wrong shape.
 */
public final class OpenCmParser {

    private OpenCmParser() {
    }

    public static CausalModel parse(JsonNode document) {
        return parse(document, null);
    }

    /**
     * @param document validated OpenCM document
     * @param origin   file the document was read from; kept on the model as provenance only (may be null)
     */
    public static CausalModel parse(JsonNode document, Path origin) {
        if (document == null || !document.isObject()) {
            throw new OpenCmFormatException("OpenCM document must be a JSON object");
        }
        JsonNode model = objectOrEmpty(document, OpenCmFormat.KEY_MODEL);

        CausalModel.Builder builder = CausalModel.builder(
                        text(model, "id", "unknown"),
                        text(model, "name", "Unknown Model"))
                .version(text(model, "version", CausalModel.DEFAULT_VERSION))
                .domain(text(model, "domain", CausalModel.DEFAULT_DOMAIN))
                .description(text(model, "description", ""))
                .allowCycles(bool(model, "allow_cycles", false))
                .assumptions(stringList(document, OpenCmFormat.KEY_ASSUMPTIONS))
                .origin(origin);

        Iterator<Map.Entry<String, JsonNode>> variables = objectOrEmpty(document, OpenCmFormat.KEY_VARIABLES).fields();
        while (variables.hasNext()) {
            Map.Entry<String, JsonNode> entry = variables.next();
            builder.variable(parseVariable(entry.getKey(), entry.getValue()));
        }

        JsonNode edges = document.get(OpenCmFormat.KEY_EDGES);
        if (edges != null && !edges.isNull()) {
            if (!edges.isArray()) throw shapeError(OpenCmFormat.KEY_EDGES, "a list");
            for (JsonNode edge : edges) {
                builder.edge(parseEdge(edge));
            }
        }

        Iterator<Map.Entry<String, JsonNode>> equations = objectOrEmpty(document, OpenCmFormat.KEY_EQUATIONS).fields();
        while (equations.hasNext()) {
            Map.Entry<String, JsonNode> entry = equations.next();
            builder.equation(parseEquation(entry.getKey(), entry.getValue()));
        }

        JsonNode validation = document.get(OpenCmFormat.KEY_VALIDATION);
        if (validation != null && !validation.isNull() && !(validation.isObject() && validation.isEmpty())) {
            builder.validation(parseValidation(validation));
        }
        JsonNode metadata = document.get(OpenCmFormat.KEY_METADATA);
        if (metadata != null && !metadata.isNull()) {
            builder.metadata(parseMetadata(metadata));
        }
        return builder.build();
    }

    static Variable parseVariable(String name, JsonNode def) {
        if (!def.isObject()) throw shapeError("variables." + name, "an object");
        return Variable.builder(name)
                .type(VariableType.fromValue(text(def, "type", null)))
                .domain(parseDomain(name, def.get("domain")))
                .unit(text(def, "unit", ""))
                .description(text(def, "description", ""))
                .observed(bool(def, "observed", true))
                .defaultValue(optionalNumber(def, "default_value"))
                .categories(optionalStringList(def, "categories"))
                .build();
    }

    private static ValueDomain parseDomain(String variable, JsonNode domain) {
        if (domain == null || domain.isNull()) return ValueDomain.UNIT;
        if (!domain.isArray() || domain.size() != 2 || !domain.get(0).isNumber() || !domain.get(1).isNumber()) {
            throw shapeError("variables." + variable + ".domain", "[min, max]");
        }
        return new ValueDomain(domain.get(0).doubleValue(), domain.get(1).doubleValue());
    }

    static Edge parseEdge(JsonNode edge) {
        if (!edge.isObject()) throw shapeError("edges[]", "an object");
        String source = text(edge, "source", null);
        String target = text(edge, "target", null);
        if (source == null || target == null) {
            throw new OpenCmFormatException("Edge is missing 'source' or 'target'");
        }
        return new Edge(
                source,
                target,
                EdgeType.DEFAULT,
                number(edge, "strength", Edge.DEFAULT_STRENGTH),
                text(edge, "description", ""),
                number(edge, "confidence", Edge.DEFAULT_CONFIDENCE),
                bool(edge, "is_learned", false))
                .withTypeValue(text(edge, "type", null));
    }

    /** A bare string is a linear expression with default noise; an object supplies its own fields. */
    static Equation parseEquation(String target, JsonNode equation) {
        if (equation.isTextual()) {
            return Equation.linear(target, equation.asText());
        }
        if (!equation.isObject()) throw shapeError("structural_equations." + target, "a string or an object");
        return new Equation(
                target,
                EquationType.DEFAULT,
                text(equation, "expression", ""),
                text(equation, "noise_distribution", Equation.DEFAULT_NOISE_DISTRIBUTION),
                noiseParams(target, equation.get("noise_params")))
                .withTypeValue(text(equation, "type", null));
    }

    private static Map<String, Double> noiseParams(String target, JsonNode params) {
        if (params == null || params.isNull()) return Equation.DEFAULT_NOISE_PARAMS;
        if (!params.isObject()) throw shapeError("structural_equations." + target + ".noise_params", "an object");
        Map<String, Double> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = params.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getValue().isNumber()) {
                throw shapeError("structural_equations." + target + ".noise_params." + entry.getKey(), "a number");
            }
            result.put(entry.getKey(), entry.getValue().doubleValue());
        }
        return result;
    }

    private static ValidationRequirements parseValidation(JsonNode validation) {
        if (!validation.isObject()) throw shapeError(OpenCmFormat.KEY_VALIDATION, "an object");
        JsonNode min = validation.get("min_data_points");
        int minDataPoints = ValidationRequirements.DEFAULT_MIN_DATA_POINTS;
        if (min != null && !min.isNull()) {
            if (!min.canConvertToInt() || !min.isIntegralNumber()) throw shapeError("validation.min_data_points", "an integer");
            minDataPoints = min.intValue();
        }
        return new ValidationRequirements(
                minDataPoints,
                stringList(validation, "required_variables"),
                stringList(validation, "suggested_datasets"));
    }

    private static ModelMetadata parseMetadata(JsonNode metadata) {
        if (!metadata.isObject()) throw shapeError(OpenCmFormat.KEY_METADATA, "an object");
        return new ModelMetadata(
                text(metadata, "author", ""),
                text(metadata, "citation", ""),
                text(metadata, "license", ModelMetadata.DEFAULT_LICENSE),
                stringList(metadata, "tags"),
                text(metadata, "created_at", ""),
                text(metadata, "updated_at", ""),
                text(metadata, "source_url", ""),
                text(metadata, "adaptation_notes", ""));
    }

    // --- field readers: absent or null means default, wrong shape throws ---

    private static JsonNode objectOrEmpty(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return OpenCmJson.newObject();
        if (!node.isObject()) throw shapeError(field, "an object");
        return node;
    }

    private static String text(JsonNode parent, String field, String defaultValue) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return defaultValue;
        if (!node.isTextual()) throw shapeError(field, "a string");
        return node.asText();
    }

    private static double number(JsonNode parent, String field, double defaultValue) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return defaultValue;
        if (!node.isNumber()) throw shapeError(field, "a number");
        return node.doubleValue();
    }

    private static Double optionalNumber(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isNumber()) throw shapeError(field, "a number");
        return node.doubleValue();
    }

    private static boolean bool(JsonNode parent, String field, boolean defaultValue) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return defaultValue;
        if (!node.isBoolean()) throw shapeError(field, "a boolean");
        return node.booleanValue();
    }

    private static List<String> stringList(JsonNode parent, String field) {
        List<String> list = optionalStringList(parent, field);
        return list != null ? list : List.of();
    }

    private static List<String> optionalStringList(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isArray()) throw shapeError(field, "a list of strings");
        List<String> result = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) throw shapeError(field, "a list of strings");
            result.add(element.asText());
        }
        return result;
    }

    private static OpenCmFormatException shapeError(String field, String expected) {
        return new OpenCmFormatException("Field '" + field + "' must be " + expected);
    }
}
