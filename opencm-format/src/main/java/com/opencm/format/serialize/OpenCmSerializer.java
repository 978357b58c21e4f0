package com.opencm.format.serialize;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opencm.format.OpenCmFormat;
import com.opencm.format.OpenCmJson;
import com.opencm.model.CausalModel;
import com.opencm.model.Edge;
import com.opencm.model.Equation;
import com.opencm.model.ModelMetadata;
import com.opencm.model.ValidationRequirements;
import com.opencm.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link CausalModel} as an OpenCM JSON tree, the inverse of
 * {@link com.opencm.format.parse.OpenCmParser}. Defaults are omitted for compact output:
 * <ul>
 *   <li>variable description, default value and categories only when set</li>
 *   <li>edge description when non-empty, confidence when not 1.0, {@code is_learned} only when true</li>
 *   <li>an equation as a bare expression string when {@link Equation#isSimpleForm()}, otherwise as a record</li>
 *   <li>{@code validation} and {@code metadata} only when the model has them</li>
 * </ul>
 */
public final class OpenCmSerializer {

    private static final Logger log = LoggerFactory.getLogger(OpenCmSerializer.class);

    private OpenCmSerializer() {
    }

    public static ObjectNode serialize(CausalModel model) {
        ObjectNode root = OpenCmJson.newObject();
        root.put(OpenCmFormat.KEY_VERSION, OpenCmFormat.VERSION);

        ObjectNode identity = root.putObject(OpenCmFormat.KEY_MODEL);
        identity.put("id", model.getId());
        identity.put("name", model.getName());
        identity.put("version", model.getVersion());
        identity.put("domain", model.getDomain());
        identity.put("description", model.getDescription());
        if (model.isAllowCycles()) {
            identity.put("allow_cycles", true);
        }

        ObjectNode variables = root.putObject(OpenCmFormat.KEY_VARIABLES);
        for (Variable variable : model.getVariables().values()) {
            writeVariable(variables.putObject(variable.getName()), variable);
        }

        ArrayNode edges = root.putArray(OpenCmFormat.KEY_EDGES);
        for (Edge edge : model.getEdges()) {
            writeEdge(edges.addObject(), edge);
        }

        ObjectNode equations = root.putObject(OpenCmFormat.KEY_EQUATIONS);
        for (Map.Entry<String, Equation> entry : model.getEquations().entrySet()) {
            Equation equation = entry.getValue();
            if (equation.isSimpleForm()) {
                equations.put(entry.getKey(), equation.getExpression());
            } else {
                writeEquation(equations.putObject(entry.getKey()), equation);
            }
        }

        putStrings(root.putArray(OpenCmFormat.KEY_ASSUMPTIONS), model.getAssumptions());

        model.getValidation().ifPresent(v -> writeValidation(root.putObject(OpenCmFormat.KEY_VALIDATION), v));
        model.getMetadata().ifPresent(m -> writeMetadata(root.putObject(OpenCmFormat.KEY_METADATA), m));
        return root;
    }

    /** Serializes to indented JSON text. */
    public static String toJson(CausalModel model) {
        return toJson(model, true);
    }

    public static String toJson(CausalModel model, boolean pretty) {
        return OpenCmJson.write(serialize(model), pretty);
    }

    /** Saves as indented JSON; see {@link #save(CausalModel, Path, boolean)}. */
    public static Path save(CausalModel model, Path path) throws IOException {
        return save(model, path, true);
    }

    /**
     * Writes the model to {@code path} (should end with {@value OpenCmFormat#FILE_EXTENSION}),
     * creating missing parent directories.
     *
     * @return absolute path of the written file
     */
    public static Path save(CausalModel model, Path path, boolean pretty) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(absolute, toJson(model, pretty), StandardCharsets.UTF_8);
        log.info("[OpenCM] Saved model '{}' to {}", model.getId(), absolute);
        return absolute;
    }

    private static void writeVariable(ObjectNode node, Variable variable) {
        node.put("type", variable.getType().toValue());
        ArrayNode domain = node.putArray("domain");
        domain.add(variable.getDomain().min());
        domain.add(variable.getDomain().max());
        node.put("unit", variable.getUnit());
        node.put("observed", variable.isObserved());
        if (!variable.getDescription().isEmpty()) {
            node.put("description", variable.getDescription());
        }
        variable.getDefaultValue().ifPresent(v -> node.put("default_value", v));
        variable.getCategories().ifPresent(categories -> putStrings(node.putArray("categories"), categories));
    }

    private static void writeEdge(ObjectNode node, Edge edge) {
        node.put("source", edge.getSource());
        node.put("target", edge.getTarget());
        node.put("type", edge.getTypeValue());
        node.put("strength", edge.getStrength());
        if (!edge.getDescription().isEmpty()) {
            node.put("description", edge.getDescription());
        }
        if (edge.getConfidence() != Edge.DEFAULT_CONFIDENCE) {
            node.put("confidence", edge.getConfidence());
        }
        if (edge.isLearned()) {
            node.put("is_learned", true);
        }
    }

    private static void writeEquation(ObjectNode node, Equation equation) {
        node.put("type", equation.getTypeValue());
        node.put("expression", equation.getExpression());
        node.put("noise_distribution", equation.getNoiseDistribution());
        ObjectNode params = node.putObject("noise_params");
        equation.getNoiseParams().forEach(params::put);
    }

    private static void writeValidation(ObjectNode node, ValidationRequirements validation) {
        node.put("min_data_points", validation.getMinDataPoints());
        putStrings(node.putArray("required_variables"), validation.getRequiredVariables());
        putStrings(node.putArray("suggested_datasets"), validation.getSuggestedDatasets());
    }

    private static void writeMetadata(ObjectNode node, ModelMetadata metadata) {
        node.put("author", metadata.getAuthor());
        node.put("citation", metadata.getCitation());
        node.put("license", metadata.getLicense());
        putStrings(node.putArray("tags"), metadata.getTags());
        putIfNotEmpty(node, "created_at", metadata.getCreatedAt());
        putIfNotEmpty(node, "updated_at", metadata.getUpdatedAt());
        putIfNotEmpty(node, "source_url", metadata.getSourceUrl());
        putIfNotEmpty(node, "adaptation_notes", metadata.getAdaptationNotes());
    }

    private static void putIfNotEmpty(ObjectNode node, String field, String value) {
        if (!value.isEmpty()) {
            node.put(field, value);
        }
    }

    private static void putStrings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }
}
