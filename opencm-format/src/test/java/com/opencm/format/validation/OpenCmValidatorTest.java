package com.opencm.format.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencm.format.OpenCmJson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenCmValidatorTest {

    private static final String MINIMAL_JSON = """
            {
              "opencm_version": "1.0",
              "model": { "id": "m1", "name": "M" },
              "variables": { "a": {}, "b": {} },
              "edges": [ { "source": "a", "target": "b", "strength": 0.7 } ]
            }
            """;

    /** Document with one assumption; %1$s extends the model section, %2$s is variables, %3$s is edges. */
    private static final String TEMPLATE_JSON = """
            {
              "opencm_version": "1.0",
              "model": { "id": "m1", "name": "M"%1$s },
              "variables": %2$s,
              "edges": %3$s,
              "assumptions": [ "x" ]
            }
            """;

    private static final String TWO_CYCLE_EDGES = """
            [
              { "source": "A", "target": "B" },
              { "source": "B", "target": "A" }
            ]
            """;

    private static final String NO_ASSUMPTIONS_WARNING =
            "No assumptions listed; models should be transparent about their assumptions";

    private final OpenCmValidator validator = new OpenCmValidator();

    private static JsonNode json(String text) {
        return OpenCmJson.readTree(text, "test");
    }

    private static JsonNode doc(String modelExtra, String variables, String edges) {
        return json(TEMPLATE_JSON.formatted(modelExtra, variables, edges));
    }

    private static JsonNode withEdge(String edge) {
        return doc("", """
                { "a": {}, "b": {} }""", "[" + edge + "]");
    }

    private static boolean anyContains(List<String> messages, String... fragments) {
        return messages.stream().anyMatch(m -> {
            for (String f : fragments) {
                if (!m.contains(f)) return false;
            }
            return true;
        });
    }

    @Test
    void minimalDocument_validWithOnlyAssumptionsWarning() {
        ValidationResult result = validator.validate(json(MINIMAL_JSON));

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertEquals(List.of(NO_ASSUMPTIONS_WARNING), result.getWarnings());
    }

    @Test
    void missingEdges_reportsOnlyMissingFieldErrors() {
        ValidationResult result = validator.validate(json("""
                {
                  "opencm_version": "1.0",
                  "model": { "id": "BAD ID" },
                  "variables": {}
                }
                """));

        assertFalse(result.isValid());
        assertEquals(List.of("Missing required field: 'edges'"), result.getErrors());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void missingSeveralFields_reportsEachInOrder() {
        ValidationResult result = validator.validate(json("""
                { "model": {} }
                """));

        assertEquals(List.of(
                "Missing required field: 'opencm_version'",
                "Missing required field: 'variables'",
                "Missing required field: 'edges'"), result.getErrors());
    }

    @Test
    void nonObjectDocument_isAnErrorNotAnException() {
        ValidationResult result = validator.validate(json("[1, 2]"));

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertFalse(validator.validate(null).isValid());
    }

    @Test
    void versionMismatch_isWarningOnly() {
        ValidationResult result = validator.validate(json(MINIMAL_JSON.replace("\"1.0\"", "\"0.9\"")));

        assertTrue(result.isValid());
        assertTrue(result.getWarnings().contains("Model uses OpenCM version 0.9, current is 1.0"));
    }

    @Test
    void supportedVersion_comesFromConstructor() {
        ValidationResult result = new OpenCmValidator("2.0").validate(json(MINIMAL_JSON));

        assertTrue(result.getWarnings().contains("Model uses OpenCM version 1.0, current is 2.0"));
    }

    @Test
    void modelSection_requiresIdAndName() {
        ValidationResult missing = validator.validate(json("""
                {
                  "opencm_version": "1.0",
                  "model": {},
                  "variables": { "a": {} },
                  "edges": []
                }
                """));

        assertTrue(missing.getErrors().contains("Missing required model field: 'model.id'"));
        assertTrue(missing.getErrors().contains("Missing required model field: 'model.name'"));
    }

    @Test
    void modelId_mustBeLowercaseIdentifier() {
        for (String badId : List.of("Pricing", "1model", "my-model", "")) {
            JsonNode document = json(MINIMAL_JSON.replace("\"m1\"", "\"" + badId + "\""));
            assertTrue(anyContains(validator.validate(document).getErrors(), "model.id must be lowercase"), badId);
        }
        assertTrue(validator.validate(json(MINIMAL_JSON.replace("\"m1\"", "\"pricing_v2\""))).isValid());
    }

    @Test
    void unknownDomain_isWarningOnly() {
        ValidationResult result = validator.validate(doc(", \"domain\": \"astrology\"", "{ \"a\": {} }", "[]"));

        assertTrue(result.isValid());
        assertTrue(anyContains(result.getWarnings(), "Unknown domain 'astrology'", "supply_chain"));
        assertTrue(validator.validate(doc(", \"domain\": \"finance\"", "{ \"a\": {} }", "[]")).getWarnings().isEmpty());
    }

    @Test
    void emptyVariables_isError() {
        ValidationResult result = validator.validate(doc("", "{}", "[]"));

        assertEquals(List.of("Model must have at least one variable"), result.getErrors());
    }

    @Test
    void unknownVariableKind_listsValidKinds() {
        ValidationResult result = validator.validate(doc("", """
                { "a": { "type": "fuzzy" } }""", "[]"));

        assertFalse(result.isValid());
        assertTrue(anyContains(result.getErrors(), "'a'", "fuzzy", "[continuous, discrete, binary, categorical]"));
    }

    @Test
    void variableDomain_mustBeOrderedPairOfNumbers() {
        String variables = """
                { "a": { "domain": %s } }""";

        assertTrue(anyContains(validator.validate(doc("", variables.formatted("[1, 0]"), "[]")).getErrors(),
                "domain min (1) must be < max (0)"));
        assertTrue(anyContains(validator.validate(doc("", variables.formatted("[1, 1]"), "[]")).getErrors(),
                "must be < max"));
        assertTrue(anyContains(validator.validate(doc("", variables.formatted("[0]"), "[]")).getErrors(),
                "domain must be [min, max]"));
        assertTrue(anyContains(validator.validate(doc("", variables.formatted("[\"lo\", 1]"), "[]")).getErrors(),
                "domain must be [min, max]"));
        assertTrue(validator.validate(doc("", variables.formatted("[-5, 2.5]"), "[]")).isValid());
    }

    @Test
    void nonObjectVariable_isError() {
        ValidationResult result = validator.validate(doc("", "{ \"a\": 3 }", "[]"));

        assertTrue(anyContains(result.getErrors(), "Variable 'a' must be an object"));
    }

    @Test
    void edgeToUndeclaredVariable_namesIt() {
        ValidationResult result = validator.validate(withEdge("""
                { "source": "a", "target": "Ghost" }"""));

        assertFalse(result.isValid());
        assertEquals(List.of("Edge 0 target 'Ghost' not in variables"), result.getErrors());
    }

    @Test
    void edgeMissingEndpoints_isError() {
        ValidationResult result = validator.validate(doc("", "{ \"a\": {} }", """
                [
                  { "target": "a" },
                  { "source": "a", "target": "" }
                ]
                """));

        assertTrue(result.getErrors().contains("Edge 0 missing 'source'"));
        assertTrue(result.getErrors().contains("Edge 1 missing 'target'"));
    }

    @Test
    void selfLoop_isErrorEvenWhenCyclesAllowed() {
        String edges = """
                [ { "source": "a", "target": "a" } ]""";

        ValidationResult dag = validator.validate(doc("", "{ \"a\": {} }", edges));
        ValidationResult cyclic = validator.validate(doc(", \"allow_cycles\": true", "{ \"a\": {} }", edges));

        assertTrue(dag.getErrors().contains("Edge 0 is a self-loop (a -> a)"));
        assertFalse(cyclic.isValid());
        assertTrue(cyclic.getErrors().contains("Edge 0 is a self-loop (a -> a)"));
    }

    @Test
    void strengthOutsideRange_isError() {
        for (String strength : List.of("1.5", "-1.01", "2", "\"strong\"", "null", "true")) {
            ValidationResult result = validator.validate(withEdge("""
                    { "source": "a", "target": "b", "strength": %s }""".formatted(strength)));
            assertTrue(anyContains(result.getErrors(), "Edge 0 strength must be in [-1, 1]"), strength);
        }
    }

    @Test
    void strengthWithinRange_hasNoStrengthError() {
        for (String strength : List.of("-1", "-1.0", "0", "0.5", "1", "1.0")) {
            ValidationResult result = validator.validate(withEdge("""
                    { "source": "a", "target": "b", "strength": %s }""".formatted(strength)));
            assertTrue(result.isValid(), strength);
        }
    }

    @Test
    void unknownEdgeKind_isWarningOnly() {
        ValidationResult result = validator.validate(withEdge("""
                { "source": "a", "target": "b", "type": "blocks" }"""));

        assertTrue(result.isValid());
        assertTrue(anyContains(result.getWarnings(), "Edge 0 has unknown type 'blocks'", "inhibits"));
    }

    @Test
    void twoCycle_failsWhenCyclesNotAllowed() {
        ValidationResult result = validator.validate(doc("", "{ \"A\": {}, \"B\": {} }", TWO_CYCLE_EDGES));

        assertFalse(result.isValid());
        assertEquals(List.of("Graph contains cycles: A -> B -> A"), result.getErrors());
    }

    @Test
    void twoCycle_passesWithWarningWhenCyclesAllowed() {
        ValidationResult result = validator.validate(
                doc(", \"allow_cycles\": true", "{ \"A\": {}, \"B\": {} }", TWO_CYCLE_EDGES));

        assertTrue(result.isValid());
        assertEquals(List.of("Cyclic graph allowed; ensure an iterative solver is used"), result.getWarnings());
    }

    @Test
    void manyCycles_reportsAtMostThree() {
        JsonNode document = json("""
                {
                  "opencm_version": "1.0",
                  "model": { "id": "m1", "name": "M" },
                  "variables": { "a": {}, "b": {}, "c": {}, "d": {}, "e": {}, "f": {}, "g": {}, "h": {} },
                  "edges": [
                    { "source": "a", "target": "b" }, { "source": "b", "target": "a" },
                    { "source": "c", "target": "d" }, { "source": "d", "target": "c" },
                    { "source": "e", "target": "f" }, { "source": "f", "target": "e" },
                    { "source": "g", "target": "h" }, { "source": "h", "target": "g" }
                  ],
                  "assumptions": [ "x" ]
                }
                """);

        ValidationResult result = validator.validate(document);

        assertEquals(List.of("Graph contains cycles: a -> b -> a; c -> d -> c; e -> f -> e"), result.getErrors());
    }

    @Test
    void allowCycles_mustBeBoolean() {
        ValidationResult result = validator.validate(doc(", \"allow_cycles\": \"yes\"", "{ \"a\": {} }", "[]"));

        assertTrue(anyContains(result.getErrors(), "model.allow_cycles must be true or false"));
    }

    @Test
    void equations_checkTargetAndKindButNotExpression() {
        JsonNode document = json("""
                {"opencm_version":"1.0","model":{"id":"m1","name":"M"},
                 "variables":{"a":{},"b":{}},
                 "edges":[{"source":"a","target":"b"}],
                 "structural_equations":{
                   "b":"this is not ( parsed",
                   "a":{"type":"quantum","expression":"1"},
                   "Ghost":"0.5*a"
                 },
                 "assumptions":["x"]}
                """);

        ValidationResult result = validator.validate(document);

        assertEquals(List.of("Equation target 'Ghost' not in variables"), result.getErrors());
        assertEquals(List.of("Equation for 'a' has unknown type 'quantum'"), result.getWarnings());
    }

    @Test
    void equationOfWrongShape_isError() {
        JsonNode document = json("""
                {"opencm_version":"1.0","model":{"id":"m1","name":"M"},"variables":{"a":{}},"edges":[],
                 "structural_equations":{"a":42},"assumptions":["x"]}
                """);

        assertTrue(anyContains(validator.validate(document).getErrors(), "Equation for 'a' must be an expression string or an object"));
    }

    @Test
    void collectsEveryErrorInOnePass() {
        JsonNode document = json("""
                {"opencm_version":"1.0","model":{"id":"Bad","name":"M"},
                 "variables":{"a":{"type":"fuzzy"},"b":{"domain":[3,1]}},
                 "edges":[{"source":"a","target":"Ghost"},{"source":"b","target":"a","strength":9}]}
                """);

        ValidationResult result = validator.validate(document);

        assertEquals(5, result.getErrors().size(), result.getErrors().toString());
        assertTrue(result.getErrors().get(0).startsWith("model.id"));
        assertTrue(result.getErrors().get(1).startsWith("Variable 'a'"));
        assertTrue(result.getErrors().get(2).startsWith("Variable 'b'"));
        assertTrue(result.getErrors().get(3).startsWith("Edge 0 target"));
        assertTrue(result.getErrors().get(4).startsWith("Edge 1 strength"));
    }

    @Test
    void validate_doesNotLeakStateBetweenCalls() {
        ValidationResult bad = validator.validate(doc("", "{}", "[]"));
        ValidationResult good = validator.validate(json(MINIMAL_JSON));

        assertFalse(bad.isValid());
        assertTrue(good.isValid());
        assertEquals(1, bad.getErrors().size());
        assertThrows(UnsupportedOperationException.class, () -> good.getWarnings().add("x"));
    }

    @Test
    void orThrow_bundlesAllErrors() {
        ValidationResult result = validator.validate(doc("", """
                { "a": { "type": "fuzzy" } }""", """
                [ { "source": "a", "target": "Ghost" } ]"""));

        OpenCmValidationException e = assertThrows(OpenCmValidationException.class, () -> result.orThrow("m1.opencm.json"));

        assertTrue(e.getMessage().startsWith("OpenCM validation failed for m1.opencm.json:\n"));
        for (String error : result.getErrors()) {
            assertTrue(e.getMessage().contains(error));
        }
        assertSame(result, e.getValidationResult());
    }
}
