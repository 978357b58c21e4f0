package com.opencm.format.load;

import com.opencm.config.OpenCmConfig;
import com.opencm.format.OpenCmFormatException;
import com.opencm.format.validation.OpenCmValidationException;
import com.opencm.format.validation.ValidationResult;
import com.opencm.model.CausalModel;
import com.opencm.model.Edge;
import com.opencm.model.Variable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenCmLoaderTest {

    private static final String MINIMAL_JSON = """
            {
              "opencm_version": "1.0",
              "model": { "id": "m1", "name": "M" },
              "variables": { "a": {}, "b": {} },
              "edges": [ { "source": "a", "target": "b", "strength": 0.7 } ]
            }
            """;

    private static final String INVALID_JSON = """
            {
              "opencm_version": "1.0",
              "model": { "id": "bad", "name": "Bad" },
              "variables": { "a": { "type": "fuzzy" }, "b": {} },
              "edges": [
                { "source": "a", "target": "Ghost" },
                { "source": "b", "target": "b" }
              ]
            }
            """;

    private final OpenCmLoader loader = new OpenCmLoader();

    private static Path write(Path dir, String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /** Minimal document whose model name contains the byte pair C3 28, which is not valid UTF-8. */
    private static Path writeInvalidUtf8(Path dir, String name) throws Exception {
        byte[] prefix = MINIMAL_JSON.substring(0, MINIMAL_JSON.indexOf("\"M\"") + 2).getBytes(StandardCharsets.UTF_8);
        byte[] suffix = MINIMAL_JSON.substring(MINIMAL_JSON.indexOf("\"M\"") + 2).getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[prefix.length + 2 + suffix.length];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        content[prefix.length] = (byte) 0xC3;
        content[prefix.length + 1] = (byte) 0x28;
        System.arraycopy(suffix, 0, content, prefix.length + 2, suffix.length);
        Path file = dir.resolve(name);
        Files.write(file, content);
        return file;
    }

    @Test
    void load_validFileReturnsModelWithOrigin(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "m1.opencm.json", MINIMAL_JSON);

        CausalModel model = loader.load(file);

        assertEquals("m1", model.getId());
        assertEquals(2, model.nodeCount());
        assertEquals(1, model.edgeCount());
        assertEquals(file, model.getOrigin().orElseThrow());
    }

    @Test
    void load_fixtureFromResources() throws Exception {
        Path file = Path.of(getClass().getResource("/models/porter_five_forces.opencm.json").toURI());

        CausalModel model = loader.load(file);

        assertEquals("porter_five_forces", model.getId());
        assertEquals("strategy", model.getDomain());
        assertEquals(6, model.nodeCount());
        assertEquals(5, model.edgeCount());
        assertEquals("Porter Five Forces (strategy) - 6 vars, 5 edges", model.summary());
        assertEquals(40, model.getValidation().orElseThrow().getMinDataPoints());
    }

    @Test
    void load_missingFileThrowsNoSuchFile(@TempDir Path tempDir) {
        assertThrows(NoSuchFileException.class, () -> loader.load(tempDir.resolve("absent.opencm.json")));
        assertThrows(NoSuchFileException.class, () -> loader.load(tempDir));
    }

    @Test
    void load_malformedJsonThrowsFormatException(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "broken.opencm.json", """
                { "opencm_version": "1.0",\s""");

        OpenCmFormatException e = assertThrows(OpenCmFormatException.class, () -> loader.load(file));

        assertTrue(e.getMessage().contains("broken.opencm.json"));
    }

    @Test
    void load_emptyFileThrowsFormatException(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "empty.opencm.json", "");

        assertThrows(OpenCmFormatException.class, () -> loader.load(file));
    }

    @Test
    void load_invalidUtf8IsMalformedInputNotIoError(@TempDir Path tempDir) throws Exception {
        Path file = writeInvalidUtf8(tempDir, "garbled.opencm.json");

        OpenCmFormatException e = assertThrows(OpenCmFormatException.class, () -> loader.load(file));

        assertTrue(e.getMessage().contains("garbled.opencm.json"));
        assertThrows(OpenCmFormatException.class, () -> loader.validateOnly(file));
    }

    @Test
    void load_invalidDocumentReportsEveryError(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "bad.opencm.json", INVALID_JSON);

        OpenCmValidationException e = assertThrows(OpenCmValidationException.class, () -> loader.load(file));

        List<String> errors = e.getValidationResult().getErrors();
        assertTrue(errors.size() >= 3, errors.toString());
        assertTrue(e.getMessage().startsWith("OpenCM validation failed for " + file));
        for (String error : errors) {
            assertTrue(e.getMessage().contains(error), error);
        }
    }

    @Test
    void load_warningsDoNotFail(@TempDir Path tempDir) throws Exception {
        Path file = write(tempDir, "old.opencm.json", MINIMAL_JSON.replace("\"1.0\"", "\"0.8\""));
        OpenCmLoader quiet = new OpenCmLoader(OpenCmConfig.builder().logWarnings(false).build());

        assertEquals("m1", quiet.load(file).getId());
        assertEquals("m1", loader.load(file).getId());
    }

    @Test
    void validateOnly_returnsVerdictWithoutThrowing(@TempDir Path tempDir) throws Exception {
        Path good = write(tempDir, "good.opencm.json", MINIMAL_JSON);
        Path bad = write(tempDir, "bad.opencm.json", MINIMAL_JSON.replace("\"target\": \"b\"", "\"target\": \"Ghost\""));

        ValidationResult goodResult = loader.validateOnly(good);
        ValidationResult badResult = loader.validateOnly(bad);

        assertTrue(goodResult.isValid());
        assertEquals(1, goodResult.getWarnings().size());
        assertFalse(badResult.isValid());
        assertEquals(List.of("Edge 0 target 'Ghost' not in variables"), badResult.getErrors());
    }

    @Test
    void save_thenLoadReturnsEqualModel(@TempDir Path tempDir) throws Exception {
        CausalModel model = CausalModel.builder("retention", "Retention")
                .variable(Variable.of("Onboarding"))
                .variable(Variable.of("Churn"))
                .edge(Edge.causes("Onboarding", "Churn", -0.4))
                .assumptions(List.of("Onboarding quality is measured consistently"))
                .build();

        Path written = loader.save(model, tempDir.resolve("lib/retention.opencm.json"));
        CausalModel reloaded = loader.load(written);

        assertTrue(written.isAbsolute());
        assertEquals(model, reloaded);
        assertEquals(written, reloaded.getOrigin().orElseThrow());
    }

    @Test
    void save_compactWhenPrettyPrintDisabled(@TempDir Path tempDir) throws Exception {
        OpenCmLoader compact = new OpenCmLoader(OpenCmConfig.builder().prettyPrint(false).build());
        CausalModel model = CausalModel.builder("m", "M").variable(Variable.of("a")).build();

        Path written = compact.save(model, tempDir.resolve("m.opencm.json"));

        assertFalse(Files.readString(written, StandardCharsets.UTF_8).contains("\n"));
    }
}
