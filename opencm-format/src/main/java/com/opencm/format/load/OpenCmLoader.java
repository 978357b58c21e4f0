package com.opencm.format.load;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencm.config.OpenCmConfig;
import com.opencm.format.OpenCmFormatException;
import com.opencm.format.OpenCmJson;
import com.opencm.format.parse.OpenCmParser;
import com.opencm.format.serialize.OpenCmSerializer;
import com.opencm.format.validation.OpenCmValidationException;
import com.opencm.format.validation.OpenCmValidator;
import com.opencm.format.validation.ValidationResult;
import com.opencm.model.CausalModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads, validates and writes {@code *.opencm.json} files.
 * <p>
 * {@link #load} reads the file, parses the JSON, validates it and only then builds the model; every
 * validation error is reported at once in an {@link OpenCmValidationException}, while warnings are
 * logged (if {@link OpenCmConfig#isLogWarnings()}) and never thrown. {@link #validateOnly} returns the
 * verdict without building a model.
 */
public final class OpenCmLoader {

    private static final Logger log = LoggerFactory.getLogger(OpenCmLoader.class);

    private final OpenCmConfig config;
    private final OpenCmValidator validator;

    public OpenCmLoader() {
        this(OpenCmConfig.defaults());
    }

    public OpenCmLoader(OpenCmConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.validator = OpenCmValidator.forConfig(config);
    }

    public OpenCmConfig getConfig() {
        return config;
    }

    /**
     * Loads and validates an OpenCM model file.
     *
     * @param path path to a {@code .opencm.json} file
     * @return the validated model, with {@code path} as its origin
     * @throws NoSuchFileException         if the file does not exist
     * @throws IOException                 if the file cannot be read
     * @throws OpenCmFormatException       if the content is not valid JSON or a field has the wrong shape
     * @throws OpenCmValidationException   if the document fails validation (carries all errors)
     */
    public CausalModel load(Path path) throws IOException {
        JsonNode document = readDocument(path);
        ValidationResult result = validator.validate(document).orThrow(path.toString());
        if (config.isLogWarnings()) {
            for (String warning : result.getWarnings()) {
                log.warn("[OpenCM] {}: {}", path, warning);
            }
        }
        CausalModel model = OpenCmParser.parse(document, path);
        log.info("[OpenCM] Loaded model '{}' from {}: {}", model.getId(), path, model.summary());
        return model;
    }

    /**
     * Validates an OpenCM file without building a model.
     *
     * @throws NoSuchFileException   if the file does not exist
     * @throws OpenCmFormatException if the content is not valid JSON
     */
    public ValidationResult validateOnly(Path path) throws IOException {
        return validator.validate(readDocument(path));
    }

    /**
     * Saves the model, creating parent directories; indentation follows {@link OpenCmConfig#isPrettyPrint()}.
     *
     * @return absolute path of the written file
     */
    public Path save(CausalModel model, Path path) throws IOException {
        return OpenCmSerializer.save(model, path, config.isPrettyPrint());
    }

    /**
     * Reads and parses the file as JSON (no validation).
     *
     * @throws NoSuchFileException   if the file does not exist
     * @throws OpenCmFormatException if the bytes are not valid JSON text, including undecodable UTF-8
     */
    public JsonNode readDocument(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "OpenCM file not found");
        }
        return OpenCmJson.readTree(Files.readAllBytes(path), path.toString());
    }
}
