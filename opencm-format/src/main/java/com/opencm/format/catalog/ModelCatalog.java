package com.opencm.format.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencm.format.OpenCmFormat;
import com.opencm.format.OpenCmFormatException;
import com.opencm.format.load.OpenCmLoader;
import com.opencm.format.validation.OpenCmValidationException;
import com.opencm.model.CausalModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Model library backed by a directory of {@code *.opencm.json} files (default from
 * {@link com.opencm.config.OpenCmConfig#getModelsDir()}). Files are visited in file-name order;
 * unreadable or invalid files are logged and skipped so one bad file does not hide the rest.
 */
public final class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    static final String DEFAULT_DESCRIPTION = "A validated causal model in OpenCM format.";

    private final OpenCmLoader loader;
    private final Path directory;

    public ModelCatalog(OpenCmLoader loader) {
        this(loader, loader.getConfig().getModelsDir());
    }

    public ModelCatalog(OpenCmLoader loader, Path directory) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    /** Paths of all model files in the directory, sorted by file name; empty if the directory does not exist. */
    public List<Path> modelFiles() throws IOException {
        if (!Files.isDirectory(directory)) {
            log.debug("Models directory {} does not exist", directory);
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> OpenCmFormat.isOpenCmFileName(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    /** Summaries of every readable model file. Does not validate. */
    public List<ModelSummary> list() throws IOException {
        List<ModelSummary> summaries = new ArrayList<>();
        for (Path file : modelFiles()) {
            summarize(file).ifPresent(summaries::add);
        }
        return summaries;
    }

    /** Loads every model that validates; invalid files are skipped with a warning. */
    public List<CausalModel> loadAll() throws IOException {
        List<CausalModel> models = new ArrayList<>();
        for (Path file : modelFiles()) {
            try {
                models.add(loader.load(file));
            } catch (IOException | OpenCmValidationException | OpenCmFormatException e) {
                log.warn("Skipping model file {}: {}", file, e.getMessage());
            }
        }
        return models;
    }

    /**
     * Loads the model with the given id ({@code <id>.opencm.json} in the directory), if the file exists.
     *
     * @throws IllegalArgumentException if {@code id} is not a valid model id
     */
    public Optional<CausalModel> find(String id) throws IOException {
        if (id == null || !OpenCmFormat.MODEL_ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid model id: '" + id + "'");
        }
        Path file = directory.resolve(id + OpenCmFormat.FILE_EXTENSION);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(loader.load(file));
    }

    private Optional<ModelSummary> summarize(Path file) {
        String fileName = file.getFileName().toString();
        JsonNode document;
        try {
            document = loader.readDocument(file);
        } catch (IOException | OpenCmFormatException e) {
            log.warn("Failed to read model file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        JsonNode model = document.path(OpenCmFormat.KEY_MODEL);
        return Optional.of(new ModelSummary(
                OpenCmFormat.stripExtension(fileName),
                textOr(model, "name", fileName),
                textOr(model, "domain", CausalModel.DEFAULT_DOMAIN),
                textOr(model, "description", DEFAULT_DESCRIPTION),
                file));
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : fallback;
    }
}
