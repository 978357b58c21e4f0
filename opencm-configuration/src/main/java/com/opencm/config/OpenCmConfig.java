package com.opencm.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Settings for loading, validating and saving OpenCM files, read from environment variables.
 * <p>
 * Models directory: OPENCM_MODELS_DIR. Supported format version: OPENCM_SUPPORTED_VERSION
 * (documents declaring another version load with a warning). OPENCM_LOG_WARNINGS controls whether
 * validation warnings are logged on load; OPENCM_PRETTY_PRINT whether saved files are indented.
 */
public final class OpenCmConfig {

    private static final String ENV_MODELS_DIR = "OPENCM_MODELS_DIR";
    private static final String ENV_SUPPORTED_VERSION = "OPENCM_SUPPORTED_VERSION";
    private static final String ENV_LOG_WARNINGS = "OPENCM_LOG_WARNINGS";
    private static final String ENV_PRETTY_PRINT = "OPENCM_PRETTY_PRINT";

    private static final String DEFAULT_MODELS_DIR = "models";
    /** Format version this implementation reads and writes. */
    public static final String DEFAULT_SUPPORTED_VERSION = "1.0";
    private static final boolean DEFAULT_LOG_WARNINGS = true;
    private static final boolean DEFAULT_PRETTY_PRINT = true;

    private static final OpenCmConfig DEFAULTS = builder().build();

    private final Path modelsDir;
    private final String supportedVersion;
    private final boolean logWarnings;
    private final boolean prettyPrint;

    private OpenCmConfig(Builder b) {
        this.modelsDir = b.modelsDir;
        this.supportedVersion = b.supportedVersion;
        this.logWarnings = b.logWarnings;
        this.prettyPrint = b.prettyPrint;
    }

    /** Directory of {@code *.opencm.json} files listed by the catalog. Default {@code models}. */
    public Path getModelsDir() {
        return modelsDir;
    }

    /** Format version documents are compared against. Default {@value #DEFAULT_SUPPORTED_VERSION}. */
    public String getSupportedVersion() {
        return supportedVersion;
    }

    /** Whether validation warnings are logged when a model is loaded. Default true. */
    public boolean isLogWarnings() {
        return logWarnings;
    }

    /** Whether saved files are written as indented JSON. Default true. */
    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public static OpenCmConfig defaults() {
        return DEFAULTS;
    }

    public static OpenCmConfig fromEnvironment() {
        return fromVariables(System::getenv);
    }

    /** Reads settings through the given lookup (e.g. a map in tests); blank or invalid values fall back to defaults. */
    public static OpenCmConfig fromVariables(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables");
        return fromVariables(variables::get);
    }

    private static OpenCmConfig fromVariables(Function<String, String> env) {
        return builder()
                .modelsDir(Path.of(getEnv(env, ENV_MODELS_DIR, DEFAULT_MODELS_DIR)))
                .supportedVersion(getEnv(env, ENV_SUPPORTED_VERSION, DEFAULT_SUPPORTED_VERSION))
                .logWarnings(parseBoolean(env.apply(ENV_LOG_WARNINGS), DEFAULT_LOG_WARNINGS))
                .prettyPrint(parseBoolean(env.apply(ENV_PRETTY_PRINT), DEFAULT_PRETTY_PRINT))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        return defaultValue;
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "OpenCmConfig{modelsDir=" + modelsDir + ", supportedVersion=" + supportedVersion
                + ", logWarnings=" + logWarnings + ", prettyPrint=" + prettyPrint + "}";
    }

    public static final class Builder {
        private Path modelsDir = Path.of(DEFAULT_MODELS_DIR);
        private String supportedVersion = DEFAULT_SUPPORTED_VERSION;
        private boolean logWarnings = DEFAULT_LOG_WARNINGS;
        private boolean prettyPrint = DEFAULT_PRETTY_PRINT;

        public Builder modelsDir(Path modelsDir) {
            this.modelsDir = modelsDir != null ? modelsDir : Path.of(DEFAULT_MODELS_DIR);
            return this;
        }

        public Builder supportedVersion(String supportedVersion) {
            this.supportedVersion = (supportedVersion != null && !supportedVersion.isBlank())
                    ? supportedVersion : DEFAULT_SUPPORTED_VERSION;
            return this;
        }

        public Builder logWarnings(boolean logWarnings) {
            this.logWarnings = logWarnings;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public OpenCmConfig build() {
            return new OpenCmConfig(this);
        }
    }
}
