package com.opencm.format;

import com.opencm.config.OpenCmConfig;
import com.opencm.model.EdgeType;
import com.opencm.model.EquationType;
import com.opencm.model.ModelDomain;
import com.opencm.model.VariableType;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Constants of the OpenCM file format: version, file extension, id pattern and the valid kind values
 * (in declaration order, as listed in diagnostics).
 */
public final class OpenCmFormat {

    public static final String VERSION = OpenCmConfig.DEFAULT_SUPPORTED_VERSION;
    public static final String FILE_EXTENSION = ".opencm.json";
    public static final Pattern MODEL_ID_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    public static final List<String> VARIABLE_TYPES = wireValues(VariableType.values(), VariableType.UNKNOWN);
    public static final List<String> EDGE_TYPES = wireValues(EdgeType.values(), EdgeType.UNKNOWN);
    public static final List<String> EQUATION_TYPES = wireValues(EquationType.values(), EquationType.UNKNOWN);
    public static final List<String> DOMAINS = wireValues(ModelDomain.values(), ModelDomain.UNKNOWN);

    // Top-level keys
    public static final String KEY_VERSION = "opencm_version";
    public static final String KEY_MODEL = "model";
    public static final String KEY_VARIABLES = "variables";
    public static final String KEY_EDGES = "edges";
    public static final String KEY_EQUATIONS = "structural_equations";
    public static final String KEY_ASSUMPTIONS = "assumptions";
    public static final String KEY_VALIDATION = "validation";
    public static final String KEY_METADATA = "metadata";

    public static final List<String> REQUIRED_KEYS = List.of(KEY_VERSION, KEY_MODEL, KEY_VARIABLES, KEY_EDGES);

    private OpenCmFormat() {
    }

    /** True when the file name ends with {@value #FILE_EXTENSION}. */
    public static boolean isOpenCmFileName(String fileName) {
        return fileName != null && fileName.endsWith(FILE_EXTENSION);
    }

    /** File name without {@value #FILE_EXTENSION} (or unchanged if it does not carry it). */
    public static String stripExtension(String fileName) {
        return isOpenCmFileName(fileName)
                ? fileName.substring(0, fileName.length() - FILE_EXTENSION.length())
                : fileName;
    }

    private static <E extends Enum<E>> List<String> wireValues(E[] values, E unknown) {
        return Arrays.stream(values)
                .filter(v -> v != unknown)
                .map(v -> v.name().toLowerCase(Locale.ROOT))
                .toList();
    }
}
