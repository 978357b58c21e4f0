package com.opencm.format.validation;

/**
 * Thrown when an OpenCM document fails validation. The message lists every error found, one per line.
 */
public final class OpenCmValidationException extends RuntimeException {

    private final ValidationResult validationResult;

    public OpenCmValidationException(String source, ValidationResult validationResult) {
        super(buildMessage(source, validationResult));
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    private static String buildMessage(String source, ValidationResult result) {
        String header = "OpenCM validation failed for " + (source != null ? source : "<document>") + ":";
        if (result == null || result.getErrors().isEmpty()) {
            return header;
        }
        return header + "\n" + String.join("\n", result.getErrors());
    }
}
