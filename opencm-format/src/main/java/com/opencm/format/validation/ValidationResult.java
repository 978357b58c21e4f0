package com.opencm.format.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Verdict of validating one OpenCM document: errors (document must be rejected) and warnings
 * (document is usable but suspect), each in the order they were found.
 */
public final class ValidationResult {

    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    private ValidationResult(List<String> errors, List<String> warnings) {
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
        this.warnings = warnings != null ? Collections.unmodifiableList(new ArrayList<>(warnings)) : List.of();
        this.valid = this.errors.isEmpty();
    }

    /** Valid exactly when {@code errors} is empty. */
    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors, warnings);
    }

    public static ValidationResult success() {
        return new ValidationResult(List.of(), List.of());
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Throws {@link OpenCmValidationException} if there are errors; otherwise returns this result.
     *
     * @param source document being validated (e.g. file path), used in the exception message
     */
    public ValidationResult orThrow(String source) {
        if (!valid) {
            throw new OpenCmValidationException(source, this);
        }
        return this;
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid + ", errors=" + errors + ", warnings=" + warnings + "}";
    }
}
