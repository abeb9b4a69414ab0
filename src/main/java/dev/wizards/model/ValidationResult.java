package dev.wizards.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a step's self-check. Errors block forward navigation, warnings never do.
 */
public final class ValidationResult {
    private boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult(boolean valid, List<String> errors, List<String> warnings) {
        this.errors = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
        this.warnings = warnings == null ? new ArrayList<>() : new ArrayList<>(warnings);
        // Errors always win over the flag passed in
        this.valid = valid && this.errors.isEmpty();
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public static ValidationResult invalid(String... errors) {
        return new ValidationResult(false, List.of(errors), List.of());
    }

    public boolean isValid() { return valid; }
    public List<String> errors() { return Collections.unmodifiableList(errors); }
    public List<String> warnings() { return Collections.unmodifiableList(warnings); }

    public ValidationResult addError(String message) {
        errors.add(message);
        valid = false;
        return this;
    }

    public ValidationResult addWarning(String message) {
        warnings.add(message);
        return this;
    }

    public boolean hasErrors() { return !errors.isEmpty(); }
    public boolean hasWarnings() { return !warnings.isEmpty(); }

    @Override
    public String toString() {
        return "ValidationResult[valid=%s, errors=%s, warnings=%s]".formatted(valid, errors, warnings);
    }
}
