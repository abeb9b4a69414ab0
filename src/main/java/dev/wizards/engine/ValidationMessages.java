package dev.wizards.engine;

import dev.wizards.model.ValidationResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders validation results as plain text for the user.
 */
public final class ValidationMessages {

    static final String BULLET = "• ";
    static final String FALLBACK = "Please check the entered data.";

    private ValidationMessages() {}

    /**
     * Errors as bullet lines, followed by warnings as bullet lines. Falls back to a generic
     * message when the result carries neither.
     */
    public static String format(ValidationResult result) {
        String errors = bullets(result.errors());
        String warnings = bullets(result.warnings());

        var sb = new StringBuilder(errors);
        if (!warnings.isEmpty()) {
            if (sb.length() > 0) {
                sb.append("\n");
            }
            sb.append(warnings);
        }
        return sb.length() > 0 ? sb.toString() : FALLBACK;
    }

    private static String bullets(List<String> messages) {
        return messages.stream()
            .map(m -> BULLET + m)
            .collect(Collectors.joining("\n"));
    }
}
