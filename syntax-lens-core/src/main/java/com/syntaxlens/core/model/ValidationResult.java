package com.syntaxlens.core.model;

/**
 * Outcome of a syntax check.
 *
 * @param valid true if the input parsed
 * @param message grammar error message; null when valid
 */
public record ValidationResult(
    boolean valid,
    String message
) {
    public ValidationResult {
        if (!valid && (message == null || message.isBlank())) {
            message = "Unknown syntax error";
        }
        if (valid) {
            message = null;
        }
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(false, message);
    }
}
