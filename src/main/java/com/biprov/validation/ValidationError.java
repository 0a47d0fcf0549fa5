package com.biprov.validation;

import java.util.List;

/**
 * Thrown when an inbound payload is malformed or violates a field constraint.
 *
 * Surfaced to callers as {@code validation_error} (HTTP 400). A payload that fails validation
 * is never retried: the same bytes always produce the same error.
 */
public class ValidationError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Field-level messages in the form {@code field: message}, sorted.
     */
    private final List<String> violations;

    public ValidationError(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public ValidationError(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public ValidationError(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
