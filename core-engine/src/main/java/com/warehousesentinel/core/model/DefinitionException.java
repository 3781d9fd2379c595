package com.warehousesentinel.core.model;

import java.util.List;

/**
 * Raised when a definition violates one of its construction-time invariants.
 *
 * <p>
 * Validation collects every problem it finds before throwing, so
 * {@link #getErrors()} lists all of them and the message joins them with
 * {@code "; "}. A definition that fails validation is never usable.
 * </p>
 *
 * @since 1.0.0
 */
public class DefinitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<String> errors;

    public DefinitionException(String subject, List<String> errors) {
        super(subject + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public DefinitionException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    /**
     * Throw when {@code errors} is non-empty.
     *
     * @param subject description of the definition being validated
     * @param errors  collected validation messages
     * @throws DefinitionException if {@code errors} is not empty
     */
    public static void throwIfAny(String subject, List<String> errors) {
        if (!errors.isEmpty()) {
            throw new DefinitionException(subject, errors);
        }
    }

    public List<String> getErrors() {
        return errors;
    }
}
