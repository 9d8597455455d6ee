package com.funcpool.exception;

import java.util.List;

/**
 * Stored data does not conform to the expected on-disk schema.
 */
public class SchemaException extends PoolException {

    private static final long serialVersionUID = 1L;
    private final List<String> violations;

    public SchemaException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public SchemaException(List<String> violations) {
        super(String.join(System.lineSeparator(), violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
