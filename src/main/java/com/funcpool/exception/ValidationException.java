package com.funcpool.exception;

import java.util.List;

/**
 * A stored function failed validation. Holds every violation found.
 */
public class ValidationException extends PoolException {

    private static final long serialVersionUID = 1L;
    private final String hash;
    private final List<String> errors;

    public ValidationException(String hash, List<String> errors) {
        super("Validation failed for " + hash + ": " + String.join("; ", errors));
        this.hash = hash;
        this.errors = List.copyOf(errors);
    }

    public String getHash() {
        return hash;
    }

    public List<String> getErrors() {
        return errors;
    }
}
