package com.funcpool.storage;

import lombok.Value;

import java.util.List;

/**
 * Outcome of validating one stored function. {@code errors} lists every violation found.
 */
@Value
public class ValidationResult {
    String hash;
    List<String> errors;

    public static ValidationResult of(String hash, List<String> errors) {
        return new ValidationResult(hash, List.copyOf(errors));
    }

    public boolean isOk() {
        return errors.isEmpty();
    }
}
