package com.funcpool.cli.exception;

import com.funcpool.exception.PoolException;

import java.util.List;

/**
 * Single exception that can hold multiple command line errors.
 */
public class OptionsValidationException extends PoolException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
