package com.funcpool.exception;

public class NotFoundException extends PoolException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }
}
