package com.funcpool.exception;

import java.nio.file.Path;

/**
 * I/O failure while reading or writing the pool.
 */
public class PoolStorageException extends PoolException {

    private static final long serialVersionUID = 1L;
    private final transient Path path;

    public PoolStorageException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
