package com.funcpool.exception;

/**
 * Running a resolved program failed. {@code stderr} holds the interpreter's diagnostic output.
 */
public class ExecutionException extends PoolException {

    private static final long serialVersionUID = 1L;
    private final String stderr;

    public ExecutionException(String message, String stderr) {
        super(message);
        this.stderr = stderr == null ? "" : stderr;
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.stderr = "";
    }

    public String getStderr() {
        return stderr;
    }
}
