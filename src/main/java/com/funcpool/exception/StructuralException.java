package com.funcpool.exception;

/**
 * Parsed source does not have the shape of a poolable function (exactly one function definition
 * plus imports).
 */
public class StructuralException extends PoolException {

    private static final long serialVersionUID = 1L;
    private final String fileName;
    private final int line;

    public StructuralException(String message, String fileName, int line) {
        super(line > 0 ? String.format("%s:%d: %s", fileName, line, message) : fileName + ": " + message);
        this.fileName = fileName;
        this.line = line;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }
}
