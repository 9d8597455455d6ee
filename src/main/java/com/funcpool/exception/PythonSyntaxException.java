package com.funcpool.exception;

/**
 * Source text is not valid Python (or uses syntax outside the supported subset).
 */
public class PythonSyntaxException extends PoolException {

    private static final long serialVersionUID = 1L;
    private final String fileName;
    private final int line;
    private final int column;

    public PythonSyntaxException(String message, String fileName, int line, int column) {
        super(String.format("%s:%d:%d: %s", fileName, line, column, message));
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
