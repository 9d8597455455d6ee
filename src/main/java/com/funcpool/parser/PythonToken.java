package com.funcpool.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the Python tokenizer.
 */
@Data
@AllArgsConstructor
public class PythonToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        NAME,
        NUMBER,
        STRING,
        OP,
        NEWLINE,
        INDENT,
        DEDENT,
        ENDMARKER
    }

    public boolean isOp(String op) {
        return type == TokenType.OP && value.equals(op);
    }

    public boolean isName(String name) {
        return type == TokenType.NAME && value.equals(name);
    }
}
