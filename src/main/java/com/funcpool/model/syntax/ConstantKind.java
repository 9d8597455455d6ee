package com.funcpool.model.syntax;

/**
 * Kind of a literal constant. The constant's text is interpreted according to its kind.
 */
public enum ConstantKind {
    /** Decoded string value. */
    STRING,
    /** Decoded byte values, one char per byte (0-255). */
    BYTES,
    /** Decimal digits, optionally signed. */
    INTEGER,
    /** Shortest round-trip representation, e.g. {@code 1.5}, {@code 1e+16}, {@code inf}. */
    FLOAT,
    /** Imaginary part as a float representation. */
    COMPLEX,
    TRUE,
    FALSE,
    NONE,
    ELLIPSIS
}
