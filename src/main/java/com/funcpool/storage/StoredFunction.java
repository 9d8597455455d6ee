package com.funcpool.storage;

/**
 * A function as found on disk, in either schema generation.
 */
public interface StoredFunction {

    String getHash();

    /**
     * Canonical text as stored, docstring included.
     */
    String getNormalizedCode();

    SchemaGeneration generation();
}
