package com.funcpool.cli.model;

import lombok.Value;

/**
 * A function named on the command line as {@code HASH[@lang[@mappingHash]]}.
 */
@Value
public class FunctionTarget {
    String hash;
    String language;
    String mappingHash;

    public boolean hasLanguage() {
        return language != null;
    }
}
