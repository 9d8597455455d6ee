package com.funcpool.canonical;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of canonicalizing one function source file.
 */
@Value
@Builder
public class CanonicalForm {
    /** Name of the function as written. */
    String functionName;

    /** Canonical text with the docstring kept as written; this is what gets stored. */
    String withDocstring;

    /** Canonical text without the docstring; this is what gets hashed. */
    String withoutDocstring;

    /** Cleaned docstring, empty when the function has none. */
    String docstring;

    /** Slot name to original identifier, in slot order. */
    Map<String, String> nameMapping;

    /** Dependency hash to the alias it was imported under. */
    Map<String, String> aliasMapping;

    /** Hashes named by {@code @check(object_<hash>)} decorators, in decorator order. */
    List<String> checks;

    /** Hashes imported from the pool, in import order. */
    List<String> dependencies;
}
