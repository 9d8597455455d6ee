package com.funcpool.storage;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * On-disk schema generations of a stored function.
 */
@Getter
@RequiredArgsConstructor
public enum SchemaGeneration {
    /** One JSON file per function holding every language. Read and migrate only. */
    LEGACY(0),
    /** Object file plus one file per mapping variant. */
    CURRENT(1);

    private final int version;
}
