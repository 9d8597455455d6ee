package com.funcpool.storage;

import lombok.Value;

/**
 * One stored mapping of a function in a language, as listed for disambiguation.
 */
@Value
public class MappingVariant {
    String mappingHash;
    String comment;
}
