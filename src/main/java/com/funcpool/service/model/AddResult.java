package com.funcpool.service.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AddResult {
    String hash;
    String language;
    String mappingHash;
    String functionName;

    /** False when identical logic was already stored and only a mapping was added. */
    boolean newObject;
}
