package com.funcpool.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contents of {@code object.json}: the language independent logic of one function.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"schema_version", "hash", "hash_algorithm", "normalized_code", "encoding", "metadata"})
public class CanonicalFunction implements StoredFunction {

    @JsonProperty("schema_version")
    private int schemaVersion;

    private String hash;

    @JsonProperty("hash_algorithm")
    private String hashAlgorithm;

    @JsonProperty("normalized_code")
    private String normalizedCode;

    private String encoding;

    private FunctionMetadata metadata;

    @Override
    public SchemaGeneration generation() {
        return SchemaGeneration.CURRENT;
    }
}
