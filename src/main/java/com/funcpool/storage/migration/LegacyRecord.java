package com.funcpool.storage.migration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.funcpool.storage.SchemaGeneration;
import com.funcpool.storage.StoredFunction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A function in the legacy single-file layout: the canonical code plus every language's
 * docstring, names and aliases keyed by language.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"version", "hash", "normalized_code", "docstrings", "name_mappings", "alias_mappings"})
public class LegacyRecord implements StoredFunction {

    @Builder.Default
    private int version = SchemaGeneration.LEGACY.getVersion();

    private String hash;

    @JsonProperty("normalized_code")
    private String normalizedCode;

    @Builder.Default
    private Map<String, String> docstrings = new LinkedHashMap<>();

    @JsonProperty("name_mappings")
    @Builder.Default
    private Map<String, Map<String, String>> nameMappings = new LinkedHashMap<>();

    @JsonProperty("alias_mappings")
    @Builder.Default
    private Map<String, Map<String, String>> aliasMappings = new LinkedHashMap<>();

    @Override
    public SchemaGeneration generation() {
        return SchemaGeneration.LEGACY;
    }
}
