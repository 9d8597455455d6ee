package com.funcpool.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.funcpool.canonical.ContentHasher;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contents of {@code mapping.json}: what it takes to show a function in one human language.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"docstring", "name_mapping", "alias_mapping", "comment"})
public class LocalizationMapping {

    @Builder.Default
    private String docstring = "";

    /** Slot name to original identifier. */
    @JsonProperty("name_mapping")
    @Builder.Default
    private Map<String, String> nameMapping = new LinkedHashMap<>();

    /** Dependency hash to local alias. */
    @JsonProperty("alias_mapping")
    @Builder.Default
    private Map<String, String> aliasMapping = new LinkedHashMap<>();

    @Builder.Default
    private String comment = "";

    /**
     * Content address of this mapping.
     */
    public String mappingHash() {
        return ContentHasher.mappingHash(docstring, nameMapping, aliasMapping, comment);
    }
}
