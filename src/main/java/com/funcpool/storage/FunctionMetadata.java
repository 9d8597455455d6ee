package com.funcpool.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Provenance recorded when an object is first written.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"created", "author", "name", "email", "parent", "checks"})
public class FunctionMetadata {
    /** ISO-8601 UTC timestamp with second precision, e.g. {@code 2025-01-31T09:15:00Z}. */
    private String created;
    private String author;
    private String name;
    private String email;
    /** Hash of the function this one was derived from. */
    private String parent;
    /** Hashes of the functions this function is a test for. */
    @Builder.Default
    private List<String> checks = new ArrayList<>();
}
