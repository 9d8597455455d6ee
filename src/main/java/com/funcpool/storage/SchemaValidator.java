package com.funcpool.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.funcpool.canonical.Identifiers;
import com.funcpool.exception.PoolException;
import com.funcpool.exception.PythonSyntaxException;
import com.funcpool.parser.PythonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a stored function is complete: a well-formed object file and at least one
 * well-formed mapping. Every violation is reported, not only the first.
 */
public class SchemaValidator {
    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private static final List<String> OBJECT_FIELDS = List.of(
        "schema_version", "hash", "hash_algorithm", "normalized_code", "encoding", "metadata"
    );

    private static final List<String> MAPPING_FIELDS = List.of(
        "docstring", "name_mapping", "alias_mapping", "comment"
    );

    private final PoolStorage storage;

    public SchemaValidator(PoolStorage storage) {
        this.storage = storage;
    }

    public ValidationResult validate(String hash) {
        List<String> errors = new ArrayList<>();
        if (!Identifiers.isHash(hash)) {
            errors.add("Invalid hash: " + hash);
            return ValidationResult.of(hash, errors);
        }
        PoolLayout layout = storage.layout();
        Path objectFile = layout.objectFile(hash);
        if (!Files.isRegularFile(objectFile)) {
            errors.add("object.json not found for function " + hash);
            return ValidationResult.of(hash, errors);
        }

        validateObject(hash, objectFile, errors);
        validateMappings(hash, errors);

        if (!errors.isEmpty()) {
            log.debug("Function {} has {} validation errors", hash, errors.size());
        }
        return ValidationResult.of(hash, errors);
    }

    /**
     * Validates every function in the current layout, keyed by hash in hash order.
     */
    public Map<String, ValidationResult> validateAll() {
        Map<String, ValidationResult> results = new LinkedHashMap<>();
        for (String hash : storage.listFunctions()) {
            ValidationResult result = validate(hash);
            if (!result.isOk()) {
                log.warn("Function {} is invalid: {}", hash, String.join("; ", result.getErrors()));
            }
            results.put(hash, result);
        }
        return results;
    }

    private void validateObject(String hash, Path objectFile, List<String> errors) {
        JsonNode object;
        try {
            object = PoolJson.readTree(objectFile);
        } catch (PoolException e) {
            errors.add("Failed to parse object.json: " + e.getMessage());
            return;
        }
        if (!object.isObject()) {
            errors.add("object.json does not hold a JSON object");
            return;
        }
        for (String field : OBJECT_FIELDS) {
            if (!object.has(field)) {
                errors.add("Missing required field in object.json: " + field);
            }
        }
        JsonNode version = object.get("schema_version");
        if (version != null && (!version.isInt() || version.asInt() != SchemaGeneration.CURRENT.getVersion())) {
            errors.add("Invalid schema version: " + version);
        }
        JsonNode storedHash = object.get("hash");
        if (storedHash != null && !hash.equals(storedHash.asText())) {
            errors.add("Hash field " + storedHash.asText() + " does not match directory hash " + hash);
        }
        JsonNode code = object.get("normalized_code");
        if (code != null) {
            if (!code.isTextual()) {
                errors.add("normalized_code is not a string");
            } else {
                try {
                    PythonParser.parse(code.asText(), hash);
                } catch (PythonSyntaxException e) {
                    errors.add("normalized_code does not parse: " + e.getMessage());
                }
            }
        }
        JsonNode metadata = object.get("metadata");
        if (metadata != null && !metadata.isObject()) {
            errors.add("metadata is not an object");
        }
    }

    private void validateMappings(String hash, List<String> errors) {
        List<String> languages = storage.listLanguages(hash);
        if (languages.isEmpty()) {
            errors.add("No language mappings found (no language directories)");
            return;
        }
        int mappingCount = 0;
        for (String language : languages) {
            List<Path> mappingFiles = storage.mappingFiles(hash, language);
            if (mappingFiles.isEmpty()) {
                errors.add("No mappings found for language " + language);
            }
            for (Path mappingFile : mappingFiles) {
                mappingCount++;
                validateMapping(language, mappingFile, errors);
            }
        }
        if (mappingCount == 0) {
            errors.add("No mappings found in any language");
        }
    }

    private void validateMapping(String language, Path mappingFile, List<String> errors) {
        String location = language + "/" + mappingFile.getParent().getParent().getFileName()
                + mappingFile.getParent().getFileName();
        JsonNode mapping;
        try {
            mapping = PoolJson.readTree(mappingFile);
        } catch (PoolException e) {
            errors.add("Failed to parse mapping " + location + ": " + e.getMessage());
            return;
        }
        if (!mapping.isObject()) {
            errors.add("Mapping " + location + " does not hold a JSON object");
            return;
        }
        for (String field : MAPPING_FIELDS) {
            if (!mapping.has(field)) {
                errors.add("Missing required field in mapping " + location + ": " + field);
            }
        }
    }
}
