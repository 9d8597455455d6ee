package com.funcpool.storage;

import com.funcpool.canonical.ContentHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SchemaValidatorTest {

    private static final String CODE = "def _fp_v_0():\n    return 42";
    private static final String HASH = ContentHasher.sha256(CODE);

    @TempDir
    Path tempDir;

    private PoolStorage storage;
    private SchemaValidator validator;

    @BeforeEach
    void setUp() {
        storage = new PoolStorage(tempDir);
        validator = new SchemaValidator(storage);
    }

    @Test
    void testCompleteFunctionIsValid() {
        storeValidFunction();

        ValidationResult result = validator.validate(HASH);

        assertThat(result.isOk()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void testFunctionWithoutMappingIsInvalid() {
        storage.saveObject(HASH, CODE, FunctionMetadata.builder().author("alice").build());

        ValidationResult result = validator.validate(HASH);

        assertThat(result.isOk()).isFalse();
        assertThat(result.getErrors()).anyMatch(error -> error.contains("No language mappings found"));
    }

    @Test
    void testMissingObjectIsReported() {
        ValidationResult result = validator.validate(HASH);

        assertThat(result.getErrors()).containsExactly("object.json not found for function " + HASH);
    }

    @Test
    void testEveryViolationIsReported() throws IOException {
        storeValidFunction();
        Files.writeString(storage.layout().objectFile(HASH), """
                {
                  "schema_version" : 2,
                  "hash" : "%s",
                  "normalized_code" : "def broken(:",
                  "metadata" : []
                }
                """.formatted(ContentHasher.sha256("elsewhere")));

        ValidationResult result = validator.validate(HASH);

        assertThat(result.getErrors())
                .contains("Missing required field in object.json: hash_algorithm",
                        "Missing required field in object.json: encoding",
                        "Invalid schema version: 2",
                        "metadata is not an object")
                .anyMatch(error -> error.startsWith("Hash field"))
                .anyMatch(error -> error.startsWith("normalized_code does not parse"));
    }

    @Test
    void testIncompleteMappingIsReported() throws IOException {
        storeValidFunction();
        Path mappingFile = storage.layout().mappingFile(HASH, "fra", ContentHasher.sha256("partial"));
        Files.createDirectories(mappingFile.getParent());
        Files.writeString(mappingFile, "{\"docstring\": \"\", \"name_mapping\": {}}");

        ValidationResult result = validator.validate(HASH);

        assertThat(result.getErrors()).hasSize(2)
                .allMatch(error -> error.startsWith("Missing required field in mapping fra/"))
                .anyMatch(error -> error.endsWith("alias_mapping"))
                .anyMatch(error -> error.endsWith("comment"));
    }

    @Test
    void testValidateAllCoversEveryFunction() {
        storeValidFunction();
        String orphan = ContentHasher.sha256("orphan");
        storage.saveObject(orphan, CODE, FunctionMetadata.builder().build());

        Map<String, ValidationResult> results = validator.validateAll();

        assertThat(results).containsOnlyKeys(HASH, orphan);
        assertThat(results.get(HASH).isOk()).isTrue();
        assertThat(results.get(orphan).isOk()).isFalse();
    }

    private void storeValidFunction() {
        storage.saveObject(HASH, CODE, FunctionMetadata.builder().author("alice").created("2025-01-31T09:15:00Z").build());
        storage.saveMapping(HASH, "eng", "The answer.", Map.of("_fp_v_0", "answer"), Map.of(), "");
    }
}
