package com.funcpool.storage.migration;

import com.funcpool.canonical.CanonicalForm;
import com.funcpool.canonical.Canonicalizer;
import com.funcpool.canonical.ContentHasher;
import com.funcpool.config.MetadataFactory;
import com.funcpool.config.PoolConfig;
import com.funcpool.exception.ValidationException;
import com.funcpool.storage.CanonicalFunction;
import com.funcpool.storage.LocalizationMapping;
import com.funcpool.storage.PoolStorage;
import com.funcpool.storage.SchemaGeneration;
import com.funcpool.storage.SchemaValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SchemaMigratorTest {

    private static final String DEPENDENCY = ContentHasher.sha256("dependency");

    @TempDir
    Path tempDir;

    private PoolStorage storage;
    private SchemaMigrator migrator;

    @BeforeEach
    void setUp() {
        storage = new PoolStorage(tempDir);
        PoolConfig config = PoolConfig.builder().author("alice").build();
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:30:45.500Z"), ZoneOffset.UTC);
        migrator = new SchemaMigrator(storage, new SchemaValidator(storage), new MetadataFactory(config, clock));
    }

    @Test
    void testMigrationPreservesHashAndMappings() {
        CanonicalForm form = new Canonicalizer().canonicalize("""
                from funcpool.pool import object_%s as helper
                def twice(value):
                    \"\"\"Apply helper twice.\"\"\"
                    return helper(helper(value))
                """.formatted(DEPENDENCY), "twice.py");
        String hash = ContentHasher.identityHash(form);
        String legacyCode = form.getWithDocstring().replace("object_" + DEPENDENCY, DEPENDENCY);
        storage.legacy().save(hash, "eng", legacyCode, form.getDocstring(), form.getNameMapping(),
                form.getAliasMapping());
        storage.legacy().save(hash, "fra", legacyCode, "Applique helper deux fois.",
                Map.of("_fp_v_0", "deux_fois", "_fp_v_1", "valeur"), Map.of(DEPENDENCY, "aide"));

        migrator.migrate(hash, false);

        CanonicalFunction object = storage.loadObject(hash);
        assertThat(object.getNormalizedCode()).isEqualTo(form.getWithDocstring());
        assertThat(object.getMetadata().getCreated()).isEqualTo("2025-03-01T12:30:45Z");
        assertThat(object.getMetadata().getAuthor()).isEqualTo("alice");

        LocalizationMapping eng = storage.loadMapping(hash, "eng", null);
        assertThat(eng.getDocstring()).isEqualTo("Apply helper twice.");
        assertThat(eng.getNameMapping()).isEqualTo(form.getNameMapping());
        assertThat(eng.getAliasMapping()).containsExactly(entry(DEPENDENCY, "helper"));
        assertThat(eng.getComment()).isEmpty();

        LocalizationMapping fra = storage.loadMapping(hash, "fra", null);
        assertThat(fra.getNameMapping()).containsEntry("_fp_v_0", "deux_fois");
        assertThat(fra.getAliasMapping()).containsExactly(entry(DEPENDENCY, "aide"));

        assertThat(storage.detectVersion(hash)).contains(SchemaGeneration.CURRENT);
        assertThat(storage.legacy().exists(hash)).isFalse();
        assertThat(storage.layout().legacyFile(hash).getParent()).doesNotExist();
        assertThat(new SchemaValidator(storage).validate(hash).isOk()).isTrue();
    }

    @Test
    void testKeepLegacyLeavesOldFile() {
        String hash = storeLegacy("def _fp_v_0():\n    return 1", "one");

        migrator.migrate(hash, true);

        assertThat(storage.legacy().exists(hash)).isTrue();
        assertThat(storage.detectVersion(hash)).contains(SchemaGeneration.CURRENT);
    }

    @Test
    void testLegacyReferencesArePrefixed() {
        String code = """
                from funcpool.pool import %1$s

                def _fp_v_0(_fp_v_1):
                    return %1$s._fp_v_0(_fp_v_1) + %1$s . _fp_v_0(1)""".formatted(DEPENDENCY);

        assertThat(SchemaMigrator.prefixPoolReferences(code)).isEqualTo("""
                from funcpool.pool import object_%1$s

                def _fp_v_0(_fp_v_1):
                    return object_%1$s._fp_v_0(_fp_v_1) + object_%1$s . _fp_v_0(1)""".formatted(DEPENDENCY));
        assertThat(SchemaMigrator.prefixPoolReferences("x = 'object_" + DEPENDENCY + "'"))
                .isEqualTo("x = 'object_" + DEPENDENCY + "'");
    }

    @Test
    void testFunctionWithoutMappingsFailsValidation() throws IOException {
        String hash = ContentHasher.sha256("empty");
        Path legacyFile = storage.layout().legacyFile(hash);
        Files.createDirectories(legacyFile.getParent());
        Files.writeString(legacyFile, """
                {"version": 0, "hash": "%s", "normalized_code": "def _fp_v_0():\\n    pass",
                 "docstrings": {}, "name_mappings": {}, "alias_mappings": {}}
                """.formatted(hash));

        assertThatThrownBy(() -> migrator.migrate(hash, false))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining(hash);
        assertThat(storage.legacy().exists(hash)).isTrue();
    }

    @Test
    void testBatchContinuesPastFailures() throws IOException {
        String good = storeLegacy("def _fp_v_0():\n    return 2", "two");
        String bad = ContentHasher.sha256("bad");
        Path badFile = storage.layout().legacyFile(bad);
        Files.createDirectories(badFile.getParent());
        Files.writeString(badFile, "{\"version\": 0, \"normalized_code\": \"def (\"}");

        MigrationReport report = migrator.migrateAll(false, false);

        assertThat(report.getMigrated()).containsExactly(good);
        assertThat(report.getFailed()).containsOnlyKeys(bad);
        assertThat(report.hasFailures()).isTrue();
        assertThat(storage.detectVersion(good)).contains(SchemaGeneration.CURRENT);
    }

    @Test
    void testDryRunChangesNothing() {
        String hash = storeLegacy("def _fp_v_0():\n    return 3", "three");

        MigrationReport report = migrator.migrateAll(false, true);

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.getPending()).containsExactly(hash);
        assertThat(report.affected()).containsExactly(hash);
        assertThat(report.getMigrated()).isEmpty();
        assertThat(storage.detectVersion(hash)).contains(SchemaGeneration.LEGACY);
    }

    private String storeLegacy(String code, String name) {
        String hash = ContentHasher.sha256(code);
        storage.legacy().save(hash, "eng", code, "", Map.of("_fp_v_0", name), Map.of());
        return hash;
    }
}
