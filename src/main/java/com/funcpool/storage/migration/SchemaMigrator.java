package com.funcpool.storage.migration;

import com.funcpool.canonical.Identifiers;
import com.funcpool.config.MetadataFactory;
import com.funcpool.exception.PoolException;
import com.funcpool.exception.PythonSyntaxException;
import com.funcpool.exception.SchemaException;
import com.funcpool.exception.ValidationException;
import com.funcpool.parser.PythonParser;
import com.funcpool.storage.PoolStorage;
import com.funcpool.storage.SchemaValidator;
import com.funcpool.storage.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves functions from the legacy single-file layout to the current object/mapping layout.
 */
public class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private static final Pattern POOL_IMPORT_LINE = Pattern.compile(
            "^(\\s*from\\s+" + Pattern.quote(Identifiers.POOL_MODULE) + "\\s+import\\s+)(.*)$", Pattern.MULTILINE);
    private static final Pattern BARE_HASH = Pattern.compile("(?<![\\w])([0-9a-f]{64})(?![\\w])");
    private static final Pattern BARE_RECEIVER = Pattern.compile(
            "(?<![\\w])([0-9a-f]{64})(?=\\s*\\.\\s*" + Pattern.quote(Identifiers.ENTRY_SLOT) + "(?![\\w]))");

    private final PoolStorage storage;
    private final SchemaValidator validator;
    private final MetadataFactory metadataFactory;

    public SchemaMigrator(PoolStorage storage, SchemaValidator validator, MetadataFactory metadataFactory) {
        this.storage = storage;
        this.validator = validator;
        this.metadataFactory = metadataFactory;
    }

    /**
     * Migrates one function. The legacy file is deleted unless {@code keepLegacy} is set.
     *
     * @throws ValidationException when the migrated function does not validate
     */
    public void migrate(String hash, boolean keepLegacy) {
        LegacyRecord record = storage.legacy().load(hash);
        if (record.getHash() != null && !hash.equals(record.getHash())) {
            throw new SchemaException("Legacy file of " + hash + " declares hash " + record.getHash());
        }
        String code = prefixPoolReferences(record.getNormalizedCode());
        try {
            PythonParser.parse(code, hash);
        } catch (PythonSyntaxException e) {
            throw new SchemaException("Legacy code of " + hash + " does not parse after patching: " + e.getMessage(), e);
        }

        storage.saveObject(hash, code, metadataFactory.create(null, List.of()));
        for (Map.Entry<String, Map<String, String>> entry : record.getNameMappings().entrySet()) {
            String language = entry.getKey();
            String mappingHash = storage.saveMapping(hash, language,
                    record.getDocstrings().getOrDefault(language, ""),
                    entry.getValue(),
                    record.getAliasMappings().getOrDefault(language, Map.of()),
                    "");
            log.debug("Migrated {}@{} to mapping {}", hash, language, mappingHash);
        }

        ValidationResult result = validator.validate(hash);
        if (!result.isOk()) {
            throw new ValidationException(hash, result.getErrors());
        }
        if (!keepLegacy) {
            storage.legacy().delete(hash);
        }
        log.info("Migrated {} ({} languages)", hash, record.getNameMappings().size());
    }

    /**
     * Migrates every legacy function. A failure is recorded in the report and the batch
     * continues with the next hash.
     */
    public MigrationReport migrateAll(boolean keepLegacy, boolean dryRun) {
        MigrationReport report = new MigrationReport(dryRun);
        for (String hash : storage.listLegacyFunctions()) {
            if (dryRun) {
                report.getPending().add(hash);
                continue;
            }
            try {
                migrate(hash, keepLegacy);
                report.getMigrated().add(hash);
            } catch (PoolException e) {
                log.error("Migration of {} failed: {}", hash, e.getMessage());
                report.getFailed().put(hash, e.getMessage());
            }
        }
        return report;
    }

    /**
     * Adds the identifier prefix to hashes used as pool import names and as call receivers.
     */
    static String prefixPoolReferences(String code) {
        Matcher imports = POOL_IMPORT_LINE.matcher(code);
        StringBuilder patched = new StringBuilder();
        while (imports.find()) {
            String names = BARE_HASH.matcher(imports.group(2))
                    .replaceAll(match -> Identifiers.OBJECT_PREFIX + match.group(1));
            imports.appendReplacement(patched, Matcher.quoteReplacement(imports.group(1) + names));
        }
        imports.appendTail(patched);
        return BARE_RECEIVER.matcher(patched.toString())
                .replaceAll(match -> Identifiers.OBJECT_PREFIX + match.group(1));
    }
}
