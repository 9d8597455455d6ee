package com.funcpool.storage.migration;

import com.funcpool.canonical.Identifiers;
import com.funcpool.exception.NotFoundException;
import com.funcpool.exception.SchemaException;
import com.funcpool.storage.PoolFiles;
import com.funcpool.storage.PoolJson;
import com.funcpool.storage.PoolLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the legacy single-file layout {@code <root>/ab/cdef....json}.
 */
public class LegacyPoolStore {
    private static final Logger log = LoggerFactory.getLogger(LegacyPoolStore.class);

    private static final String SUFFIX = ".json";

    private final PoolLayout layout;

    public LegacyPoolStore(PoolLayout layout) {
        this.layout = layout;
    }

    /**
     * Hashes of every legacy file, sorted.
     */
    public List<String> listFunctions() {
        List<String> hashes = new ArrayList<>();
        for (Path prefixDir : PoolFiles.list(layout.root())) {
            String prefix = prefixDir.getFileName().toString();
            if (prefix.length() != 2 || !Files.isDirectory(prefixDir)) {
                continue;
            }
            for (Path file : PoolFiles.list(prefixDir)) {
                String name = file.getFileName().toString();
                if (!name.endsWith(SUFFIX) || !Files.isRegularFile(file)) {
                    continue;
                }
                String hash = prefix + name.substring(0, name.length() - SUFFIX.length());
                if (Identifiers.isHash(hash)) {
                    hashes.add(hash);
                }
            }
        }
        return hashes;
    }

    public boolean exists(String hash) {
        return Files.isRegularFile(layout.legacyFile(hash));
    }

    public LegacyRecord load(String hash) {
        Identifiers.requireHash(hash);
        Path file = layout.legacyFile(hash);
        if (!Files.isRegularFile(file)) {
            throw new NotFoundException("Legacy function not found: " + hash);
        }
        LegacyRecord record = PoolJson.read(file, LegacyRecord.class);
        if (record.getVersion() != 0) {
            throw new SchemaException("Unexpected version " + record.getVersion() + " in legacy file " + file);
        }
        if (record.getNormalizedCode() == null) {
            throw new SchemaException("Missing normalized_code in legacy file " + file);
        }
        return record;
    }

    /**
     * Adds one language to a legacy record, creating the record when needed.
     */
    public void save(String hash, String language, String normalizedCode, String docstring,
                     Map<String, String> nameMapping, Map<String, String> aliasMapping) {
        Identifiers.requireHash(hash);
        LegacyRecord record = exists(hash) ? load(hash) : LegacyRecord.builder()
                .hash(hash)
                .normalizedCode(normalizedCode)
                .build();
        record.getDocstrings().put(language, docstring);
        record.getNameMappings().put(language, nameMapping);
        record.getAliasMappings().put(language, aliasMapping);
        PoolFiles.writeAtomically(layout.legacyFile(hash), PoolJson.write(record));
        log.debug("Stored legacy record {} for language {}", hash, language);
    }

    /**
     * Removes a legacy file and its prefix directory when that becomes empty.
     */
    public void delete(String hash) {
        Path file = layout.legacyFile(hash);
        PoolFiles.delete(file);
        if (PoolFiles.deleteIfEmpty(file.getParent())) {
            log.debug("Removed empty legacy directory {}", file.getParent());
        }
    }
}
