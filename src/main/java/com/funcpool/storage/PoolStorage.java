package com.funcpool.storage;

import com.funcpool.canonical.Identifiers;
import com.funcpool.exception.AmbiguousMappingException;
import com.funcpool.exception.NotFoundException;
import com.funcpool.exception.PoolException;
import com.funcpool.exception.SchemaException;
import com.funcpool.storage.migration.LegacyPoolStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Content-addressed storage of functions and their mappings on the local filesystem.
 *
 * Objects are written once and never overwritten. Mappings are addressed by their own content,
 * so saving the same mapping twice leaves a single file.
 */
public class PoolStorage {
    private static final Logger log = LoggerFactory.getLogger(PoolStorage.class);

    public static final String ENCODING = "utf-8";

    private final PoolLayout layout;
    private final LegacyPoolStore legacy;

    public PoolStorage(Path root) {
        this.layout = new PoolLayout(root);
        this.legacy = new LegacyPoolStore(layout);
    }

    public PoolLayout layout() {
        return layout;
    }

    public LegacyPoolStore legacy() {
        return legacy;
    }

    /**
     * Schema generation a function is stored under, current layout probed first.
     */
    public Optional<SchemaGeneration> detectVersion(String hash) {
        Identifiers.requireHash(hash);
        if (Files.isRegularFile(layout.objectFile(hash))) {
            return Optional.of(SchemaGeneration.CURRENT);
        }
        if (Files.isRegularFile(layout.legacyFile(hash))) {
            return Optional.of(SchemaGeneration.LEGACY);
        }
        return Optional.empty();
    }

    public boolean exists(String hash) {
        return detectVersion(hash).isPresent();
    }

    /**
     * Loads a function from whichever generation holds it.
     */
    public StoredFunction load(String hash) {
        SchemaGeneration generation = detectVersion(hash)
                .orElseThrow(() -> new NotFoundException("Function not found: " + hash));
        return generation == SchemaGeneration.CURRENT ? loadObject(hash) : legacy.load(hash);
    }

    /**
     * Writes {@code object.json} unless it already exists. Returns whether a file was written.
     */
    public boolean saveObject(String hash, String normalizedCode, FunctionMetadata metadata) {
        Identifiers.requireHash(hash);
        Path objectFile = layout.objectFile(hash);
        if (Files.exists(objectFile)) {
            log.debug("Object {} already stored, keeping existing file", hash);
            return false;
        }
        CanonicalFunction object = CanonicalFunction.builder()
                .schemaVersion(SchemaGeneration.CURRENT.getVersion())
                .hash(hash)
                .hashAlgorithm(Identifiers.HASH_ALGORITHM)
                .normalizedCode(normalizedCode)
                .encoding(ENCODING)
                .metadata(metadata)
                .build();
        PoolFiles.writeAtomically(objectFile, PoolJson.write(object));
        log.debug("Stored object {}", hash);
        return true;
    }

    public String saveMapping(String hash, String language, String docstring, Map<String, String> nameMapping,
                              Map<String, String> aliasMapping, String comment) {
        return saveMapping(hash, language, LocalizationMapping.builder()
                .docstring(docstring == null ? "" : docstring)
                .nameMapping(nameMapping)
                .aliasMapping(aliasMapping)
                .comment(comment == null ? "" : comment)
                .build());
    }

    /**
     * Writes a mapping under its content hash and returns that hash.
     */
    public String saveMapping(String hash, String language, LocalizationMapping mapping) {
        Identifiers.requireHash(hash);
        Identifiers.requireLanguage(language);
        String mappingHash = mapping.mappingHash();
        Path mappingFile = layout.mappingFile(hash, language, mappingHash);
        if (Files.exists(mappingFile)) {
            log.debug("Mapping {} of {}@{} already stored", mappingHash, hash, language);
        } else {
            PoolFiles.writeAtomically(mappingFile, PoolJson.write(mapping));
            log.debug("Stored mapping {} of {}@{}", mappingHash, hash, language);
        }
        return mappingHash;
    }

    /**
     * Mapping variants of a function in a language, sorted by mapping hash. Empty when the language
     * is unknown for the function. Unreadable mapping files are skipped.
     */
    public List<MappingVariant> listMappings(String hash, String language) {
        Identifiers.requireHash(hash);
        Identifiers.requireLanguage(language);
        List<MappingVariant> variants = new ArrayList<>();
        for (Path mappingFile : mappingFiles(hash, language)) {
            String mappingHash = mappingHashOf(mappingFile);
            try {
                LocalizationMapping mapping = PoolJson.read(mappingFile, LocalizationMapping.class);
                variants.add(new MappingVariant(mappingHash, mapping.getComment() == null ? "" : mapping.getComment()));
            } catch (PoolException e) {
                log.warn("Skipping unreadable mapping {}: {}", mappingFile, e.getMessage());
            }
        }
        return variants;
    }

    /**
     * Paths of every {@code mapping.json} of a function in a language, sorted by mapping hash.
     */
    public List<Path> mappingFiles(String hash, String language) {
        List<Path> files = new ArrayList<>();
        for (Path prefixDir : PoolFiles.list(layout.mappingsRoot(hash, language))) {
            for (Path mappingDir : PoolFiles.list(prefixDir)) {
                Path mappingFile = mappingDir.resolve(PoolLayout.MAPPING_FILE);
                if (Identifiers.isHash(prefixDir.getFileName().toString() + mappingDir.getFileName())
                        && Files.isRegularFile(mappingFile)) {
                    files.add(mappingFile);
                }
            }
        }
        return files;
    }

    /**
     * Language directories of a function, sorted.
     */
    public List<String> listLanguages(String hash) {
        Identifiers.requireHash(hash);
        return PoolFiles.list(layout.functionDirectory(hash)).stream()
                .filter(Files::isDirectory)
                .map(path -> path.getFileName().toString())
                .filter(Identifiers::isLanguage)
                .collect(Collectors.toList());
    }

    /**
     * Hashes of every function stored in the current layout, sorted.
     */
    public List<String> listFunctions() {
        List<String> hashes = new ArrayList<>();
        for (Path prefixDir : PoolFiles.list(layout.objectsRoot())) {
            for (Path functionDir : PoolFiles.list(prefixDir)) {
                String hash = prefixDir.getFileName().toString() + functionDir.getFileName();
                if (Identifiers.isHash(hash) && Files.isRegularFile(functionDir.resolve(PoolLayout.OBJECT_FILE))) {
                    hashes.add(hash);
                }
            }
        }
        return hashes;
    }

    public List<String> listLegacyFunctions() {
        return legacy.listFunctions();
    }

    /**
     * Reads {@code object.json}.
     *
     * @throws NotFoundException when no current-generation object exists
     * @throws SchemaException when the file is unreadable or of another schema version
     */
    public CanonicalFunction loadObject(String hash) {
        Identifiers.requireHash(hash);
        Path objectFile = layout.objectFile(hash);
        if (!Files.isRegularFile(objectFile)) {
            if (Files.isRegularFile(layout.legacyFile(hash))) {
                throw new SchemaException("Function " + hash + " is stored in the legacy schema; run 'migrate "
                        + hash + "' first");
            }
            throw new NotFoundException("Function not found: " + hash);
        }
        CanonicalFunction object = PoolJson.read(objectFile, CanonicalFunction.class);
        if (object.getSchemaVersion() != SchemaGeneration.CURRENT.getVersion()) {
            throw new SchemaException("Unsupported schema version " + object.getSchemaVersion() + " in " + objectFile);
        }
        if (object.getNormalizedCode() == null) {
            throw new SchemaException("Missing normalized_code in " + objectFile);
        }
        return object;
    }

    /**
     * Loads a mapping. Without a mapping hash the language must have exactly one variant.
     *
     * @throws NotFoundException when the language or the requested variant does not exist
     * @throws AmbiguousMappingException when several variants exist and none was requested
     */
    public LocalizationMapping loadMapping(String hash, String language, String mappingHash) {
        Identifiers.requireHash(hash);
        Identifiers.requireLanguage(language);
        if (mappingHash != null) {
            Identifiers.requireHash(mappingHash);
            Path mappingFile = layout.mappingFile(hash, language, mappingHash);
            if (!Files.isRegularFile(mappingFile)) {
                throw new NotFoundException("Mapping " + mappingHash + " not found for " + hash + "@" + language);
            }
            return PoolJson.read(mappingFile, LocalizationMapping.class);
        }

        List<MappingVariant> variants = listMappings(hash, language);
        if (variants.isEmpty()) {
            List<String> languages = listLanguages(hash);
            throw new NotFoundException("No mapping for language '" + language + "' of function " + hash
                    + (languages.isEmpty() ? "" : "; available languages: " + String.join(", ", languages)));
        }
        if (variants.size() > 1) {
            throw new AmbiguousMappingException(hash, language,
                    variants.stream().map(MappingVariant::getMappingHash).collect(Collectors.toList()));
        }
        return PoolJson.read(layout.mappingFile(hash, language, variants.get(0).getMappingHash()),
                LocalizationMapping.class);
    }

    private static String mappingHashOf(Path mappingFile) {
        Path mappingDir = mappingFile.getParent();
        return mappingDir.getParent().getFileName().toString() + mappingDir.getFileName();
    }
}
