package com.funcpool.storage;

import com.funcpool.canonical.Identifiers;

import java.nio.file.Path;

/**
 * Paths of the current and legacy pool layouts. Every hash-addressed level splits the hash after
 * its first two characters.
 *
 * <pre>
 * &lt;root&gt;/sha256/ab/cdef.../object.json
 * &lt;root&gt;/sha256/ab/cdef.../&lt;lang&gt;/sha256/12/3456.../mapping.json
 * &lt;root&gt;/ab/cdef....json                                   (legacy)
 * </pre>
 */
public class PoolLayout {

    public static final String OBJECT_FILE = "object.json";
    public static final String MAPPING_FILE = "mapping.json";

    private final Path root;

    public PoolLayout(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public Path objectsRoot() {
        return root.resolve(Identifiers.HASH_ALGORITHM);
    }

    public Path functionDirectory(String hash) {
        return split(objectsRoot(), hash);
    }

    public Path objectFile(String hash) {
        return functionDirectory(hash).resolve(OBJECT_FILE);
    }

    public Path languageDirectory(String hash, String language) {
        return functionDirectory(hash).resolve(language);
    }

    public Path mappingsRoot(String hash, String language) {
        return languageDirectory(hash, language).resolve(Identifiers.HASH_ALGORITHM);
    }

    public Path mappingFile(String hash, String language, String mappingHash) {
        return split(mappingsRoot(hash, language), mappingHash).resolve(MAPPING_FILE);
    }

    public Path legacyFile(String hash) {
        return root.resolve(hash.substring(0, 2)).resolve(hash.substring(2) + ".json");
    }

    private static Path split(Path base, String hash) {
        return base.resolve(hash.substring(0, 2)).resolve(hash.substring(2));
    }
}
