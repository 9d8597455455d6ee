package com.funcpool.canonical;

import com.funcpool.exception.PoolException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content addresses for functions and their mappings.
 */
public final class ContentHasher {

    private ContentHasher() {
    }

    /**
     * Identity of a function: the hash of its canonical text without the docstring.
     */
    public static String identityHash(CanonicalForm form) {
        return sha256(form.getWithoutDocstring());
    }

    /**
     * Identity of a mapping: the hash of the canonical JSON of its four fields. Identical mappings
     * therefore share one address.
     */
    public static String mappingHash(String docstring, Map<String, String> nameMapping,
                                     Map<String, String> aliasMapping, String comment) {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("docstring", docstring == null ? "" : docstring);
        fields.put("name_mapping", new TreeMap<>(nameMapping));
        fields.put("alias_mapping", new TreeMap<>(aliasMapping));
        fields.put("comment", comment == null ? "" : comment);
        return sha256(CanonicalJson.write(fields));
    }

    public static String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new PoolException("SHA-256 is not available in this JVM", e);
        }
    }
}
