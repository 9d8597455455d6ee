package com.funcpool.canonical;

import com.funcpool.exception.PoolException;

import java.util.regex.Pattern;

/**
 * Names and identifier formats shared by the canonical form, the pool layout and the command line.
 */
public final class Identifiers {

    /** Module that pool functions are imported from. */
    public static final String POOL_MODULE = "funcpool.pool";

    /** Module that provides the {@code check} decorator. */
    public static final String RUNTIME_MODULE = "funcpool";

    public static final String CHECK_DECORATOR = "check";

    /** Prefix that turns a hash into a valid Python identifier. */
    public static final String OBJECT_PREFIX = "object_";

    public static final String SLOT_PREFIX = "_fp_v_";

    /** Slot of the function's own name. */
    public static final String ENTRY_SLOT = SLOT_PREFIX + "0";

    public static final String HASH_ALGORITHM = "sha256";

    private static final Pattern HASH = Pattern.compile("[0-9a-f]{64}");
    private static final Pattern LANGUAGE = Pattern.compile("[A-Za-z0-9_-]{3,256}");
    private static final Pattern SLOT = Pattern.compile(Pattern.quote(SLOT_PREFIX) + "(0|[1-9][0-9]*)");
    private static final Pattern OBJECT_REFERENCE = Pattern.compile(Pattern.quote(OBJECT_PREFIX) + "[0-9a-f]{64}");

    private Identifiers() {
    }

    public static boolean isHash(String value) {
        return value != null && HASH.matcher(value).matches();
    }

    public static boolean isLanguage(String value) {
        return value != null && LANGUAGE.matcher(value).matches();
    }

    public static boolean isSlot(String value) {
        return value != null && SLOT.matcher(value).matches();
    }

    public static boolean isObjectReference(String value) {
        return value != null && OBJECT_REFERENCE.matcher(value).matches();
    }

    public static String requireHash(String value) {
        if (!isHash(value)) {
            throw new PoolException("Invalid hash '" + value + "': expected 64 lowercase hexadecimal characters");
        }
        return value;
    }

    public static String requireLanguage(String value) {
        if (!isLanguage(value)) {
            throw new PoolException("Invalid language code '" + value
                    + "': expected 3 to 256 characters from [A-Za-z0-9_-]");
        }
        return value;
    }

    public static String slot(int index) {
        return SLOT_PREFIX + index;
    }

    public static String objectReference(String hash) {
        return OBJECT_PREFIX + hash;
    }

    /**
     * Hash named by an {@code object_<hash>} reference, or null when the name is not one.
     */
    public static String hashOfReference(String name) {
        return isObjectReference(name) ? name.substring(OBJECT_PREFIX.length()) : null;
    }
}
