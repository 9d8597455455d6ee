package com.funcpool.exception;

import java.util.List;

/**
 * Several mapping variants exist for a language and none was chosen.
 */
public class AmbiguousMappingException extends PoolException {

    private static final long serialVersionUID = 1L;
    private final String hash;
    private final String language;
    private final List<String> candidates;

    public AmbiguousMappingException(String hash, String language, List<String> candidates) {
        super(String.format("Function %s has %d mappings for language '%s'; choose one of: %s",
                hash, candidates.size(), language, String.join(", ", candidates)));
        this.hash = hash;
        this.language = language;
        this.candidates = List.copyOf(candidates);
    }

    public String getHash() {
        return hash;
    }

    public String getLanguage() {
        return language;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
