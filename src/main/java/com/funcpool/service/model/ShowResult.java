package com.funcpool.service.model;

import com.funcpool.storage.MappingVariant;
import lombok.Value;

import java.util.List;

/**
 * Either the readable source of a function or, when the language has several mappings and none
 * was chosen, the variants to choose from.
 */
@Value
public class ShowResult {
    String hash;
    String language;
    String source;
    List<MappingVariant> variants;

    public static ShowResult source(String hash, String language, String source) {
        return new ShowResult(hash, language, source, List.of());
    }

    public static ShowResult choices(String hash, String language, List<MappingVariant> variants) {
        return new ShowResult(hash, language, null, List.copyOf(variants));
    }

    public boolean isAmbiguous() {
        return source == null;
    }
}
