package com.funcpool.resolve;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One function of a resolved program, denormalized in the language picked for it.
 */
@Value
@Builder
public class ResolvedUnit {
    String hash;
    String language;
    String functionName;

    /**
     * Denormalized source as a user reads it, pool imports included.
     */
    String displaySource;

    /**
     * Denormalized source with pool and runtime imports removed, ready to be linked.
     */
    String source;

    /**
     * Every pool hash the source refers to: imported dependencies and check targets.
     */
    List<String> references;
}
