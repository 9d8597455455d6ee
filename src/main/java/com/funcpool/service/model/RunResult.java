package com.funcpool.service.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RunResult {
    String hash;
    String language;
    String functionName;

    /** Denormalized source of the entry function. */
    String source;

    /** Number of functions loaded besides the entry function. */
    int dependencyCount;

    List<String> arguments;
    String output;
}
