package com.funcpool.config;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings of one invocation, merged from command line options, environment and the user
 * configuration file.
 */
@Data
@Builder
public class PoolConfig {

    /**
     * Base directory holding the pool and the configuration file.
     */
    private Path baseDirectory;

    /**
     * Root of the content-addressed pool.
     */
    private Path poolDirectory;

    /**
     * User configuration file; may not exist.
     */
    private Path configFile;

    /**
     * Operating system account, recorded as the author of new functions.
     */
    private String author;

    private String userName;

    private String userEmail;

    /**
     * Preferred languages, most preferred first.
     */
    @Builder.Default
    private List<String> languages = List.of();

    /**
     * Interpreter used to run resolved programs.
     */
    @Builder.Default
    private String pythonExecutable = "python3";

    @Builder.Default
    private Duration executionTimeout = Duration.ofSeconds(120);
}
