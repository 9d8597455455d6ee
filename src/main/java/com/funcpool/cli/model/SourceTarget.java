package com.funcpool.cli.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * A source file named on the command line as {@code path/to/file.py@lang}.
 */
@Value
public class SourceTarget {
    Path file;
    String language;
}
