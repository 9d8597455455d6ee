package com.funcpool.cli.validation;

import com.funcpool.canonical.Identifiers;
import com.funcpool.cli.exception.OptionsValidationException;
import com.funcpool.cli.model.FunctionTarget;
import com.funcpool.cli.model.SourceTarget;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses and checks the targets and values given on the command line. All problems of one value
 * are reported together.
 */
public class TargetParser {

    public FunctionTarget function(String raw, boolean languageRequired) {
        List<String> errors = new ArrayList<>();
        String[] parts = raw == null ? new String[]{""} : raw.split("@", -1);
        if (parts.length > 3) {
            errors.add("Expected HASH@lang[@mappingHash], got: " + raw);
            throw new OptionsValidationException(errors);
        }

        String hash = parts[0];
        if (!Identifiers.isHash(hash)) {
            errors.add("Invalid hash format. Expected 64 hex characters. Got: " + hash);
        }
        String language = parts.length > 1 ? parts[1] : null;
        if (language == null && languageRequired) {
            errors.add("Missing language suffix. Use format: HASH@lang");
        } else if (language != null && !Identifiers.isLanguage(language)) {
            errors.add("Language code must be 3-256 characters from [A-Za-z0-9_-]. Got: " + language);
        }
        String mappingHash = parts.length > 2 ? parts[2] : null;
        if (mappingHash != null && !Identifiers.isHash(mappingHash)) {
            errors.add("Invalid mapping hash format. Expected 64 hex characters. Got: " + mappingHash);
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return new FunctionTarget(hash, language, mappingHash);
    }

    public SourceTarget source(String raw) {
        List<String> errors = new ArrayList<>();
        int at = raw.lastIndexOf('@');
        if (at < 0 || (!Identifiers.isLanguage(raw.substring(at + 1)) && Files.isRegularFile(Path.of(raw)))) {
            errors.add("Missing language suffix. Use format: path/to/file.py@lang");
            throw new OptionsValidationException(errors);
        }
        Path file = Path.of(raw.substring(0, at));
        String language = raw.substring(at + 1);
        if (!Identifiers.isLanguage(language)) {
            errors.add("Language code must be 3-256 characters from [A-Za-z0-9_-]. Got: " + language);
        }
        if (!Files.isRegularFile(file)) {
            errors.add("File not found: " + file);
        }
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return new SourceTarget(file, language);
    }

    public String hash(String raw) {
        if (!Identifiers.isHash(raw)) {
            throw new OptionsValidationException(
                    List.of("Invalid hash format. Expected 64 hex characters. Got: " + raw));
        }
        return raw;
    }

    public String language(String raw) {
        if (!Identifiers.isLanguage(raw)) {
            throw new OptionsValidationException(
                    List.of("Language code must be 3-256 characters from [A-Za-z0-9_-]. Got: " + raw));
        }
        return raw;
    }

    /**
     * Parses {@code old=new} pairs, keeping their order.
     */
    public Map<String, String> renames(List<String> pairs) {
        List<String> errors = new ArrayList<>();
        Map<String, String> renames = new LinkedHashMap<>();
        for (String pair : pairs) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                errors.add("Expected OLD=NEW, got: " + pair);
                continue;
            }
            String previous = renames.put(pair.substring(0, eq), pair.substring(eq + 1));
            if (previous != null) {
                errors.add("Name given twice: " + pair.substring(0, eq));
            }
        }
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        return renames;
    }
}
