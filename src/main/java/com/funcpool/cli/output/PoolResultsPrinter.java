package com.funcpool.cli.output;

import com.funcpool.service.model.AddResult;
import com.funcpool.service.model.LogEntry;
import com.funcpool.service.model.ReviewItem;
import com.funcpool.service.model.ReviewResult;
import com.funcpool.service.model.RunResult;
import com.funcpool.service.model.SearchHit;
import com.funcpool.service.model.ShowResult;
import com.funcpool.storage.MappingVariant;
import com.funcpool.storage.ValidationResult;
import com.funcpool.storage.migration.MigrationReport;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

/**
 * Responsible only for printing command results. No validation, no execution.
 */
public class PoolResultsPrinter {

    private static final String RULE = "=".repeat(60);

    private final PrintWriter out;

    public PoolResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printAdded(AddResult result) {
        out.println("Hash: " + result.getHash());
        out.println("Mapping hash: " + result.getMappingHash());
        if (!result.isNewObject()) {
            out.println("Function already in pool, added mapping for " + result.getLanguage());
        }
    }

    public void printSource(String source) {
        out.println(source);
    }

    public void printShow(ShowResult result) {
        if (!result.isAmbiguous()) {
            out.println(result.getSource());
            return;
        }
        out.println("Multiple mappings found for '" + result.getLanguage() + "'. Please choose one:");
        out.println();
        for (MappingVariant variant : result.getVariants()) {
            String comment = variant.getComment().isEmpty() ? "" : "  # " + variant.getComment();
            out.println("funcpool show " + result.getHash() + "@" + result.getLanguage() + "@"
                    + variant.getMappingHash() + comment);
        }
    }

    public void printMapping(String hash, String language, String mappingHash) {
        out.println("Mapping hash: " + mappingHash);
        out.println("View with: funcpool show " + hash + "@" + language);
    }

    public void printRun(RunResult result) {
        if (result.getDependencyCount() > 0) {
            out.println("Loaded " + result.getDependencyCount() + " dependencies");
        }
        out.println("Running function: " + result.getFunctionName() + " (" + result.getLanguage() + ")");
        out.println(RULE);
        out.println(result.getSource());
        out.println(RULE);
        out.println("Calling: " + result.getFunctionName() + "(" + String.join(", ", result.getArguments()) + ")");
        out.println("Result: " + result.getOutput());
    }

    public void printReview(ReviewResult result) {
        int index = 1;
        for (ReviewItem item : result.getItems()) {
            out.println("[" + index++ + "/" + result.getItems().size() + "] " + item.getHash()
                    + " (" + item.getLanguage() + ")");
            out.println(RULE);
            out.println(item.getSource());
            out.println(RULE);
        }
        for (String warning : result.getWarnings()) {
            out.println("Warning: " + warning);
        }
    }

    public void printLog(List<LogEntry> entries) {
        if (entries.isEmpty()) {
            out.println("No functions in pool");
            return;
        }
        out.println("Function Pool Log (" + entries.size() + " functions)");
        out.println(RULE);
        for (LogEntry entry : entries) {
            out.println();
            out.println("Hash: " + entry.getHash());
            out.println("Date: " + nullToUnknown(entry.getCreated()));
            out.println("Author: " + nullToUnknown(entry.getAuthor()));
            out.println("Languages: " + (entry.getLanguages().isEmpty() ? "none" : String.join(", ", entry.getLanguages())));
        }
    }

    public void printSearch(List<String> terms, List<SearchHit> hits) {
        out.println("Search Results (" + hits.size() + " matches for: " + String.join(" ", terms) + ")");
        out.println(RULE);
        if (hits.isEmpty()) {
            out.println("No matches found");
            return;
        }
        for (SearchHit hit : hits) {
            out.println();
            out.println("Name: " + hit.getFunctionName() + " (" + hit.getLanguage() + ")");
            out.println("Hash: " + hit.getHash());
            out.println("Match: " + String.join(", ", hit.getMatchedIn()));
            out.println("View: funcpool show " + hit.getHash() + "@" + hit.getLanguage() + "@" + hit.getMappingHash());
        }
    }

    public void printHashes(List<String> hashes, String command, String emptyMessage) {
        if (hashes.isEmpty()) {
            out.println(emptyMessage);
            return;
        }
        for (String hash : hashes) {
            out.println("funcpool " + command + " " + hash);
        }
    }

    public void printMigration(MigrationReport report) {
        if (report.isDryRun()) {
            out.println("Would migrate " + report.getPending().size() + " function(s)");
            report.getPending().forEach(hash -> out.println("  " + hash));
            return;
        }
        out.println("Migrated " + report.getMigrated().size() + " function(s)");
        report.getMigrated().forEach(hash -> out.println("  " + hash));
        if (report.hasFailures()) {
            out.println("Failed " + report.getFailed().size() + " function(s)");
            report.getFailed().forEach((hash, reason) -> out.println("  " + hash + ": " + reason));
        }
    }

    public void printValidation(String hash, ValidationResult result) {
        if (result.isOk()) {
            out.println("Function " + hash + " is valid");
            return;
        }
        out.println("Function " + hash + " is invalid:");
        result.getErrors().forEach(error -> out.println("  - " + error));
    }

    public void printPoolValidation(Map<String, ValidationResult> results) {
        long invalid = results.values().stream().filter(result -> !result.isOk()).count();
        out.println("Pool Validation");
        out.println(RULE);
        out.println("Functions total:   " + results.size());
        out.println("Functions valid:   " + (results.size() - invalid));
        out.println("Functions invalid: " + invalid);
        results.forEach((hash, result) -> {
            if (!result.isOk()) {
                out.println();
                printValidation(hash, result);
            }
        });
    }

    private static String nullToUnknown(String value) {
        return value == null ? "unknown" : value;
    }
}
