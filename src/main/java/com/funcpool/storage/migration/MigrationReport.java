package com.funcpool.storage.migration;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch migration. Pure structure: no logging, no formatting.
 */
@Getter
public class MigrationReport {
    private final boolean dryRun;
    private final List<String> migrated = new ArrayList<>();
    private final List<String> pending = new ArrayList<>();
    private final Map<String, String> failed = new LinkedHashMap<>();

    public MigrationReport(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    /**
     * Hashes that were migrated or, for a dry run, would be.
     */
    public List<String> affected() {
        return dryRun ? pending : migrated;
    }
}
