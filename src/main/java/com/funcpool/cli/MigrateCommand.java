package com.funcpool.cli;

import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import com.funcpool.storage.migration.MigrationReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "migrate", description = "Move functions from the legacy layout to the current one.")
public class MigrateCommand extends PoolSubcommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "HASH", description = "Function to migrate; all when omitted")
    private String hash;

    @Option(names = {"--keep-legacy"}, description = "Keep the legacy files after migration")
    private boolean keepLegacy;

    @Option(names = {"--dry-run"}, description = "Only list what would be migrated")
    private boolean dryRun;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        MigrationReport report = service.migrate(hash == null ? null : targets.hash(hash), keepLegacy, dryRun);
        printer.printMigration(report);
        return report.hasFailures() ? 1 : 0;
    }
}
