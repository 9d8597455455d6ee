package com.funcpool.cli;

import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "check", description = "List the functions declared as tests of a function.")
public class CheckCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "HASH")
    private String hash;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        printer.printHashes(service.checks(targets.hash(hash)), "run", "No tests found.");
        return 0;
    }
}
