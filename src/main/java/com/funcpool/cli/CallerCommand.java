package com.funcpool.cli;

import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "caller", description = "List the functions that import a function.")
public class CallerCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "HASH")
    private String hash;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        printer.printHashes(service.callers(targets.hash(hash)), "show", "No callers found.");
        return 0;
    }
}
