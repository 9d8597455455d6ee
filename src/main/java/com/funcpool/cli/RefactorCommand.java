package com.funcpool.cli;

import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "refactor", description = "Copy a function, replacing one of its dependencies with another.")
public class RefactorCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "WHAT")
    private String what;

    @Parameters(index = "1", paramLabel = "FROM")
    private String from;

    @Parameters(index = "2", paramLabel = "TO")
    private String to;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        String hash = service.refactor(targets.hash(what), targets.hash(from), targets.hash(to));
        printer.printHashes(List.of(hash), "show", "");
        return 0;
    }
}
