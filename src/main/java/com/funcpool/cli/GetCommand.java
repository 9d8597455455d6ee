package com.funcpool.cli;

import com.funcpool.cli.model.FunctionTarget;
import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "get", description = "Print a function in a language with a single mapping.")
public class GetCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "HASH@LANG")
    private String target;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        FunctionTarget function = targets.function(target, true);
        printer.printSource(service.get(function.getHash(), function.getLanguage()));
        return 0;
    }
}
