package com.funcpool.cli;

import com.funcpool.cli.model.FunctionTarget;
import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Print a function, or list its mappings when the choice is ambiguous.")
public class ShowCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "HASH@LANG[@MAPPING]")
    private String target;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        FunctionTarget function = targets.function(target, true);
        printer.printShow(service.show(function.getHash(), function.getLanguage(), function.getMappingHash()));
        return 0;
    }
}
