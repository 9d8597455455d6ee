package com.funcpool.cli;

import com.funcpool.cli.model.FunctionTarget;
import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

@Command(name = "run", description = "Resolve a function with its dependencies and call it.")
public class RunCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "HASH[@LANG]", description = "Without a language, the configured languages are tried")
    private String target;

    @Parameters(index = "1..*", paramLabel = "ARG", description = "Arguments, passed as int, float or str")
    private List<String> arguments = new ArrayList<>();

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        FunctionTarget function = targets.function(target, false);
        List<String> languages = function.hasLanguage() ? List.of(function.getLanguage()) : List.of();
        printer.printRun(service.run(function.getHash(), languages, arguments));
        return 0;
    }
}
