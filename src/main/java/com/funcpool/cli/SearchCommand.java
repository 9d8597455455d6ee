package com.funcpool.cli;

import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "search", description = "Search function names, docstrings and identifiers.")
public class SearchCommand extends PoolSubcommand {

    @Parameters(arity = "1..*", paramLabel = "TERM")
    private List<String> terms;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        printer.printSearch(terms, service.search(terms));
        return 0;
    }
}
