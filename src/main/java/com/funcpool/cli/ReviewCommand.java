package com.funcpool.cli;

import com.funcpool.cli.model.FunctionTarget;
import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import com.funcpool.service.model.ReviewResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "review", description = "Show a function and its transitive dependencies, lowest level first.")
public class ReviewCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "HASH[@LANG]")
    private String target;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        FunctionTarget function = targets.function(target, false);
        List<String> languages = function.hasLanguage() ? List.of(function.getLanguage()) : List.of();
        ReviewResult result = service.review(function.getHash(), languages);
        printer.printReview(result);
        return 0;
    }
}
