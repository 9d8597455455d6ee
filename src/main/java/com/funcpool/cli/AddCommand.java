package com.funcpool.cli;

import com.funcpool.cli.model.SourceTarget;
import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import com.funcpool.service.model.AddResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "add", description = "Add a function to the pool.")
public class AddCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "FILE@LANG", description = "Python file holding one function, with its language")
    private String target;

    @Option(names = {"--comment", "-m"}, description = "Comment distinguishing this mapping from others in the same language")
    private String comment;

    @Option(names = {"--parent"}, paramLabel = "HASH", description = "Function this one was derived from")
    private String parent;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        SourceTarget source = targets.source(target);
        String parentHash = parent == null ? null : targets.hash(parent);
        AddResult result = service.add(source.getFile(), source.getLanguage(), comment, parentHash);
        printer.printAdded(result);
        return 0;
    }
}
