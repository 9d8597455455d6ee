package com.funcpool.cli;

import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;

@Command(name = "log", description = "List every function, newest first.")
public class LogCommand extends PoolSubcommand {

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        printer.printLog(service.log());
        return 0;
    }
}
