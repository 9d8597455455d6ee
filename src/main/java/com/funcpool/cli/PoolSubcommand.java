package com.funcpool.cli;

import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.cli.validation.TargetParser;
import com.funcpool.exception.ExecutionException;
import com.funcpool.exception.PoolException;
import com.funcpool.service.PoolService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Common behavior of subcommands: results go to stdout, a failure is reported as a single
 * {@code Error:} line on stderr with exit code 1.
 */
public abstract class PoolSubcommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(PoolSubcommand.class);

    @ParentCommand
    private FuncPoolCommand root;

    @Spec
    private CommandSpec spec;

    protected final TargetParser targets = new TargetParser();

    @Override
    public Integer call() {
        try {
            return execute(root.service(), new PoolResultsPrinter(spec.commandLine().getOut()));
        } catch (ExecutionException e) {
            log.debug("{} failed", spec.name(), e);
            PrintWriter err = spec.commandLine().getErr();
            if (!e.getStderr().isEmpty()) {
                err.println(e.getStderr());
            }
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (PoolException e) {
            log.debug("{} failed", spec.name(), e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        } finally {
            spec.commandLine().getOut().flush();
            spec.commandLine().getErr().flush();
        }
    }

    protected abstract int execute(PoolService service, PoolResultsPrinter printer);
}
