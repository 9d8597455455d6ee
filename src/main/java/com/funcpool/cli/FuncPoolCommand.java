package com.funcpool.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.funcpool.config.PoolConfig;
import com.funcpool.config.PoolConfigLoader;
import com.funcpool.service.PoolService;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Root command. Holds the options shared by every subcommand and builds the service they use.
 */
@Command(
        name = "funcpool",
        mixinStandardHelpOptions = true,
        version = "funcpool 1.0.0",
        description = "Content-addressed pool of Python functions with localized names.",
        subcommands = {
                AddCommand.class,
                GetCommand.class,
                ShowCommand.class,
                TranslateCommand.class,
                RunCommand.class,
                ReviewCommand.class,
                LogCommand.class,
                SearchCommand.class,
                CallerCommand.class,
                CheckCommand.class,
                RefactorCommand.class,
                MigrateCommand.class,
                ValidateCommand.class
        }
)
public class FuncPoolCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--pool-dir"}, description = "Pool directory (default: $FUNCPOOL_DIRECTORY/pool or ~/.local/funcpool/pool)")
    private Path poolDir;

    @Option(names = {"--config"}, description = "User configuration file (default: <base>/config.json)")
    private Path configFile;

    @Option(names = {"--verbose", "-v"}, description = "Log diagnostics to stderr")
    private boolean verbose;

    private final PoolConfigLoader configLoader;
    private PoolService service;

    public FuncPoolCommand() {
        this(new PoolConfigLoader());
    }

    public FuncPoolCommand(PoolConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }

    PoolService service() {
        if (service == null) {
            if (verbose) {
                ((Logger) LoggerFactory.getLogger("com.funcpool")).setLevel(Level.DEBUG);
            }
            PoolConfig config = configLoader.load(poolDir, configFile);
            service = new PoolService(config);
        }
        return service;
    }
}
