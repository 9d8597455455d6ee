package com.funcpool;

import com.funcpool.cli.FuncPoolCommand;
import picocli.CommandLine;

/**
 * Main entry point of the funcpool command line.
 */
public class FuncPoolApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FuncPoolCommand()).execute(args);
        System.exit(exitCode);
    }
}
