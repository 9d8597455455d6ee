package com.funcpool.execution;

import java.util.List;

/**
 * Runs a rendered program.
 */
public interface ProgramExecutor {

    /**
     * Runs the script with the given command line arguments and returns what it printed.
     *
     * @throws com.funcpool.exception.ExecutionException on a non-zero exit, a timeout or an interruption
     */
    String execute(String script, List<String> arguments);
}
