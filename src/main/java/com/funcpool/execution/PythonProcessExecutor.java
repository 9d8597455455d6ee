package com.funcpool.execution;

import com.funcpool.exception.ExecutionException;
import com.funcpool.exception.PoolStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs programs in a fresh interpreter process. The script goes to a temporary file that is
 * removed afterwards.
 */
public class PythonProcessExecutor implements ProgramExecutor {
    private static final Logger log = LoggerFactory.getLogger(PythonProcessExecutor.class);

    private final String interpreter;
    private final Duration timeout;

    public PythonProcessExecutor(String interpreter, Duration timeout) {
        this.interpreter = interpreter;
        this.timeout = timeout;
    }

    @Override
    public String execute(String script, List<String> arguments) {
        Path scriptFile = writeScript(script);
        try {
            return run(scriptFile, arguments);
        } finally {
            try {
                Files.deleteIfExists(scriptFile);
            } catch (IOException e) {
                log.warn("Could not delete temporary script {}: {}", scriptFile, e.getMessage());
            }
        }
    }

    private String run(Path scriptFile, List<String> arguments) {
        List<String> command = new ArrayList<>();
        command.add(interpreter);
        command.add(scriptFile.toString());
        command.addAll(arguments);
        log.debug("Running {}", command);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectInput(ProcessBuilder.Redirect.from(new File(isWindows() ? "NUL" : "/dev/null")));
        pb.environment().put("PYTHONIOENCODING", "utf-8");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExecutionException("Unable to start interpreter '" + interpreter + "': " + e.getMessage(), e);
        }

        // drain both pipes right away so a chatty program cannot block on a full buffer
        CompletableFuture<String> stdoutFuture = CompletableFuture.supplyAsync(() -> readStream(process.getInputStream()));
        CompletableFuture<String> stderrFuture = CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExecutionException("Program did not complete within " + timeout.toSeconds() + " seconds",
                        stderrFuture.join());
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExecutionException("Interrupted while waiting for the program", e);
        }

        String stdout = stdoutFuture.join();
        String stderr = stderrFuture.join();
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new ExecutionException("Program exited with code " + exitCode + lastLine(stderr), stderr);
        }
        return stdout;
    }

    private static Path writeScript(String script) {
        Path scriptFile = null;
        try {
            scriptFile = Files.createTempFile("funcpool-", ".py");
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);
            return scriptFile;
        } catch (IOException e) {
            throw new PoolStorageException("Failed to write program script", scriptFile, e);
        }
    }

    private static String readStream(InputStream in) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            log.debug("Program output closed early: {}", e.getMessage());
        }
        return String.join("\n", lines);
    }

    private static String lastLine(String stderr) {
        String trimmed = stderr.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return ": " + trimmed.substring(trimmed.lastIndexOf('\n') + 1);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
    }
}
