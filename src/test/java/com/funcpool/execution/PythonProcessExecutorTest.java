package com.funcpool.execution;

import com.funcpool.canonical.ContentHasher;
import com.funcpool.exception.ExecutionException;
import com.funcpool.resolve.BindingEnvironment;
import com.funcpool.resolve.ResolvedProgram;
import com.funcpool.resolve.ResolvedUnit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonProcessExecutorTest {

    private static final String PYTHON = "python3";

    private final PythonProcessExecutor executor = new PythonProcessExecutor(PYTHON, Duration.ofSeconds(30));

    @BeforeAll
    static void requireInterpreter() {
        assumeTrue(interpreterAvailable(), PYTHON + " is not installed");
    }

    @Test
    void testOutputIsReturned() {
        String output = executor.execute("import sys\nprint('-'.join(sys.argv[1:]))\n", List.of("a", "b c"));

        assertThat(output).isEqualTo("a-b c");
    }

    @Test
    void testFailureCarriesStandardError() {
        assertThatThrownBy(() -> executor.execute("raise ValueError('boom')\n", List.of()))
                .isInstanceOf(ExecutionException.class)
                .hasMessage("Program exited with code 1: ValueError: boom")
                .satisfies(e -> assertThat(((ExecutionException) e).getStderr()).contains("Traceback"));
    }

    @Test
    void testRenderedCycleRuns() {
        String ping = ContentHasher.sha256("ping");
        String pong = ContentHasher.sha256("pong");
        BindingEnvironment environment = new BindingEnvironment();
        environment.bind(pong, "ping", ping, true);
        environment.bind(ping, "pong", pong, false);
        ResolvedProgram program = new ResolvedProgram(List.of(
                countdown(pong, "pong", "ping", ping),
                countdown(ping, "ping", "pong", pong)), environment, ping);

        String output = executor.execute(new ProgramRenderer().render(program), List.of("8"));

        assertThat(output).isEqualTo("ping:0");
    }

    @Test
    void testSlowProgramTimesOut() {
        PythonProcessExecutor impatient = new PythonProcessExecutor(PYTHON, Duration.ofMillis(500));

        assertThatThrownBy(() -> impatient.execute("import time\ntime.sleep(10)\n", List.of()))
                .isInstanceOf(ExecutionException.class)
                .hasMessageStartingWith("Program did not complete within");
    }

    private static ResolvedUnit countdown(String hash, String name, String callee, String reference) {
        String source = """
                def %1$s(n):
                    if n <= 0:
                        return '%1$s:' + str(n)
                    return %2$s(n - 1)""".formatted(name, callee);
        return ResolvedUnit.builder()
                .hash(hash)
                .language("eng")
                .functionName(name)
                .displaySource(source)
                .source(source)
                .references(List.of(reference))
                .build();
    }

    private static boolean interpreterAvailable() {
        try {
            Process process = new ProcessBuilder(PYTHON, "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
