package com.funcpool.cli;

import com.funcpool.config.PoolConfigLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FuncPoolCommandTest {

    @TempDir
    Path tempDir;

    private Path pool;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        pool = tempDir.resolve("pool");
        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    void testAddThenGet() throws IOException {
        Path file = writeSource("sum.py", """
                def calculate_sum(first, second):
                    \"\"\"Add two numbers\"\"\"
                    return first + second
                """);

        assertThat(execute("add", file + "@eng", "-m", "first version")).isZero();
        String hash = hashFromOutput();
        assertThat(out.toString()).contains("Mapping hash: ");

        out.getBuffer().setLength(0);
        assertThat(execute("get", hash + "@eng")).isZero();
        assertThat(out.toString().strip()).isEqualTo("""
                def calculate_sum(first, second):
                    \"\"\"Add two numbers\"\"\"
                    return first + second""");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testTranslateThenShowChoices() throws IOException {
        Path file = writeSource("square.py", "def square(n):\n    return n * n\n");
        execute("add", file + "@eng");
        String hash = hashFromOutput();

        assertThat(execute("translate", hash + "@eng", "fra", "-n", "square=carre", "-n", "n=nombre")).isZero();
        assertThat(execute("translate", hash + "@eng", "fra", "-n", "square=au_carre", "-n", "n=x",
                "-m", "court")).isZero();

        out.getBuffer().setLength(0);
        assertThat(execute("show", hash + "@fra")).isZero();
        List<String> lines = out.toString().lines().toList();
        assertThat(lines.get(0)).isEqualTo("Multiple mappings found for 'fra'. Please choose one:");
        assertThat(lines).filteredOn(line -> line.startsWith("funcpool show " + hash + "@fra@")).hasSize(2)
                .anyMatch(line -> line.endsWith("  # court"));
    }

    @Test
    void testMissingLanguageSuffixIsReported() {
        String hash = "a".repeat(64);

        assertThat(execute("get", hash)).isEqualTo(1);
        assertThat(err.toString().strip()).isEqualTo("Error: Missing language suffix. Use format: HASH@lang");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testUnknownFunctionIsReported() {
        String hash = "b".repeat(64);

        assertThat(execute("show", hash + "@eng")).isEqualTo(1);
        assertThat(err.toString().strip()).isEqualTo("Error: Function not found: " + hash);
    }

    @Test
    void testMissingFileIsReported() {
        Path missing = tempDir.resolve("missing.py");

        assertThat(execute("add", missing + "@eng")).isEqualTo(1);
        assertThat(err.toString().strip()).isEqualTo("Error: File not found: " + missing);
    }

    @Test
    void testEmptyPool() {
        assertThat(execute("log")).isZero();
        assertThat(out.toString().strip()).isEqualTo("No functions in pool");

        out.getBuffer().setLength(0);
        assertThat(execute("caller", "c".repeat(64))).isZero();
        assertThat(out.toString().strip()).isEqualTo("No callers found.");
    }

    @Test
    void testValidateAddedFunction() throws IOException {
        Path file = writeSource("inc.py", "def inc(n):\n    return n + 1\n");
        execute("add", file + "@eng");
        String hash = hashFromOutput();

        out.getBuffer().setLength(0);
        assertThat(execute("validate", hash)).isZero();
        assertThat(out.toString().strip()).isEqualTo("Function " + hash + " is valid");

        out.getBuffer().setLength(0);
        assertThat(execute("validate")).isZero();
        assertThat(out.toString()).contains("Functions total:   1", "Functions invalid: 0");
    }

    @Test
    void testMissingRequiredOptionIsUsageError() {
        assertThat(execute("translate", "d".repeat(64) + "@eng", "fra")).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--name");
    }

    @Test
    void testNoSubcommandPrintsUsage() {
        assertThat(execute()).isEqualTo(1);
        assertThat(err.toString()).contains("Usage: funcpool");
    }

    private int execute(String... args) {
        CommandLine cli = new CommandLine(new FuncPoolCommand(new PoolConfigLoader(Map.of(), tempDir.toString(), "alice")));
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        List<String> arguments = new ArrayList<>(List.of("--pool-dir", pool.toString(),
                "--config", tempDir.resolve("no-config.json").toString()));
        arguments.addAll(List.of(args));
        int exitCode = cli.execute(arguments.toArray(new String[0]));
        cli.getOut().flush();
        cli.getErr().flush();
        return exitCode;
    }

    private String hashFromOutput() {
        return out.toString().lines()
                .filter(line -> line.startsWith("Hash: "))
                .map(line -> line.substring("Hash: ".length()))
                .findFirst()
                .orElseThrow();
    }

    private Path writeSource(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, source);
        return file;
    }
}
