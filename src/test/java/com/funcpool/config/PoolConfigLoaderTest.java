package com.funcpool.config;

import com.funcpool.exception.PoolException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PoolConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultsUnderUserHome() {
        PoolConfig config = new PoolConfigLoader(Map.of(), tempDir.toString(), "alice").load(null, null);

        Path base = tempDir.resolve(".local").resolve("funcpool");
        assertThat(config.getBaseDirectory()).isEqualTo(base);
        assertThat(config.getPoolDirectory()).isEqualTo(base.resolve("pool"));
        assertThat(config.getConfigFile()).isEqualTo(base.resolve("config.json"));
        assertThat(config.getAuthor()).isEqualTo("alice");
        assertThat(config.getLanguages()).isEmpty();
        assertThat(config.getPythonExecutable()).isEqualTo("python3");
        assertThat(config.getExecutionTimeout()).isEqualTo(Duration.ofSeconds(120));
    }

    @Test
    void testEnvironmentMovesBaseDirectory() {
        Map<String, String> env = Map.of(PoolConfigLoader.ENV_DIRECTORY, tempDir.toString(),
                PoolConfigLoader.ENV_PYTHON, "/opt/python/bin/python3");

        PoolConfig config = new PoolConfigLoader(env, "/home/alice", "alice").load(null, null);

        assertThat(config.getPoolDirectory()).isEqualTo(tempDir.resolve("pool"));
        assertThat(config.getPythonExecutable()).isEqualTo("/opt/python/bin/python3");
    }

    @Test
    void testConfigurationFileIsApplied() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, """
                {
                  "user": {"name": "Alice Martin", "email": "alice@example.org", "languages": ["fra", "eng"]},
                  "python": "pypy3",
                  "timeout_seconds": 5
                }
                """);
        Path pool = tempDir.resolve("elsewhere");

        PoolConfig config = new PoolConfigLoader(Map.of(), tempDir.toString(), "alice").load(pool, file);

        assertThat(config.getPoolDirectory()).isEqualTo(pool);
        assertThat(config.getUserName()).isEqualTo("Alice Martin");
        assertThat(config.getUserEmail()).isEqualTo("alice@example.org");
        assertThat(config.getLanguages()).containsExactly("fra", "eng");
        assertThat(config.getPythonExecutable()).isEqualTo("pypy3");
        assertThat(config.getExecutionTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void testEnvironmentWinsOverFile() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"python\": \"pypy3\"}");

        PoolConfig config = new PoolConfigLoader(Map.of(PoolConfigLoader.ENV_PYTHON, "python3.12"),
                tempDir.toString(), "alice").load(null, file);

        assertThat(config.getPythonExecutable()).isEqualTo("python3.12");
    }

    @Test
    void testInvalidFileIsRejected() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"timeout_seconds\": 0}");
        PoolConfigLoader loader = new PoolConfigLoader(Map.of(), tempDir.toString(), "alice");

        assertThatThrownBy(() -> loader.load(null, file))
                .isInstanceOf(PoolException.class)
                .hasMessageStartingWith("timeout_seconds must be positive");

        Files.writeString(file, "[1, 2]");
        assertThatThrownBy(() -> loader.load(null, file))
                .isInstanceOf(PoolException.class)
                .hasMessageEndingWith("does not hold a JSON object");
    }
}
