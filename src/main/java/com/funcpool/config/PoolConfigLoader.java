package com.funcpool.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.funcpool.exception.PoolException;
import com.funcpool.storage.PoolJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link PoolConfig}. Command line options win over the environment, which wins over
 * the user configuration file.
 *
 * <pre>
 * {
 *   "user": {"name": "...", "email": "...", "languages": ["eng", "fra"]},
 *   "python": "python3",
 *   "timeout_seconds": 120
 * }
 * </pre>
 */
public class PoolConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PoolConfigLoader.class);

    public static final String ENV_DIRECTORY = "FUNCPOOL_DIRECTORY";
    public static final String ENV_PYTHON = "FUNCPOOL_PYTHON";

    private final Map<String, String> environment;
    private final String userHome;
    private final String osUser;

    public PoolConfigLoader() {
        this(System.getenv(), System.getProperty("user.home"), System.getProperty("user.name"));
    }

    public PoolConfigLoader(Map<String, String> environment, String userHome, String osUser) {
        this.environment = environment;
        this.userHome = userHome;
        this.osUser = osUser;
    }

    /**
     * @param poolDirectory explicit pool directory, or null
     * @param configFile explicit configuration file, or null
     */
    public PoolConfig load(Path poolDirectory, Path configFile) {
        String envDirectory = environment.get(ENV_DIRECTORY);
        Path base = envDirectory != null && !envDirectory.isBlank()
                ? Path.of(envDirectory)
                : Path.of(userHome, ".local", "funcpool");
        Path config = configFile != null ? configFile : base.resolve("config.json");

        PoolConfig.PoolConfigBuilder builder = PoolConfig.builder()
                .baseDirectory(base)
                .poolDirectory(poolDirectory != null ? poolDirectory : base.resolve("pool"))
                .configFile(config)
                .author(osUser);

        if (Files.isRegularFile(config)) {
            applyFile(builder, config);
        } else {
            log.debug("No configuration file at {}", config);
        }

        String python = environment.get(ENV_PYTHON);
        if (python != null && !python.isBlank()) {
            builder.pythonExecutable(python);
        }
        return builder.build();
    }

    private void applyFile(PoolConfig.PoolConfigBuilder builder, Path config) {
        JsonNode root = PoolJson.readTree(config);
        if (!root.isObject()) {
            throw new PoolException("Configuration file " + config + " does not hold a JSON object");
        }
        JsonNode user = root.path("user");
        if (user.hasNonNull("name")) {
            builder.userName(user.get("name").asText());
        }
        if (user.hasNonNull("email")) {
            builder.userEmail(user.get("email").asText());
        }
        if (user.path("languages").isArray()) {
            List<String> languages = new ArrayList<>();
            user.get("languages").forEach(language -> languages.add(language.asText()));
            builder.languages(List.copyOf(languages));
        }
        if (root.hasNonNull("python")) {
            builder.pythonExecutable(root.get("python").asText());
        }
        if (root.has("timeout_seconds")) {
            long seconds = root.get("timeout_seconds").asLong();
            if (seconds <= 0) {
                throw new PoolException("timeout_seconds must be positive in " + config);
            }
            builder.executionTimeout(Duration.ofSeconds(seconds));
        }
        log.debug("Loaded configuration from {}", config);
    }
}
