package org.javai.runner.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads {@link RunnerConfig} from a YAML file with snake_case keys, then applies
 * environment overrides:
 *
 * <ul>
 *   <li>{@code RUNNER_CLAUDE__BINARY}</li>
 *   <li>{@code RUNNER_CLAUDE__TIMEOUT_SECONDS}</li>
 *   <li>{@code RUNNER_CACHE__DIR}</li>
 * </ul>
 */
public class YamlConfigLoader implements ConfigLoader {

    private static final Logger logger = LogManager.getLogger(YamlConfigLoader.class);

    static final String ENV_BINARY = "RUNNER_CLAUDE__BINARY";
    static final String ENV_TIMEOUT = "RUNNER_CLAUDE__TIMEOUT_SECONDS";
    static final String ENV_CACHE_DIR = "RUNNER_CACHE__DIR";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    private final Map<String, String> env;

    public YamlConfigLoader() {
        this(System.getenv());
    }

    YamlConfigLoader(Map<String, String> env) {
        this.env = Map.copyOf(env);
    }

    @Override
    public RunnerConfig load(Path path) throws RunnerException {
        RunnerConfig config;
        if (path == null || !Files.exists(path)) {
            logger.info("No configuration at {}, using defaults", path);
            config = RunnerConfig.defaults();
        } else {
            config = read(path);
        }
        return applyEnv(config).validate();
    }

    private RunnerConfig read(Path path) throws RunnerException {
        try {
            JsonNode root = mapper.readTree(path.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                return RunnerConfig.defaults();
            }
            return mapper.treeToValue(root, RunnerConfig.class);
        } catch (IOException e) {
            throw new RunnerException(RunnerError.INVALID_CONFIG,
                    "failed to load configuration from " + path + ": " + e.getMessage(), e);
        }
    }

    private RunnerConfig applyEnv(RunnerConfig config) throws RunnerException {
        RunnerConfig result = config;
        String binary = env.get(ENV_BINARY);
        if (binary != null && !binary.isBlank()) {
            result = result.withClaude(result.claude().withBinary(binary));
        }
        String timeout = env.get(ENV_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            try {
                result = result.withClaude(result.claude().withTimeoutSeconds(Integer.parseInt(timeout.trim())));
            } catch (NumberFormatException e) {
                throw new RunnerException(RunnerError.INVALID_CONFIG,
                        "invalid configuration: " + ENV_TIMEOUT + "=" + timeout + " is not a number", e);
            }
        }
        String cacheDir = env.get(ENV_CACHE_DIR);
        if (cacheDir != null && !cacheDir.isBlank()) {
            result = result.withCache(result.cache().withDir(cacheDir));
        }
        return result;
    }
}
