package org.javai.runner.config;

import org.javai.runner.RunnerException;

import java.nio.file.Path;

/**
 * Loads runner configuration from a file.
 */
@FunctionalInterface
public interface ConfigLoader {

    /**
     * @param path the configuration file; a missing file yields defaults
     * @throws RunnerException {@link org.javai.runner.RunnerError#INVALID_CONFIG} if the file
     *         cannot be read or parsed, or holds invalid values
     */
    RunnerConfig load(Path path) throws RunnerException;
}
