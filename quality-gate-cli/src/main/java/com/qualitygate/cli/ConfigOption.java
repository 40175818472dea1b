package com.qualitygate.cli;

import com.qualitygate.core.config.ConfigLoader;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Shared {@code -c/--config} option.
 */
public class ConfigOption {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: <project>/" + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath;

    /**
     * Resolves the configuration file for a project.
     *
     * @param projectRoot project root
     * @return explicit configuration path, or the default file in the project root
     */
    public Path resolve(Path projectRoot) {
        return configPath != null ? configPath : projectRoot.resolve(ConfigLoader.DEFAULT_FILE_NAME);
    }
}
