package com.qualitygate.cli;

import com.qualitygate.core.config.ConfigLoader;
import com.qualitygate.core.config.ConfigValidator;
import com.qualitygate.core.config.ConfigurationException;
import com.qualitygate.core.config.QualityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate the configuration without running any analyzer.
 */
@Command(
    name = "validate",
    description = "Validate the quality gate configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Mixin
    private ConfigOption configOption;

    @Override
    public Integer call() {
        Path configFile = configOption.resolve(projectPath.toAbsolutePath().normalize());
        log.info("Validating configuration: {}", configFile);

        QualityConfig config;
        try {
            config = ConfigLoader.load(configFile);
        } catch (ConfigurationException e) {
            System.err.println("✗ " + e.getMessage());
            return ExitCode.CONFIGURATION_ERROR;
        }

        List<String> errors = ConfigValidator.collectErrors(config);
        if (!errors.isEmpty()) {
            System.err.println("✗ Configuration is invalid: " + configFile);
            errors.forEach(error -> System.err.println("  - " + error));
            return ExitCode.CONFIGURATION_ERROR;
        }

        if (!Files.exists(configFile)) {
            System.out.println("✓ No configuration file at " + configFile + "; defaults are valid");
        } else {
            System.out.println("✓ Configuration is valid: " + configFile);
        }
        System.out.printf("  Passing score: %.1f, weights: quality %.2f, coverage %.2f, architecture %.2f, security %.2f%n",
            config.scoring().passingScore(),
            config.scoring().weights().codeQuality(),
            config.scoring().weights().testCoverage(),
            config.scoring().weights().architecture(),
            config.scoring().weights().security());
        return ExitCode.PASS;
    }
}
