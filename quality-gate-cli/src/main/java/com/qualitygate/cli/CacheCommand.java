package com.qualitygate.cli;

import com.qualitygate.core.cache.ResultCache;
import com.qualitygate.core.config.ConfigLoader;
import com.qualitygate.core.config.ConfigurationException;
import com.qualitygate.core.config.QualityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to inspect and maintain the result cache of a project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * quality-gate cache stats
 * quality-gate cache cleanup ../storefront
 * quality-gate cache clear
 * }</pre>
 */
@Command(
    name = "cache",
    description = "Show statistics of, clean up or clear the result cache",
    mixinStandardHelpOptions = true
)
public class CacheCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CacheCommand.class);

    /**
     * Cache maintenance actions.
     */
    public enum Action {
        /** Print entry counts of both tiers */
        STATS,
        /** Remove expired and malformed entries */
        CLEANUP,
        /** Remove every entry */
        CLEAR
    }

    @Parameters(index = "0", description = "Action: ${COMPLETION-CANDIDATES}")
    private Action action;

    @Parameters(
        index = "1",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Mixin
    private ConfigOption configOption;

    @Override
    public Integer call() {
        Path root = projectPath.toAbsolutePath().normalize();
        try {
            QualityConfig config = ConfigLoader.load(configOption.resolve(root));
            ResultCache cache = new ResultCache(root, config.cache());
            log.debug("Cache action {} on {}", action, cache.getDirectory());

            switch (action) {
                case STATS -> {
                    ResultCache.Size size = cache.getSize();
                    System.out.println("Cache directory: " + cache.getDirectory());
                    System.out.println("Enabled: " + cache.isEnabled());
                    System.out.println("Entries on disk: " + size.disk());
                    System.out.println("TTL: " + config.cache().ttlSeconds() + " s, max in memory: "
                        + config.cache().maxSize());
                }
                case CLEANUP -> {
                    int removed = cache.cleanup();
                    System.out.println("✓ Removed " + removed + " expired cache entries");
                }
                case CLEAR -> {
                    cache.clear();
                    System.out.println("✓ Cache cleared: " + cache.getDirectory());
                }
            }
            return ExitCode.PASS;
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.err.println("✗ Configuration error: " + e.getMessage());
            return ExitCode.CONFIGURATION_ERROR;
        } catch (Exception e) {
            log.error("Cache command failed", e);
            System.err.println("✗ Cache command failed: " + e.getMessage());
            return ExitCode.EXECUTION_ERROR;
        }
    }
}
