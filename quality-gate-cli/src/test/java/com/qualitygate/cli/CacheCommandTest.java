package com.qualitygate.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CacheCommand}.
 */
class CacheCommandTest extends CliTestSupport {

    @Test
    void stats_emptyProject_reportsNoEntries() {
        int exitCode = execute("cache", "stats", tempDir.toString());

        assertThat(exitCode).isEqualTo(ExitCode.PASS);
        assertThat(output()).contains("Enabled: true").contains("Entries on disk: 0");
    }

    @Test
    void stats_afterCheck_countsWrittenEntries() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", "scoring:\n  passingScore: 0\n");
        execute("check", tempDir.toString());

        int exitCode = execute("cache", "stats", tempDir.toString());

        assertThat(exitCode).isEqualTo(ExitCode.PASS);
        assertThat(output()).doesNotContain("Entries on disk: 0");
    }

    @Test
    void clear_afterCheck_removesEveryEntry() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", "scoring:\n  passingScore: 0\n");
        execute("check", tempDir.toString());

        int exitCode = execute("cache", "clear", tempDir.toString());

        assertThat(exitCode).isEqualTo(ExitCode.PASS);
        assertThat(output()).contains("✓ Cache cleared");
        assertThat(cacheFileCount()).isZero();
    }

    @Test
    void cleanup_freshEntries_removesNothing() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", "scoring:\n  passingScore: 0\n");
        execute("check", tempDir.toString());

        int exitCode = execute("cache", "CLEANUP", tempDir.toString());

        assertThat(exitCode).isEqualTo(ExitCode.PASS);
        assertThat(output()).contains("✓ Removed 0 expired cache entries");
        assertThat(cacheFileCount()).isPositive();
    }

    @Test
    void unknownAction_isUsageError() {
        int exitCode = execute("cache", "compact", tempDir.toString());

        assertThat(exitCode).isEqualTo(2);
    }

    private long cacheFileCount() throws IOException {
        Path directory = tempDir.resolve(".quality/.cache");
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile).count();
        }
    }
}
