package com.qualitygate.core.analyzer;

import com.qualitygate.core.cache.ResultCache;
import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.Finding;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Base class for analyzer tests providing a temporary project and context helpers.
 */
public abstract class AnalyzerTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp project with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "src/app.ts")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Creates a context over the given files with default configuration and no cache.
     */
    protected AnalysisContext context(String... files) {
        return context(QualityConfig.defaults(), files);
    }

    protected AnalysisContext context(QualityConfig config, String... files) {
        return new AnalysisContext(tempDir, List.of(files), config, ResultCache.disabled(tempDir));
    }

    protected AnalysisContext cachedContext(ResultCache cache, String... files) {
        return new AnalysisContext(tempDir, List.of(files), QualityConfig.defaults(), cache);
    }

    protected Optional<Finding> findById(AnalysisResult result, String id) {
        return result.findings().stream().filter(finding -> finding.id().equals(id)).findFirst();
    }

    protected List<Finding> findByPrefix(AnalysisResult result, String prefix) {
        return result.findings().stream().filter(finding -> finding.id().startsWith(prefix)).toList();
    }
}
