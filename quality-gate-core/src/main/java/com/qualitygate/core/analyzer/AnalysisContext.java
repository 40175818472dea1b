package com.qualitygate.core.analyzer;

import com.qualitygate.core.cache.ResultCache;
import com.qualitygate.core.config.QualityConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Context provided to analyzers during a run.
 *
 * <p>The file list is already discovered and filtered; analyzers must not walk the file
 * system on their own. The same context is shared by all analyzers of a run and is never
 * mutated.
 *
 * @param rootPath project root directory
 * @param files ordered project-relative file paths
 * @param configuration run configuration
 * @param cache shared result cache (possibly disabled)
 */
public record AnalysisContext(
    Path rootPath,
    List<String> files,
    QualityConfig configuration,
    ResultCache cache
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisContext {
        Objects.requireNonNull(rootPath, "rootPath must not be null");
        files = files == null ? List.of() : List.copyOf(files);
        if (configuration == null) {
            configuration = QualityConfig.defaults();
        }
        if (cache == null) {
            cache = ResultCache.disabled(rootPath);
        }
    }

    /**
     * Resolves a project-relative path against the root.
     *
     * @param file project-relative path
     * @return absolute path
     */
    public Path resolve(String file) {
        return rootPath.resolve(file);
    }

    /**
     * Returns the files with a configured source extension, in input order.
     *
     * @return source files
     */
    public List<String> sourceFiles() {
        return files.stream().filter(configuration::isSourceFile).toList();
    }
}
