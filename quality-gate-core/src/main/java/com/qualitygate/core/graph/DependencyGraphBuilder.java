package com.qualitygate.core.graph;

import com.qualitygate.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds a {@link DependencyGraph} from the import specifiers of each file.
 *
 * <p>Internal specifiers are resolved to project files:
 * <ul>
 *   <li>relative ({@code ./x}, {@code ../x}) against the importing file's directory</li>
 *   <li>root-absolute ({@code /src/x}) against the project root</li>
 *   <li>aliased ({@code @/x}) against the {@code src} directory</li>
 * </ul>
 * A resolved path is tried as-is, then with each source extension appended, then as a
 * directory {@code index} file. Specifiers that resolve to no analyzed file are ignored.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private static final String ALIAS_ROOT = "src/";

    private final List<String> extensions;

    /**
     * @param extensions source extensions tried during resolution, including the dot
     */
    public DependencyGraphBuilder(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    /**
     * Builds the graph for the given files.
     *
     * @param importsByFile import specifiers per project-relative file, in file-list order
     * @return dependency graph with one node per file
     */
    public DependencyGraph build(Map<String, List<String>> importsByFile) {
        DependencyGraph graph = new DependencyGraph();
        importsByFile.keySet().forEach(graph::addNode);
        Set<String> known = importsByFile.keySet();

        int unresolved = 0;
        for (Map.Entry<String, List<String>> entry : importsByFile.entrySet()) {
            String file = entry.getKey();
            for (String specifier : entry.getValue()) {
                if (ImportExtractor.isExternal(specifier)) {
                    graph.recordExternal(ImportExtractor.packageName(specifier));
                    continue;
                }
                Optional<String> target = resolve(file, specifier, known::contains);
                if (target.isPresent()) {
                    graph.addEdge(file, target.get());
                } else {
                    unresolved++;
                    log.debug("Unresolved import '{}' in {}", specifier, file);
                }
            }
        }

        log.debug("Built dependency graph: {} modules, {} edges, {} unresolved imports",
            graph.nodeCount(), graph.edgeCount(), unresolved);
        return graph;
    }

    /**
     * Convenience overload extracting the specifiers from file contents first.
     *
     * @param contents file content per project-relative path, in file-list order
     * @return dependency graph
     */
    public DependencyGraph buildFromContents(Map<String, String> contents) {
        return build(contents.entrySet().stream().collect(Collectors.toMap(
            Map.Entry::getKey,
            entry -> ImportExtractor.extract(entry.getValue()),
            (a, b) -> a,
            LinkedHashMap::new)));
    }

    /**
     * Resolves an internal specifier to a known file.
     *
     * @param importer importing file
     * @param specifier internal specifier
     * @param exists membership test for project files
     * @return resolved project-relative path
     */
    Optional<String> resolve(String importer, String specifier, Predicate<String> exists) {
        String base;
        if (specifier.startsWith(ImportExtractor.SOURCE_ALIAS)) {
            base = ALIAS_ROOT + specifier.substring(ImportExtractor.SOURCE_ALIAS.length());
        } else if (specifier.startsWith("/")) {
            base = specifier.substring(1);
        } else {
            int lastSlash = importer.lastIndexOf('/');
            String directory = lastSlash >= 0 ? importer.substring(0, lastSlash + 1) : "";
            base = directory + specifier;
        }

        String normalized = FileUtils.normalizePath(base);
        if (normalized.startsWith("..")) {
            return Optional.empty();
        }
        if (exists.test(normalized)) {
            return Optional.of(normalized);
        }
        for (String extension : extensions) {
            if (exists.test(normalized + extension)) {
                return Optional.of(normalized + extension);
            }
        }
        for (String extension : extensions) {
            String index = normalized + "/index" + extension;
            if (exists.test(index)) {
                return Optional.of(index);
            }
        }
        return Optional.empty();
    }
}
