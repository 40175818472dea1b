package com.qualitygate.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file discovery and path handling.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds source files below a root directory.
     *
     * <p>A file is included when its name ends with one of the extensions and none of its
     * path segments matches an excluded name. Results are project-relative, normalized with
     * forward slashes and sorted, so the file order is stable across runs.
     *
     * @param rootPath root directory to search from
     * @param extensions file extensions including the dot (e.g. ".ts")
     * @param excludedSegments directory or file names to skip (e.g. "node_modules")
     * @return sorted project-relative paths
     * @throws IOException if directory traversal fails
     */
    public static List<String> discoverFiles(Path rootPath, List<String> extensions,
                                             List<String> excludedSegments) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .map(path -> toRelativePath(rootPath, path))
                .filter(relative -> extensions.stream().anyMatch(relative::endsWith))
                .filter(relative -> !isExcluded(relative, excludedSegments))
                .sorted()
                .toList();
        }
    }

    /**
     * Checks whether any segment of a relative path is excluded.
     *
     * @param relativePath normalized project-relative path
     * @param excludedSegments excluded segment names
     * @return true if the path lies in an excluded location
     */
    public static boolean isExcluded(String relativePath, List<String> excludedSegments) {
        for (String segment : relativePath.split("/")) {
            if (excludedSegments.contains(segment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Converts an absolute file path to a normalized project-relative path.
     *
     * @param rootPath project root
     * @param file file below the root
     * @return relative path with forward slashes
     */
    public static String toRelativePath(Path rootPath, Path file) {
        return normalizePath(rootPath.toAbsolutePath().normalize()
            .relativize(file.toAbsolutePath().normalize()).toString());
    }

    /**
     * Normalizes a path string: forward slashes, no {@code ./} prefix, {@code ..} resolved.
     *
     * @param path raw path
     * @return normalized path
     */
    public static String normalizePath(String path) {
        String unified = path.replace('\\', '/');
        String normalized = Paths.get(unified).normalize().toString().replace('\\', '/');
        return normalized.startsWith("./") ? normalized.substring(2) : normalized;
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(String path) {
        String fileName = getFileName(path);
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the last segment of a slash-separated path.
     *
     * @param path file path
     * @return file name
     */
    public static String getFileName(String path) {
        int lastSlash = path.lastIndexOf('/');
        return lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return base name
     */
    public static String getBaseName(String path) {
        String fileName = getFileName(path);
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Counts lines the way an editor does: a trailing newline does not start a new line.
     *
     * @param content file content
     * @return number of lines
     */
    public static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n' && i < content.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
