package com.qualitygate.core.model;

import java.util.Objects;

/**
 * Location of a finding within the project.
 *
 * @param file project-relative file path
 * @param line 1-based line number, or null when unknown
 * @param column 1-based column number, or null when unknown
 */
public record FileLocation(
    String file,
    Integer line,
    Integer column
) {
    public FileLocation {
        Objects.requireNonNull(file, "file must not be null");
    }

    public static FileLocation of(String file) {
        return new FileLocation(file, null, null);
    }

    public static FileLocation of(String file, int line) {
        return new FileLocation(file, line, null);
    }
}
