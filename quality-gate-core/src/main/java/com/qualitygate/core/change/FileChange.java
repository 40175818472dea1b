package com.qualitygate.core.change;

import java.util.Objects;

/**
 * Change classification of one file.
 *
 * @param path project-relative path
 * @param type change type
 * @param previousHash recorded digest, or null if the file was never recorded
 * @param currentHash current digest, or null if the file could not be read
 */
public record FileChange(
    String path,
    ChangeType type,
    String previousHash,
    String currentHash
) {
    public FileChange {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
