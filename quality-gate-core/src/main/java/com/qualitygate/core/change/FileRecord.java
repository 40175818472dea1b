package com.qualitygate.core.change;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Baseline recorded for a file.
 *
 * @param path project-relative path
 * @param hash content digest
 * @param size size in bytes
 * @param modifiedTime last modification time in epoch milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileRecord(
    @JsonProperty("path") String path,
    @JsonProperty("hash") String hash,
    @JsonProperty("size") long size,
    @JsonProperty("modifiedTime") long modifiedTime
) {

    public FileRecord {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(hash, "hash must not be null");
    }
}
