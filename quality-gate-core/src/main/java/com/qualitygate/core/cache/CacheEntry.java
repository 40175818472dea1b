package com.qualitygate.core.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * One cached payload, as held in memory and persisted on disk.
 *
 * @param key normalized cache key
 * @param content serialized payload (JSON)
 * @param hash digest of the source file at write time, or of the payload when the key
 *             does not refer to a readable file
 * @param timestamp write time in epoch milliseconds
 * @param expiresAt expiry time in epoch milliseconds
 * @param metadata optional caller-supplied metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(
    @JsonProperty("key") String key,
    @JsonProperty("content") String content,
    @JsonProperty("hash") String hash,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("expiresAt") long expiresAt,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public CacheEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(hash, "hash must not be null");
        if (metadata == null) {
            metadata = Map.of();
        }
    }

    /**
     * An entry is valid while its expiry lies in the future.
     *
     * @param nowMillis current time in epoch milliseconds
     * @return true if not expired
     */
    public boolean isValid(long nowMillis) {
        return expiresAt > nowMillis;
    }
}
