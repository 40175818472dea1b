package com.qualitygate.core.cache;

/**
 * Snapshot of cache counters.
 *
 * @param hits lookups answered from either tier
 * @param misses lookups that found nothing valid
 * @param writes successful {@code set} calls
 * @param evictions memory entries evicted for capacity
 * @param hitRate hits as a percentage of all lookups
 * @param averageRetrievalMillis rolling average lookup latency
 * @param memoryEntries entries currently in memory
 * @param diskEntries entry files currently on disk
 */
public record CacheStatistics(
    long hits,
    long misses,
    long writes,
    long evictions,
    double hitRate,
    double averageRetrievalMillis,
    int memoryEntries,
    int diskEntries
) {
    public static CacheStatistics empty() {
        return new CacheStatistics(0, 0, 0, 0, 0, 0, 0, 0);
    }
}
