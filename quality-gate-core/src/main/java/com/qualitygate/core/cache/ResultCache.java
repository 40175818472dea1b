package com.qualitygate.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qualitygate.core.config.QualityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache of per-file, per-category analysis output.
 *
 * <p>The memory tier answers repeated lookups within a process; the disk tier (one JSON file
 * per entry under the cache directory) survives across runs. Every entry in memory also
 * exists on disk: a write goes to disk first and only then into memory, and eviction only
 * ever drops the memory copy.
 *
 * <p>Entries expire {@code ttl} after they were written. Expired entries are treated as
 * absent and purged when encountered; {@link #cleanup()} sweeps them eagerly. When the
 * memory tier is full, the entry with the oldest write timestamp is evicted (LRU by
 * insertion time, not by access).
 *
 * <p>Malformed entry files are treated as misses and deleted. A disabled cache misses on
 * every lookup and ignores writes, so callers never need to special-case it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ResultCache cache = new ResultCache(projectRoot, config.cache());
 * CacheKey key = CacheKey.of("architecture", "src/app.ts");
 *
 * if (cache.hasChanged(key)) {
 *     cache.set(key, analyze("src/app.ts"));
 * }
 * Optional<FileReport> report = cache.get(key, FileReport.class);
 * }</pre>
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private static final int MAX_RETRIEVAL_SAMPLES = 1000;
    private static final int RETAINED_RETRIEVAL_SAMPLES = 500;

    private final boolean enabled;
    private final Path projectRoot;
    private final Path directory;
    private final Duration ttl;
    private final int maxSize;
    private final ContentHasher hasher;
    private final Clock clock;
    private final ObjectMapper mapper;

    private final Map<String, CacheEntry> memory = new LinkedHashMap<>();
    private final Object memoryLock = new Object();
    private final Deque<Long> retrievalNanos = new ArrayDeque<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    /**
     * Creates a cache from configuration using the system clock.
     *
     * @param projectRoot project root; relative cache directories resolve against it
     * @param config cache configuration
     */
    public ResultCache(Path projectRoot, QualityConfig.CacheConfig config) {
        this(projectRoot, config, new ContentHasher(), Clock.systemUTC());
    }

    /**
     * Creates a cache with an explicit hasher and clock.
     *
     * @param projectRoot project root; relative cache directories resolve against it
     * @param config cache configuration
     * @param hasher digest function shared with change detection
     * @param clock time source for TTL handling
     */
    public ResultCache(Path projectRoot, QualityConfig.CacheConfig config, ContentHasher hasher, Clock clock) {
        this.enabled = config.enabled();
        this.projectRoot = projectRoot;
        this.directory = projectRoot.resolve(config.directory());
        this.ttl = Duration.ofSeconds(config.ttlSeconds());
        this.maxSize = config.maxSize();
        this.hasher = hasher;
        this.clock = clock;
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates a cache that never stores anything.
     *
     * @param projectRoot project root
     * @return disabled cache
     */
    public static ResultCache disabled(Path projectRoot) {
        return new ResultCache(projectRoot, new QualityConfig.CacheConfig(false, null, null, null));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path getDirectory() {
        return directory;
    }

    // ==================== Lookup ====================

    /**
     * Looks up a payload and deserializes it into the given type.
     *
     * @param key cache key
     * @param type payload type
     * @param <T> payload type
     * @return the payload, or empty on a miss
     */
    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        return get(key, mapper.constructType(type));
    }

    /**
     * Looks up a payload of a generic type.
     *
     * @param key cache key
     * @param type payload type, e.g. built with {@code mapper.getTypeFactory()}
     * @param <T> payload type
     * @return the payload, or empty on a miss
     */
    public <T> Optional<T> get(CacheKey key, JavaType type) {
        if (!enabled) {
            return Optional.empty();
        }

        long start = System.nanoTime();
        try {
            Optional<CacheEntry> entry = lookup(key);
            if (entry.isEmpty()) {
                misses.incrementAndGet();
                log.debug("Cache miss: {}", key.normalized());
                return Optional.empty();
            }

            try {
                T value = mapper.readValue(entry.get().content(), type);
                hits.incrementAndGet();
                log.debug("Cache hit: {}", key.normalized());
                return Optional.ofNullable(value);
            } catch (JsonProcessingException e) {
                log.debug("Cached payload for {} does not match {}: {}", key.normalized(), type, e.getMessage());
                invalidate(key);
                misses.incrementAndGet();
                return Optional.empty();
            }
        } finally {
            recordRetrieval(System.nanoTime() - start);
        }
    }

    /**
     * Checks whether a file must be re-analyzed for a category.
     *
     * <p>Returns true when the cache is disabled, when no valid entry exists, when the file
     * cannot be read, or when its current digest differs from the digest stored with the entry.
     *
     * @param key cache key whose path names the file
     * @return true if the cached payload cannot be reused
     */
    public boolean hasChanged(CacheKey key) {
        if (!enabled) {
            return true;
        }
        Optional<CacheEntry> entry = lookup(key);
        if (entry.isEmpty()) {
            return true;
        }
        Optional<String> currentHash = sourceDigest(key.path());
        return currentHash.isEmpty() || !currentHash.get().equals(entry.get().hash());
    }

    private Optional<CacheEntry> lookup(CacheKey key) {
        String id = key.normalized();
        long now = clock.millis();

        CacheEntry cached;
        synchronized (memoryLock) {
            cached = memory.get(id);
            if (cached != null && !cached.isValid(now)) {
                memory.remove(id);
            }
        }
        if (cached != null) {
            if (cached.isValid(now)) {
                return Optional.of(cached);
            }
            deleteFile(key.fileName());
            return Optional.empty();
        }

        Optional<CacheEntry> stored = readFromDisk(key.fileName());
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        if (!id.equals(stored.get().key())) {
            log.debug("Cache file {} holds entry {}, ignoring", key.fileName(), stored.get().key());
            return Optional.empty();
        }
        if (!stored.get().isValid(now)) {
            deleteFile(key.fileName());
            return Optional.empty();
        }
        putInMemory(id, stored.get());
        return stored;
    }

    // ==================== Writes ====================

    /**
     * Stores a payload without metadata.
     *
     * @param key cache key
     * @param value serializable payload
     */
    public void set(CacheKey key, Object value) {
        set(key, value, Map.of());
    }

    /**
     * Stores a payload in both tiers.
     *
     * <p>Serialization or disk failures are logged and leave the cache unchanged; a failed
     * write only costs a future recomputation.
     *
     * @param key cache key
     * @param value serializable payload
     * @param metadata optional metadata stored with the entry
     */
    public void set(CacheKey key, Object value, Map<String, Object> metadata) {
        if (!enabled) {
            return;
        }

        String content;
        try {
            content = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize cache payload for {}: {}", key.normalized(), e.getMessage());
            return;
        }

        String hash = sourceDigest(key.path()).orElseGet(() -> hasher.digest(content));
        long now = clock.millis();
        CacheEntry entry = new CacheEntry(key.normalized(), content, hash, now, now + ttl.toMillis(), metadata);

        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(key.fileName()), mapper.writeValueAsString(entry));
        } catch (IOException e) {
            log.warn("Cannot write cache entry {}: {}", key.fileName(), e.getMessage());
            return;
        }

        putInMemory(entry.key(), entry);
        writes.incrementAndGet();
    }

    private void putInMemory(String id, CacheEntry entry) {
        synchronized (memoryLock) {
            if (!memory.containsKey(id) && memory.size() >= maxSize) {
                evictOldest();
            }
            memory.remove(id);
            memory.put(id, entry);
        }
    }

    private void evictOldest() {
        memory.values().stream()
            .min(Comparator.comparingLong(CacheEntry::timestamp))
            .ifPresent(oldest -> {
                memory.remove(oldest.key());
                evictions.incrementAndGet();
                log.debug("Evicted cache entry: {}", oldest.key());
            });
    }

    // ==================== Invalidation ====================

    /**
     * Removes an entry from both tiers.
     *
     * @param key cache key
     */
    public void invalidate(CacheKey key) {
        synchronized (memoryLock) {
            memory.remove(key.normalized());
        }
        deleteFile(key.fileName());
    }

    /**
     * Removes every entry from both tiers.
     */
    public void clear() {
        synchronized (memoryLock) {
            memory.clear();
        }
        for (Path file : listEntryFiles()) {
            deleteFile(file.getFileName().toString());
        }
        log.info("Cache cleared: {}", directory);
    }

    /**
     * Removes all expired and malformed entries from both tiers.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        long now = clock.millis();
        int removed = 0;

        synchronized (memoryLock) {
            List<String> expired = memory.values().stream()
                .filter(entry -> !entry.isValid(now))
                .map(CacheEntry::key)
                .toList();
            expired.forEach(memory::remove);
        }

        for (Path file : listEntryFiles()) {
            String fileName = file.getFileName().toString();
            Optional<CacheEntry> entry = readFromDisk(fileName);
            if (entry.isEmpty()) {
                // readFromDisk already deleted the malformed file
                removed++;
            } else if (!entry.get().isValid(now)) {
                deleteFile(fileName);
                removed++;
            }
        }

        if (removed > 0) {
            log.info("Removed {} expired cache entries", removed);
        }
        return removed;
    }

    // ==================== Statistics ====================

    /**
     * Returns a snapshot of the cache counters.
     *
     * @return cache statistics
     */
    public CacheStatistics getStatistics() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long lookups = hitCount + missCount;
        double hitRate = lookups > 0 ? (hitCount * 100.0) / lookups : 0;

        double averageMillis;
        synchronized (retrievalNanos) {
            averageMillis = retrievalNanos.stream().mapToLong(Long::longValue).average().orElse(0) / 1_000_000.0;
        }

        int memoryEntries;
        synchronized (memoryLock) {
            memoryEntries = memory.size();
        }
        return new CacheStatistics(hitCount, missCount, writes.get(), evictions.get(),
            hitRate, averageMillis, memoryEntries, listEntryFiles().size());
    }

    /**
     * Entry counts of both tiers.
     *
     * @param memory entries held in memory
     * @param disk entry files on disk
     */
    public record Size(int memory, int disk) {}

    /**
     * Counts the entries of both tiers without touching the hit counters.
     *
     * @return entry counts
     */
    public Size getSize() {
        int memoryEntries;
        synchronized (memoryLock) {
            memoryEntries = memory.size();
        }
        return new Size(memoryEntries, listEntryFiles().size());
    }

    /**
     * Resets all counters; entries are kept.
     */
    public void resetStatistics() {
        hits.set(0);
        misses.set(0);
        writes.set(0);
        evictions.set(0);
        synchronized (retrievalNanos) {
            retrievalNanos.clear();
        }
    }

    private void recordRetrieval(long nanos) {
        synchronized (retrievalNanos) {
            retrievalNanos.addLast(nanos);
            if (retrievalNanos.size() > MAX_RETRIEVAL_SAMPLES) {
                while (retrievalNanos.size() > RETAINED_RETRIEVAL_SAMPLES) {
                    retrievalNanos.removeFirst();
                }
            }
        }
    }

    // ==================== Disk Tier ====================

    private Optional<CacheEntry> readFromDisk(String fileName) {
        Path file = directory.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(Files.readString(file), CacheEntry.class));
        } catch (IOException | RuntimeException e) {
            log.debug("Discarding unreadable cache entry {}: {}", fileName, e.getMessage());
            deleteFile(fileName);
            return Optional.empty();
        }
    }

    private void deleteFile(String fileName) {
        try {
            Files.deleteIfExists(directory.resolve(fileName));
        } catch (IOException e) {
            log.warn("Cannot delete cache entry {}: {}", fileName, e.getMessage());
        }
    }

    private List<Path> listEntryFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.warn("Cannot list cache directory {}: {}", directory, e.getMessage());
        }
        return files;
    }

    private Optional<String> sourceDigest(String relativePath) {
        Path file = projectRoot.resolve(relativePath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(hasher.digestFile(file));
        } catch (IOException e) {
            log.debug("Cannot digest {}: {}", relativePath, e.getMessage());
            return Optional.empty();
        }
    }
}
