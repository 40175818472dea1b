package com.qualitygate.core.cache;

import com.qualitygate.core.MutableClock;
import com.qualitygate.core.config.QualityConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ResultCache}.
 */
class ResultCacheTest {

    record FileReport(String file, int lineCount, List<String> imports) {}

    @TempDir
    Path tempDir;

    private MutableClock clock;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock();
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("src/app.ts"), "import { a } from './a';\n");
        Files.writeString(tempDir.resolve("src/a.ts"), "export const a = 1;\n");
        Files.writeString(tempDir.resolve("src/b.ts"), "export const b = 2;\n");
    }

    @Test
    void get_afterSet_returnsPayload() {
        ResultCache cache = cache(3600, 10);
        CacheKey key = CacheKey.of("architecture", "src/app.ts");
        FileReport report = new FileReport("src/app.ts", 1, List.of("./a"));

        cache.set(key, report);

        assertThat(cache.get(key, FileReport.class)).contains(report);
        assertThat(cache.getStatistics().hits()).isEqualTo(1);
        assertThat(cache.getStatistics().writes()).isEqualTo(1);
    }

    @Test
    void get_fromNewInstance_readsDiskTier() {
        CacheKey key = CacheKey.of("architecture", "src/app.ts");
        FileReport report = new FileReport("src/app.ts", 1, List.of("./a"));
        cache(3600, 10).set(key, report);

        ResultCache reopened = cache(3600, 10);

        assertThat(reopened.get(key, FileReport.class)).contains(report);
        assertThat(Files.exists(reopened.getDirectory().resolve(key.fileName()))).isTrue();
    }

    @Test
    void get_missingKey_countsMiss() {
        ResultCache cache = cache(3600, 10);

        assertThat(cache.get(CacheKey.of("security", "src/app.ts"), FileReport.class)).isEmpty();
        assertThat(cache.getStatistics().misses()).isEqualTo(1);
        assertThat(cache.getStatistics().hitRate()).isZero();
    }

    @Test
    void get_afterTtl_isMissAndPurgesEntry() {
        ResultCache cache = cache(60, 10);
        CacheKey key = CacheKey.of("architecture", "src/app.ts");
        cache.set(key, new FileReport("src/app.ts", 1, List.of()));

        clock.advance(Duration.ofSeconds(59));
        assertThat(cache.get(key, FileReport.class)).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get(key, FileReport.class)).isEmpty();
        assertThat(cache.getSize()).isEqualTo(new ResultCache.Size(0, 0));
    }

    @Test
    void set_beyondMaxSize_evictsOldestFromMemoryOnly() {
        ResultCache cache = cache(3600, 2);
        CacheKey first = CacheKey.of("codeQuality", "src/app.ts");
        CacheKey second = CacheKey.of("codeQuality", "src/a.ts");
        CacheKey third = CacheKey.of("codeQuality", "src/b.ts");

        cache.set(first, new FileReport("src/app.ts", 1, List.of()));
        clock.advance(Duration.ofSeconds(1));
        cache.set(second, new FileReport("src/a.ts", 1, List.of()));
        clock.advance(Duration.ofSeconds(1));
        cache.set(third, new FileReport("src/b.ts", 1, List.of()));

        CacheStatistics statistics = cache.getStatistics();
        assertThat(statistics.evictions()).isEqualTo(1);
        assertThat(statistics.memoryEntries()).isEqualTo(2);
        assertThat(statistics.diskEntries()).isEqualTo(3);

        // The evicted entry is still served from disk
        assertThat(cache.get(first, FileReport.class)).isPresent();
        assertThat(cache.getSize().memory()).isEqualTo(2);
    }

    @Test
    void get_malformedEntryFile_isMissAndDeletesFile() throws IOException {
        ResultCache cache = cache(3600, 10);
        CacheKey key = CacheKey.of("architecture", "src/app.ts");
        Files.createDirectories(cache.getDirectory());
        Path entryFile = cache.getDirectory().resolve(key.fileName());
        Files.writeString(entryFile, "{ this is not json");

        assertThat(cache.get(key, FileReport.class)).isEmpty();
        assertThat(entryFile).doesNotExist();
    }

    @Test
    void hasChanged_reflectsSourceFileContent() throws IOException {
        ResultCache cache = cache(3600, 10);
        CacheKey key = CacheKey.of("architecture", "src/app.ts");

        assertThat(cache.hasChanged(key)).isTrue();

        cache.set(key, new FileReport("src/app.ts", 1, List.of()));
        assertThat(cache.hasChanged(key)).isFalse();

        Files.writeString(tempDir.resolve("src/app.ts"), "import { b } from './b';\n");
        assertThat(cache.hasChanged(key)).isTrue();
    }

    @Test
    void hasChanged_keyWithoutSourceFile_isAlwaysChanged() {
        ResultCache cache = cache(3600, 10);
        CacheKey key = CacheKey.of("coverage", "reports/summary");
        cache.set(key, new FileReport("reports/summary", 0, List.of()));

        assertThat(cache.get(key, FileReport.class)).isPresent();
        assertThat(cache.hasChanged(key)).isTrue();
    }

    @Test
    void disabledCache_neverStoresAnything() {
        ResultCache cache = ResultCache.disabled(tempDir);
        CacheKey key = CacheKey.of("architecture", "src/app.ts");

        cache.set(key, new FileReport("src/app.ts", 1, List.of()));

        assertThat(cache.isEnabled()).isFalse();
        assertThat(cache.get(key, FileReport.class)).isEmpty();
        assertThat(cache.hasChanged(key)).isTrue();
        assertThat(cache.getDirectory()).doesNotExist();
    }

    @Test
    void cleanup_removesOnlyExpiredEntries() {
        ResultCache cache = cache(60, 10);
        cache.set(CacheKey.of("architecture", "src/app.ts"), new FileReport("src/app.ts", 1, List.of()));
        clock.advance(Duration.ofSeconds(30));
        cache.set(CacheKey.of("architecture", "src/a.ts"), new FileReport("src/a.ts", 1, List.of()));
        clock.advance(Duration.ofSeconds(40));

        int removed = cache.cleanup();

        assertThat(removed).isEqualTo(1);
        assertThat(cache.getSize()).isEqualTo(new ResultCache.Size(1, 1));
    }

    @Test
    void cleanup_countsMalformedFiles() throws IOException {
        ResultCache cache = cache(3600, 10);
        Files.createDirectories(cache.getDirectory());
        Files.writeString(cache.getDirectory().resolve("garbage.json"), "[1, 2");

        assertThat(cache.cleanup()).isEqualTo(1);
        assertThat(cache.getSize().disk()).isZero();
    }

    @Test
    void invalidate_andClear_removeEntriesFromBothTiers() {
        ResultCache cache = cache(3600, 10);
        CacheKey first = CacheKey.of("architecture", "src/app.ts");
        CacheKey second = CacheKey.of("architecture", "src/a.ts");
        cache.set(first, new FileReport("src/app.ts", 1, List.of()));
        cache.set(second, new FileReport("src/a.ts", 1, List.of()));

        cache.invalidate(first);
        assertThat(cache.getSize()).isEqualTo(new ResultCache.Size(1, 1));

        cache.clear();
        assertThat(cache.getSize()).isEqualTo(new ResultCache.Size(0, 0));
        assertThat(cache.get(second, FileReport.class)).isEmpty();
    }

    @Test
    void getStatistics_computesHitRate() {
        ResultCache cache = cache(3600, 10);
        CacheKey key = CacheKey.of("architecture", "src/app.ts");
        cache.set(key, new FileReport("src/app.ts", 1, List.of()));

        cache.get(key, FileReport.class);
        cache.get(key, FileReport.class);
        cache.get(key, FileReport.class);
        cache.get(CacheKey.of("architecture", "src/missing.ts"), FileReport.class);

        assertThat(cache.getStatistics().hitRate()).isEqualTo(75.0);

        cache.resetStatistics();
        assertThat(cache.getStatistics().hits()).isZero();
        assertThat(cache.getSize().memory()).isEqualTo(1);
    }

    @Test
    void cacheKey_normalizesPathIntoFlatFileName() {
        CacheKey key = CacheKey.of("architecture", "src\\components\\Button.tsx");

        assertThat(key.path()).isEqualTo("src/components/Button.tsx");
        assertThat(key.normalized()).isEqualTo("architecture__src__components__Button.tsx");
        assertThat(key.fileName()).isEqualTo("architecture__src__components__Button.tsx.json");
    }

    @Test
    void set_pathsDifferingOnlyInSeparators_keepSeparateEntries() {
        ResultCache cache = cache(3600, 10);
        CacheKey nested = CacheKey.of("architecture", "src/a/b.ts");
        CacheKey flat = CacheKey.of("architecture", "src/a__b.ts");

        cache.set(nested, new FileReport("src/a/b.ts", 1, List.of()));
        cache.set(flat, new FileReport("src/a__b.ts", 2, List.of()));

        assertThat(nested.fileName()).isNotEqualTo(flat.fileName());
        assertThat(cache.get(nested, FileReport.class)).map(FileReport::file).contains("src/a/b.ts");
        assertThat(cache(3600, 10).get(nested, FileReport.class)).map(FileReport::file).contains("src/a/b.ts");
        assertThat(cache(3600, 10).get(flat, FileReport.class)).map(FileReport::file).contains("src/a__b.ts");
    }

    @Test
    void get_diskEntryForAnotherKey_isMiss() throws IOException {
        CacheKey owner = CacheKey.of("architecture", "src/a.ts");
        CacheKey other = CacheKey.of("architecture", "src/b.ts");
        ResultCache writer = cache(3600, 10);
        writer.set(owner, new FileReport("src/a.ts", 1, List.of()));
        Files.copy(writer.getDirectory().resolve(owner.fileName()), writer.getDirectory().resolve(other.fileName()));

        assertThat(cache(3600, 10).get(other, FileReport.class)).isEmpty();
    }

    @Test
    void cacheKey_escapesUnderscoresAndColons() {
        assertThat(CacheKey.of("architecture", "src/a__b.ts").normalized()).isEqualTo("architecture__src__a_5f_5fb.ts");
        assertThat(CacheKey.of("security", "c:/app.ts").normalized()).isEqualTo("security__c_3a__app.ts");
    }

    private ResultCache cache(long ttlSeconds, int maxSize) {
        QualityConfig.CacheConfig config = new QualityConfig.CacheConfig(true, ".quality/.cache", ttlSeconds, maxSize);
        return new ResultCache(tempDir, config, new ContentHasher(), clock);
    }
}
