package com.qualitygate.core.change;

import com.qualitygate.core.MutableClock;
import com.qualitygate.core.cache.ContentHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileChangeDetector}.
 */
class FileChangeDetectorTest {

    @TempDir
    Path tempDir;

    private Path stateFile;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws IOException {
        stateFile = tempDir.resolve(".quality/.state.json");
        clock = new MutableClock();
        write("src/app.ts", "export const app = 1;\n");
        write("src/util.ts", "export const util = 2;\n");
    }

    @Test
    void detectChanges_withoutBaseline_reportsAdded() {
        FileChangeDetector detector = detector();

        List<FileChange> changes = detector.detectChanges(List.of("src/app.ts", "src/util.ts"));

        assertThat(changes).extracting(FileChange::type).containsExactly(ChangeType.ADDED, ChangeType.ADDED);
        assertThat(changes.get(0).previousHash()).isNull();
        assertThat(changes.get(0).currentHash()).isNotNull();
    }

    @Test
    void detectChanges_afterUpdate_reportsUnchangedAndModified() throws IOException {
        FileChangeDetector detector = detector();
        detector.updateRecords(List.of("src/app.ts", "src/util.ts"));

        write("src/util.ts", "export const util = 3;\n");
        List<FileChange> changes = detector.detectChanges(List.of("src/app.ts", "src/util.ts"));

        assertThat(changes).extracting(FileChange::type).containsExactly(ChangeType.UNCHANGED, ChangeType.MODIFIED);
        assertThat(changes.get(1).previousHash()).isNotEqualTo(changes.get(1).currentHash());
        assertThat(detector.getUnchangedFiles(List.of("src/app.ts", "src/util.ts"))).containsExactly("src/app.ts");
    }

    @Test
    void detectChanges_recordedFileRemoved_reportsDeleted() throws IOException {
        FileChangeDetector detector = detector();
        detector.updateRecords(List.of("src/app.ts"));

        Files.delete(tempDir.resolve("src/app.ts"));
        FileChange change = detector.detectChanges(List.of("src/app.ts")).get(0);

        assertThat(change.type()).isEqualTo(ChangeType.DELETED);
        assertThat(change.type().requiresAnalysis()).isTrue();
        assertThat(change.currentHash()).isNull();
    }

    @Test
    void detectChanges_normalizesPaths() {
        FileChangeDetector detector = detector();
        detector.updateRecords(List.of("./src/app.ts"));

        FileChange change = detector.detectChanges(List.of("src\\app.ts")).get(0);

        assertThat(change.path()).isEqualTo("src/app.ts");
        assertThat(change.type()).isEqualTo(ChangeType.UNCHANGED);
    }

    @Test
    void updateRecords_persistsBaselinesAcrossInstances() {
        detector().updateRecords(List.of("src/app.ts", "src/util.ts"));

        FileChangeDetector reloaded = detector();

        assertThat(stateFile).exists();
        assertThat(reloaded.getTrackedFiles()).containsExactlyInAnyOrder("src/app.ts", "src/util.ts");
        assertThat(reloaded.detectChanges(List.of("src/app.ts")).get(0).type()).isEqualTo(ChangeType.UNCHANGED);
    }

    @Test
    void constructor_corruptStateFile_startsEmpty() throws IOException {
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile, "{ broken");

        FileChangeDetector detector = detector();

        assertThat(detector.getTrackedFiles()).isEmpty();
        assertThat(detector.detectChanges(List.of("src/app.ts")).get(0).type()).isEqualTo(ChangeType.ADDED);
    }

    @Test
    void constructor_nullRecordInStateFile_skipsEntry() throws IOException {
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile, """
            {"lastUpdate": 5, "records": {"src/app.ts": null}}
            """);

        FileChangeDetector detector = detector();

        assertThat(detector.getTrackedFiles()).isEmpty();
        assertThat(detector.detectChanges(List.of("src/app.ts")).get(0).type()).isEqualTo(ChangeType.ADDED);
    }

    @Test
    void constructor_recordWithoutHash_startsEmpty() throws IOException {
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile, """
            {"records": {"src/app.ts": {"path": "src/app.ts"}}}
            """);

        FileChangeDetector detector = detector();

        assertThat(detector.getTrackedFiles()).isEmpty();
        assertThat(detector.detectChanges(List.of("src/app.ts")).get(0).type()).isEqualTo(ChangeType.ADDED);
    }

    @Test
    void getStats_reportsTrackedFilesAndLastUpdate() {
        FileChangeDetector detector = detector();
        assertThat(detector.getStats()).isEqualTo(new ChangeDetectionStats(0, 0));

        detector.updateRecords(List.of("src/app.ts", "src/util.ts"));

        assertThat(detector.getStats()).isEqualTo(new ChangeDetectionStats(2, clock.millis()));
    }

    @Test
    void resetRecords_forgetsBaselinesAndDeletesState() {
        FileChangeDetector detector = detector();
        detector.updateRecords(List.of("src/app.ts"));

        detector.resetRecords();

        assertThat(detector.getTrackedFiles()).isEmpty();
        assertThat(stateFile).doesNotExist();
        assertThat(detector.detectChanges(List.of("src/app.ts")).get(0).type()).isEqualTo(ChangeType.ADDED);
    }

    @Test
    void inMemoryDetector_doesNotWriteState() {
        FileChangeDetector detector = new FileChangeDetector(tempDir, new ContentHasher());

        detector.updateRecords(List.of("src/app.ts"));

        assertThat(detector.getTrackedFiles()).containsExactly("src/app.ts");
        assertThat(stateFile).doesNotExist();
    }

    private FileChangeDetector detector() {
        return new FileChangeDetector(tempDir, stateFile, new ContentHasher(), clock);
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
