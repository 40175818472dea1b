package com.qualitygate.core.change;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qualitygate.core.cache.ContentHasher;
import com.qualitygate.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifies files as added, modified, unchanged or deleted by comparing their current
 * digest with the last recorded baseline.
 *
 * <p>Baselines live in memory and, when a state file is configured, are persisted as JSON
 * so they survive across runs. A missing or unreadable state file starts from an empty
 * baseline. A file that cannot be read is always reported as changed.
 */
public class FileChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(FileChangeDetector.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path projectRoot;
    private final Path stateFile;
    private final ContentHasher hasher;
    private final Clock clock;
    private final Map<String, FileRecord> records = new ConcurrentHashMap<>();
    private volatile long lastUpdate;

    /**
     * Creates an in-memory detector.
     *
     * @param projectRoot project root that relative paths resolve against
     * @param hasher digest function
     */
    public FileChangeDetector(Path projectRoot, ContentHasher hasher) {
        this(projectRoot, null, hasher, Clock.systemUTC());
    }

    /**
     * Creates a detector persisting its baselines to a state file.
     *
     * @param projectRoot project root that relative paths resolve against
     * @param stateFile JSON state file, or null for memory only
     * @param hasher digest function
     * @param clock time source for the last-update stamp
     */
    public FileChangeDetector(Path projectRoot, Path stateFile, ContentHasher hasher, Clock clock) {
        this.projectRoot = projectRoot;
        this.stateFile = stateFile;
        this.hasher = hasher;
        this.clock = clock;
        loadState();
    }

    /**
     * Classifies each file against its recorded baseline.
     *
     * @param files project-relative paths
     * @return one change per file, in input order
     */
    public List<FileChange> detectChanges(List<String> files) {
        List<FileChange> changes = new ArrayList<>(files.size());
        for (String file : files) {
            changes.add(classify(FileUtils.normalizePath(file)));
        }
        if (log.isDebugEnabled()) {
            long changed = changes.stream().filter(c -> c.type().requiresAnalysis()).count();
            log.debug("Change detection: {} of {} files changed", changed, files.size());
        }
        return changes;
    }

    private FileChange classify(String path) {
        FileRecord previous = records.get(path);
        String previousHash = previous != null ? previous.hash() : null;
        Path file = projectRoot.resolve(path);

        if (!Files.exists(file)) {
            return new FileChange(path, previous != null ? ChangeType.DELETED : ChangeType.ADDED, previousHash, null);
        }

        String currentHash;
        try {
            currentHash = hasher.digestFile(file);
        } catch (IOException e) {
            log.debug("Cannot read {}, treating as changed: {}", path, e.getMessage());
            return new FileChange(path, previous != null ? ChangeType.MODIFIED : ChangeType.ADDED, previousHash, null);
        }

        if (previous == null) {
            return new FileChange(path, ChangeType.ADDED, null, currentHash);
        }
        ChangeType type = previous.hash().equals(currentHash) ? ChangeType.UNCHANGED : ChangeType.MODIFIED;
        return new FileChange(path, type, previousHash, currentHash);
    }

    /**
     * Records the current digest of each file as its new baseline.
     *
     * <p>Unreadable files lose their baseline so that they are reported again next time.
     *
     * @param files project-relative paths
     */
    public void updateRecords(List<String> files) {
        for (String raw : files) {
            String path = FileUtils.normalizePath(raw);
            Path file = projectRoot.resolve(path);
            try {
                records.put(path, new FileRecord(
                    path,
                    hasher.digestFile(file),
                    Files.size(file),
                    Files.getLastModifiedTime(file).toMillis()));
            } catch (IOException e) {
                log.debug("Cannot record {}: {}", path, e.getMessage());
                records.remove(path);
            }
        }
        lastUpdate = clock.millis();
        saveState();
    }

    /**
     * Returns the files whose content matches their baseline.
     *
     * @param files project-relative paths
     * @return unchanged paths, in input order
     */
    public List<String> getUnchangedFiles(List<String> files) {
        return detectChanges(files).stream()
            .filter(change -> change.type() == ChangeType.UNCHANGED)
            .map(FileChange::path)
            .toList();
    }

    public List<String> getTrackedFiles() {
        return List.copyOf(records.keySet());
    }

    /**
     * Forgets every baseline and deletes the state file.
     */
    public void resetRecords() {
        records.clear();
        lastUpdate = 0;
        if (stateFile != null) {
            try {
                Files.deleteIfExists(stateFile);
            } catch (IOException e) {
                log.warn("Cannot delete change state {}: {}", stateFile, e.getMessage());
            }
        }
    }

    public ChangeDetectionStats getStats() {
        return new ChangeDetectionStats(records.size(), lastUpdate);
    }

    // ==================== Persistence ====================

    private void loadState() {
        if (stateFile == null || !Files.isRegularFile(stateFile)) {
            return;
        }
        try {
            ChangeState state = MAPPER.readValue(stateFile.toFile(), ChangeState.class);
            if (state.records() != null) {
                state.records().forEach((path, record) -> {
                    if (path != null && record != null) {
                        records.put(path, record);
                    }
                });
            }
            lastUpdate = state.lastUpdate();
            log.debug("Loaded {} change records from {}", records.size(), stateFile);
        } catch (IOException e) {
            log.warn("Ignoring unreadable change state {}: {}", stateFile, e.getMessage());
        }
    }

    private void saveState() {
        if (stateFile == null) {
            return;
        }
        try {
            if (stateFile.getParent() != null) {
                Files.createDirectories(stateFile.getParent());
            }
            MAPPER.writeValue(stateFile.toFile(), new ChangeState(lastUpdate, new LinkedHashMap<>(records)));
        } catch (IOException e) {
            log.warn("Cannot save change state {}: {}", stateFile, e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChangeState(
        @JsonProperty("lastUpdate") long lastUpdate,
        @JsonProperty("records") Map<String, FileRecord> records
    ) {}
}
