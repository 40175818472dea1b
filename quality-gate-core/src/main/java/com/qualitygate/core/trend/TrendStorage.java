package com.qualitygate.core.trend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling window of scored runs persisted as JSON.
 *
 * <p>Only the most recent {@code maxRecords} records are kept. A missing file is an empty
 * history; an unreadable or malformed file is logged and treated as empty, and is
 * overwritten by the next {@link #append}.
 */
public class TrendStorage {

    private static final Logger log = LoggerFactory.getLogger(TrendStorage.class);

    static final String HISTORY_VERSION = "1.0";

    private final Path file;
    private final int maxRecords;
    private final Clock clock;
    private final ObjectMapper mapper;

    /**
     * Serialized file layout.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record TrendHistory(
        @JsonProperty("version") String version,
        @JsonProperty("created") long created,
        @JsonProperty("records") List<HistoricalRecord> records
    ) {
        TrendHistory {
            records = records == null ? List.of() : List.copyOf(records);
        }
    }

    public TrendStorage(Path file, int maxRecords) {
        this(file, maxRecords, Clock.systemUTC());
    }

    public TrendStorage(Path file, int maxRecords, Clock clock) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords must be at least 1, got " + maxRecords);
        }
        this.file = file;
        this.maxRecords = maxRecords;
        this.clock = clock;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Loads all stored records, oldest first.
     *
     * @return records, empty if there is no readable history
     */
    public synchronized List<HistoricalRecord> load() {
        return readHistory().records();
    }

    /**
     * Appends a record, trims the window and writes the file.
     *
     * @param record record to append
     * @return stored records after trimming, oldest first
     */
    public synchronized List<HistoricalRecord> append(HistoricalRecord record) {
        TrendHistory current = readHistory();
        List<HistoricalRecord> records = new ArrayList<>(current.records());
        records.add(record);
        if (records.size() > maxRecords) {
            records = new ArrayList<>(records.subList(records.size() - maxRecords, records.size()));
            log.debug("Trimmed trend history to last {} records", maxRecords);
        }

        TrendHistory updated = new TrendHistory(HISTORY_VERSION, current.created(), records);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), updated);
            log.debug("Saved trend history with {} records", records.size());
        } catch (IOException e) {
            log.warn("Failed to save trend history to {}: {}", file, e.getMessage());
        }
        return List.copyOf(records);
    }

    /**
     * Returns the most recent {@code n} records, oldest first.
     *
     * @param n maximum number of records
     * @return records
     */
    public synchronized List<HistoricalRecord> lastRecords(int n) {
        List<HistoricalRecord> records = load();
        return records.subList(Math.max(0, records.size() - n), records.size());
    }

    /**
     * Deletes the history file.
     */
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
            log.debug("Cleared trend history {}", file);
        } catch (IOException e) {
            log.warn("Failed to clear trend history {}: {}", file, e.getMessage());
        }
    }

    public int getMaxRecords() {
        return maxRecords;
    }

    private TrendHistory readHistory() {
        if (!Files.isRegularFile(file)) {
            log.debug("No trend history at {}, starting fresh", file);
            return emptyHistory();
        }
        try {
            TrendHistory history = mapper.readValue(file.toFile(), TrendHistory.class);
            return history != null ? history : emptyHistory();
        } catch (IOException e) {
            log.warn("Ignoring unreadable trend history {}: {}", file, e.getMessage());
            return emptyHistory();
        }
    }

    private TrendHistory emptyHistory() {
        return new TrendHistory(HISTORY_VERSION, clock.millis(), List.of());
    }
}
