package org.companyllm.rag.store;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.companyllm.rag.pipeline.error.IndexWriteException;
import org.companyllm.rag.pipeline.ir.IndexEntry;
import org.companyllm.rag.pipeline.ir.SearchHit;
import org.companyllm.rag.pipeline.sink.InMemoryVectorStore;
import org.companyllm.rag.pipeline.sink.StoreStats;
import org.companyllm.rag.pipeline.sink.VectorStore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable {@link VectorStore} for one collection, kept as an append-only NDJSON log at
 * {@code <directory>/<collection>.jsonl}.
 *
 * <p>Every upsert appends one complete line and flushes it before returning, so an entry's
 * hash and vector are always persisted together. When the log is replayed the last line
 * per chunk id wins; a line that cannot be parsed (for example one cut short by a crash)
 * is skipped. The whole collection is held in memory for querying.
 *
 * <p>{@link #compact()} rewrites the log with one line per chunk id and swaps it in with
 * an atomic move.
 */
@Slf4j
public class FileVectorStore implements VectorStore {
    public static final String LOG_SUFFIX = ".jsonl";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Getter
    private final String collectionName;
    @Getter
    private final Path logFile;
    private final InMemoryVectorStore entries;
    private BufferedWriter writer;
    private long logLines;
    private int dimension;
    private boolean closed;

    private FileVectorStore(Path directory, String collectionName) {
        this.collectionName = collectionName;
        this.logFile = directory.resolve(collectionName + LOG_SUFFIX);
        this.entries = new InMemoryVectorStore(collectionName);
    }

    /**
     * Open (creating if necessary) the collection under {@code directory} and replay its log.
     */
    public static FileVectorStore open(Path directory, String collectionName) {
        if (collectionName == null || !collectionName.matches("[A-Za-z0-9._-]+")) {
            throw new IllegalArgumentException("Invalid collection name: " + collectionName);
        }
        var store = new FileVectorStore(directory, collectionName);
        try {
            Files.createDirectories(directory);
            store.replay();
            store.writer = store.openWriter();
        } catch (IOException | UncheckedIOException e) {
            throw new IndexWriteException("Could not open vector store " + store.logFile, e);
        }
        log.info("Opened collection '{}' at {} with {} entries", collectionName, store.logFile, store.entries.stats().count());
        return store;
    }

    private void replay() throws IOException {
        if (!Files.exists(logFile)) {
            return;
        }
        var latest = new LinkedHashMap<String, IndexEntry>();
        long lineNumber = 0;
        long skipped = 0;
        try (var lines = Files.lines(logFile, StandardCharsets.UTF_8)) {
            for (var line : (Iterable<String>) lines::iterator) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                var entry = parse(line, lineNumber);
                if (entry.isEmpty()) {
                    skipped++;
                    continue;
                }
                latest.put(entry.get().chunkId(), entry.get());
                logLines++;
            }
        }
        entries.load(latest.values());
        latest.values().stream().findFirst().ifPresent(e -> dimension = e.vector().length);
        if (skipped > 0) {
            log.warn("Skipped {} unreadable lines while loading {}", skipped, logFile);
        }
    }

    private Optional<IndexEntry> parse(String line, long lineNumber) {
        try {
            var stored = OBJECT_MAPPER.readValue(line, StoredEntry.class);
            if (!stored.isComplete()) {
                log.warn("Ignoring incomplete entry on line {} of {}", lineNumber, logFile);
                return Optional.empty();
            }
            return Optional.of(stored.toIndexEntry());
        } catch (JsonProcessingException e) {
            log.atWarn().setMessage("Ignoring unreadable line {} of {}: {}")
                .addArgument(lineNumber)
                .addArgument(logFile)
                .addArgument(e::getOriginalMessage)
                .log();
            return Optional.empty();
        }
    }

    private BufferedWriter openWriter() throws IOException {
        return Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    @Override
    public Optional<IndexEntry> get(String chunkId) {
        return entries.get(chunkId);
    }

    @Override
    public synchronized void upsert(IndexEntry entry) {
        if (closed) {
            throw new IndexWriteException("Vector store " + collectionName + " is closed");
        }
        if (entry.vector() == null || entry.vector().length == 0) {
            throw new IndexWriteException("Refusing to store " + entry.chunkId() + " without a vector");
        }
        if (dimension != 0 && entry.vector().length != dimension) {
            throw new IndexWriteException("Vector for " + entry.chunkId() + " has " + entry.vector().length
                + " dimensions, collection " + collectionName + " has " + dimension);
        }
        try {
            writer.write(OBJECT_MAPPER.writeValueAsString(StoredEntry.from(entry)));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new IndexWriteException("Could not append " + entry.chunkId() + " to " + logFile, e);
        }
        logLines++;
        dimension = entry.vector().length;
        entries.upsert(entry);
    }

    @Override
    public List<SearchHit> query(float[] vector, int k) {
        return entries.query(vector, k);
    }

    @Override
    public StoreStats stats() {
        return new StoreStats(collectionName, entries.stats().count(), logFile.toString());
    }

    /**
     * Rewrite the log with only the latest line per chunk id.
     *
     * @return the number of superseded lines dropped
     */
    public synchronized long compact() {
        var current = entries.getEntries().stream()
            .sorted(Comparator.comparing(IndexEntry::chunkId))
            .collect(Collectors.toList());
        var temp = logFile.resolveSibling(logFile.getFileName() + ".compact");
        try {
            writer.close();
            try (var out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (var entry : current) {
                    out.write(OBJECT_MAPPER.writeValueAsString(StoredEntry.from(entry)));
                    out.newLine();
                }
            }
            Files.move(temp, logFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            writer = openWriter();
        } catch (IOException e) {
            throw new IndexWriteException("Could not compact " + logFile, e);
        }
        long dropped = logLines - current.size();
        logLines = current.size();
        log.info("Compacted {}: kept {} entries, dropped {} superseded lines", logFile, current.size(), dropped);
        return dropped;
    }

    /** Drop every entry of the collection, on disk and in memory. */
    public synchronized void reset() {
        try {
            writer.close();
            Files.deleteIfExists(logFile);
            writer = openWriter();
        } catch (IOException e) {
            throw new IndexWriteException("Could not reset " + logFile, e);
        }
        entries.clear();
        logLines = 0;
        dimension = 0;
        log.info("Reset collection '{}'", collectionName);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            throw new IndexWriteException("Could not close " + logFile, e);
        }
    }
}
