package com.example.archiveindexer.checksum;

import com.example.archiveindexer.AtomicFiles;
import com.example.archiveindexer.scan.FileStat;
import com.example.archiveindexer.scan.FileStatSource;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Digest memoization keyed by archive path and validated by size and modification time.
 * <p>
 * Lookups may run on several threads. Nothing reaches disk until {@link #commit()},
 * which replaces the cache file atomically with the records seen during this run.
 */
public final class ChecksumCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChecksumCache.class);
    private static final int FORMAT_VERSION = 1;

    private final Path cacheFile;
    private final FileStatSource statSource;
    private final DigestCalculator calculator;
    private final ObjectMapper mapper;
    private final Map<String, ChecksumRecord> previous = new ConcurrentHashMap<>();
    private final Map<String, ChecksumRecord> current = new ConcurrentHashMap<>();
    private final AtomicInteger recomputed = new AtomicInteger();

    public ChecksumCache(Path cacheFile, FileStatSource statSource) {
        this(cacheFile, statSource, new DigestCalculator());
    }

    public ChecksumCache(Path cacheFile, FileStatSource statSource, DigestCalculator calculator) {
        this.cacheFile = cacheFile;
        this.statSource = statSource;
        this.calculator = calculator;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads the committed cache. A missing file means a cold cache; an unreadable one is
     * logged and treated the same way.
     */
    public void load() {
        if (!Files.exists(cacheFile)) {
            LOGGER.info("No checksum cache at {}; starting cold", cacheFile);
            return;
        }
        try {
            CacheDocument document = mapper.readValue(cacheFile.toFile(), CacheDocument.class);
            if (document.records() != null) {
                for (ChecksumRecord record : document.records()) {
                    previous.put(record.path(), record);
                }
            }
            LOGGER.info("Loaded {} checksum records from {}", previous.size(), cacheFile);
        } catch (IOException ex) {
            LOGGER.warn("Checksum cache {} is unreadable; starting cold", cacheFile, ex);
            previous.clear();
        }
    }

    /**
     * Returns the digests of {@code file}, recomputing them only when the live size or
     * modification time differs from the cached record.
     *
     * @param path archive path used as the cache key
     * @param file location of the content on disk
     */
    public Digests lookup(String path, Path file) throws IOException {
        FileStat live = statSource.statTarget(file);
        long mtime = live.modified().toEpochMilli();
        ChecksumRecord cached = current.get(path);
        if (cached == null) {
            cached = previous.get(path);
        }
        if (cached != null && cached.matches(live.size(), mtime)) {
            current.put(path, cached);
            return cached.digests();
        }

        LOGGER.debug("Computing digests for {}", path);
        Digests digests;
        try (InputStream input = statSource.open(file)) {
            digests = calculator.compute(input);
        }
        recomputed.incrementAndGet();
        current.put(path, new ChecksumRecord(path, live.size(), mtime, digests.md5(), digests.sha512()));
        return digests;
    }

    /**
     * Number of files hashed (not served from the cache) since this instance was created.
     */
    public int recomputedCount() {
        return recomputed.get();
    }

    public int size() {
        return current.size();
    }

    public void commit() throws IOException {
        List<ChecksumRecord> records = new ArrayList<>(current.values());
        records.sort(Comparator.comparing(ChecksumRecord::path));
        byte[] content = mapper.writerWithDefaultPrettyPrinter()
                .writeValueAsBytes(new CacheDocument(FORMAT_VERSION, records));
        AtomicFiles.write(cacheFile, content);
        LOGGER.info("Committed {} checksum records to {}", records.size(), cacheFile);
    }

    public Path path() {
        return cacheFile;
    }

    record CacheDocument(int version, List<ChecksumRecord> records) {
    }
}
