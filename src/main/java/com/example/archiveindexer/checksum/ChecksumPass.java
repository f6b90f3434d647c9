package com.example.archiveindexer.checksum;

import com.example.archiveindexer.BuildDiagnostics;
import com.example.archiveindexer.model.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Fills in the digests of every file entry. Lookups run on a worker pool; the results
 * are applied to the model on the calling thread only.
 */
public final class ChecksumPass {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChecksumPass.class);

    private final ChecksumCache cache;
    private final int threadCount;
    private final BuildDiagnostics diagnostics;
    private final Function<String, Path> locator;

    public ChecksumPass(ChecksumCache cache, int threadCount, BuildDiagnostics diagnostics, Function<String, Path> locator) {
        this.cache = cache;
        this.threadCount = threadCount;
        this.diagnostics = diagnostics;
        this.locator = locator;
    }

    public void run(Collection<FileEntry> entries) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            Map<FileEntry, Future<Digests>> pending = new LinkedHashMap<>();
            for (FileEntry entry : entries) {
                if (entry.isDirectoryLink()) {
                    continue;
                }
                Path file = locator.apply(entry.path());
                pending.put(entry, executor.submit(() -> cache.lookup(entry.path(), file)));
            }

            for (Map.Entry<FileEntry, Future<Digests>> result : pending.entrySet()) {
                FileEntry entry = result.getKey();
                try {
                    entry.setDigests(result.getValue().get());
                } catch (ExecutionException ex) {
                    if (ex.getCause() instanceof IOException io) {
                        diagnostics.warn(BuildDiagnostics.Kind.CHECKSUM_IO, entry.path(), io.toString());
                    } else {
                        throw new IllegalStateException("Digest computation failed for " + entry.path(), ex.getCause());
                    }
                }
            }
            LOGGER.info("Checksums ready for {} files ({} recomputed)", pending.size(), cache.recomputedCount());
        } finally {
            executor.shutdownNow();
        }
    }
}
