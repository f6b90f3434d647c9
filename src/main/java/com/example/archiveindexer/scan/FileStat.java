package com.example.archiveindexer.scan;

import java.time.Instant;

/**
 * The subset of file attributes the indexer relies on.
 */
public record FileStat(
        FileKind kind,
        long size,
        Instant modified,
        boolean worldReadable
) {
}
