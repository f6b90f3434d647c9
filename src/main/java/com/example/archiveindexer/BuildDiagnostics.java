package com.example.archiveindexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Collects the per-entry problems of one build. None of them stops the build.
 */
public final class BuildDiagnostics {
    private static final Logger LOGGER = LoggerFactory.getLogger(BuildDiagnostics.class);

    public enum Kind {
        MISSING_FILE,
        MISSING_DIRECTORY,
        UNDOCUMENTED_FILE,
        CHECKSUM_IO,
        DANGLING_SYMLINK
    }

    public record Diagnostic(Kind kind, String path, String message) {
    }

    private final ConcurrentLinkedQueue<Diagnostic> entries = new ConcurrentLinkedQueue<>();

    public void warn(Kind kind, String path, String message) {
        entries.add(new Diagnostic(kind, path, message));
        LOGGER.warn("{}: {} ({})", kind, path, message);
    }

    public List<Diagnostic> all() {
        return List.copyOf(entries);
    }

    public List<Diagnostic> of(Kind kind) {
        List<Diagnostic> matching = new ArrayList<>();
        for (Diagnostic diagnostic : entries) {
            if (diagnostic.kind() == kind) {
                matching.add(diagnostic);
            }
        }
        return matching;
    }

    public int count() {
        return entries.size();
    }
}
