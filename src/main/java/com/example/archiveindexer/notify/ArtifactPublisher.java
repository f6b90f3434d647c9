package com.example.archiveindexer.notify;

import java.nio.file.Path;

/**
 * Copies generated files to an off-box location. Uploads may run in the background;
 * {@link #close()} waits for them.
 */
@FunctionalInterface
public interface ArtifactPublisher extends AutoCloseable {
    void enqueue(Path path);

    @Override
    default void close() {
        // no-op
    }

    static ArtifactPublisher noop() {
        return path -> {
        };
    }
}
