package com.example.archiveindexer.scan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Every filesystem read the build performs. Tests substitute an in-memory source so
 * time and file changes can be simulated without touching disk.
 */
public interface FileStatSource {
    /**
     * Attributes of {@code path} itself; symlinks report {@link FileKind#SYMLINK}.
     */
    FileStat stat(Path path) throws IOException;

    /**
     * Attributes of the file {@code path} resolves to, following symlinks.
     */
    FileStat statTarget(Path path) throws IOException;

    Path readLink(Path path) throws IOException;

    /**
     * Directory entries sorted by name.
     */
    List<Path> list(Path directory) throws IOException;

    /**
     * Opens the content of {@code path}, following symlinks.
     */
    InputStream open(Path path) throws IOException;

    static FileStatSource system() {
        return new NioFileStatSource();
    }
}
