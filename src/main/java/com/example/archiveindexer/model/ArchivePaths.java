package com.example.archiveindexer.model;

import java.nio.file.Path;
import java.text.Normalizer;
import java.util.List;

/**
 * Helpers for canonical archive paths: {@code /}-separated, relative to the tree
 * directory, starting with the root name.
 */
public final class ArchivePaths {
    private ArchivePaths() {
    }

    public static String join(String directory, String name) {
        return directory + "/" + name;
    }

    /**
     * Returns the parent path, or {@code null} for a single-segment path.
     */
    public static String parent(String path) {
        int pos = path.lastIndexOf('/');
        return pos < 0 ? null : path.substring(0, pos);
    }

    public static String name(String path) {
        int pos = path.lastIndexOf('/');
        return pos < 0 ? path : path.substring(pos + 1);
    }

    public static List<String> segments(String path) {
        return List.of(path.split("/", -1));
    }

    public static int depth(String path) {
        return segments(path).size();
    }

    /**
     * Lookup key for a path. Names typed into the document and names read from disk may
     * differ in unicode composition, so both sides are compared in NFC.
     */
    public static String key(String path) {
        return Normalizer.normalize(path, Normalizer.Form.NFC);
    }

    public static boolean isWithin(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/");
    }

    public static Path toFilesystem(Path treeDirectory, String path) {
        Path resolved = treeDirectory;
        for (String segment : segments(path)) {
            resolved = resolved.resolve(segment);
        }
        return resolved;
    }
}
