package com.example.archiveindexer.plan;

import com.example.archiveindexer.model.ArchivePaths;

import java.nio.file.Path;

/**
 * Names of generated files, relative to the output directory.
 */
public final class OutputLayout {
    public static final String DIRECTORY_MAP = "dirlist.html";
    public static final String MANIFEST = "Master-Index.xml";
    public static final String FEED = "feed.xml";
    public static final String DIRECTORY_PAGE = "index.html";

    private OutputLayout() {
    }

    public static String directoryPage(String directoryPath) {
        return ArchivePaths.join(directoryPath, DIRECTORY_PAGE);
    }

    public static Path resolve(Path outputDirectory, String relativeName) {
        return ArchivePaths.toFilesystem(outputDirectory, relativeName);
    }
}
