package com.example.archiveindexer.scan;

import com.example.archiveindexer.BuildDiagnostics;
import com.example.archiveindexer.model.ArchiveModel;
import com.example.archiveindexer.model.ArchivePaths;
import com.example.archiveindexer.model.DirectoryNode;
import com.example.archiveindexer.model.FileEntry;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Walks the served tree and builds the directory and file skeleton. The filesystem
 * decides what exists, how big it is and when it changed.
 */
public final class FilesystemCorrelator {
    private static final Logger LOGGER = LoggerFactory.getLogger(FilesystemCorrelator.class);

    private final Path treeDirectory;
    private final String rootName;
    private final List<PathMatcher> excludeFiles;
    private final List<PathMatcher> excludeDirectories;
    private final List<String> reservedDirectories;
    private final FileStatSource statSource;
    private final BuildDiagnostics diagnostics;
    private final Tika tika = new Tika();

    public FilesystemCorrelator(Path treeDirectory,
                                String rootName,
                                List<String> excludeFilePatterns,
                                List<String> excludeDirectoryPatterns,
                                List<String> reservedDirectories,
                                FileStatSource statSource,
                                BuildDiagnostics diagnostics) {
        this.treeDirectory = treeDirectory.toAbsolutePath().normalize();
        this.rootName = rootName;
        this.excludeFiles = matchers(excludeFilePatterns);
        this.excludeDirectories = matchers(excludeDirectoryPatterns);
        this.reservedDirectories = List.copyOf(reservedDirectories);
        this.statSource = statSource;
        this.diagnostics = diagnostics;
    }

    public ArchiveModel scan() throws IOException {
        Path rootPath = treeDirectory.resolve(rootName);
        FileStat rootStat = statSource.stat(rootPath);
        if (rootStat.kind() != FileKind.DIRECTORY) {
            throw new IOException("Archive root is not a directory: " + rootPath);
        }

        ArchiveModel model = new ArchiveModel(rootName, rootStat.modified());
        Deque<DirectoryNode> pending = new ArrayDeque<>();
        pending.addLast(model.root());

        while (!pending.isEmpty()) {
            DirectoryNode current = pending.removeFirst();
            Path directoryPath = ArchivePaths.toFilesystem(treeDirectory, current.path());
            List<Path> entries;
            try {
                entries = statSource.list(directoryPath);
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", directoryPath, ex);
                continue;
            }

            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (name.startsWith(".")) {
                    continue;
                }
                FileStat stat;
                try {
                    stat = statSource.stat(entry);
                } catch (IOException ex) {
                    // Removed between listing and stat; an upload or cleanup is in progress.
                    LOGGER.debug("Entry vanished during scan: {}", entry);
                    continue;
                }
                String path = ArchivePaths.join(current.path(), name);
                switch (stat.kind()) {
                    case DIRECTORY -> {
                        if (!skipDirectory(path, name, stat)) {
                            pending.addLast(model.addDirectory(current, name, stat.modified()));
                        }
                    }
                    case FILE -> {
                        if (!matches(excludeFiles, name)) {
                            model.addFile(FileEntry.regular(current, name, stat.size(), stat.modified(), contentType(name)));
                        }
                    }
                    case SYMLINK -> correlateSymlink(model, current, entry, name);
                    default -> LOGGER.debug("Skipping special file {}", entry);
                }
            }
        }

        model.sortEntries();
        LOGGER.info("Scanned {} directories and {} files under {}", model.directoryCount(), model.fileCount(), rootPath);
        return model;
    }

    private void correlateSymlink(ArchiveModel model, DirectoryNode directory, Path entry, String name) {
        String path = ArchivePaths.join(directory.path(), name);
        Path link;
        try {
            link = statSource.readLink(entry);
        } catch (IOException ex) {
            diagnostics.warn(BuildDiagnostics.Kind.DANGLING_SYMLINK, path, "link cannot be read");
            return;
        }

        Path resolved = entry.getParent().resolve(link).normalize();
        String targetPath = archivePathOf(resolved);
        boolean inTree = targetPath != null;
        String shown = inTree ? targetPath : stripTrailingSlash(link.toString());

        FileStat target;
        try {
            target = statSource.statTarget(entry);
        } catch (IOException ex) {
            if (inTree) {
                model.addDependency(targetPath, directory.path());
            }
            diagnostics.warn(BuildDiagnostics.Kind.DANGLING_SYMLINK, path, "link target cannot be read: " + shown);
            return;
        }

        if (target.kind() == FileKind.DIRECTORY) {
            model.addFile(FileEntry.directoryLink(directory, name, target.modified(), shown, inTree));
        } else if (target.kind() == FileKind.FILE) {
            if (!matches(excludeFiles, name)) {
                model.addFile(FileEntry.fileLink(directory, name, target.size(), target.modified(),
                        contentType(name), shown, inTree));
            }
        } else {
            LOGGER.debug("Skipping symlink to special file {}", entry);
        }
    }

    private String archivePathOf(Path resolved) {
        Path archiveRoot = treeDirectory.resolve(rootName);
        if (!resolved.startsWith(archiveRoot)) {
            return null;
        }
        StringBuilder builder = new StringBuilder(rootName);
        for (Path segment : archiveRoot.relativize(resolved)) {
            String value = segment.toString();
            if (!value.isEmpty()) {
                builder.append('/').append(value);
            }
        }
        return builder.toString();
    }

    private boolean skipDirectory(String path, String name, FileStat stat) {
        if (!stat.worldReadable()) {
            LOGGER.info("Skipping directory without public read access: {}", path);
            return true;
        }
        for (String reserved : reservedDirectories) {
            if (ArchivePaths.isWithin(path, reserved)) {
                LOGGER.debug("Skipping reserved directory {}", path);
                return true;
            }
        }
        return matches(excludeDirectories, name);
    }

    private String contentType(String name) {
        return tika.detect(name);
    }

    private static boolean matches(List<PathMatcher> matchers, String name) {
        Path candidate = Path.of(name);
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        return patterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") && value.length() > 1 ? value.substring(0, value.length() - 1) : value;
    }
}
