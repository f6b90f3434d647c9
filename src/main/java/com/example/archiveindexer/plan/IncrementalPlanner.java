package com.example.archiveindexer.plan;

import com.example.archiveindexer.model.ArchiveModel;
import com.example.archiveindexer.model.ArchivePaths;
import com.example.archiveindexer.model.DirectoryNode;
import com.example.archiveindexer.model.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Decides which pages need regenerating since the last successful build.
 */
public final class IncrementalPlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(IncrementalPlanner.class);

    /**
     * @param model            the resolved archive
     * @param lastBuild        start time of the last successful run, if a marker exists
     * @param now              start time of this run
     * @param documentModified modification time of the description document
     * @param forceFull        regenerate everything regardless of the marker
     * @param outputExists     whether a generated file (relative name) is present
     */
    public BuildPlan plan(ArchiveModel model,
                          Optional<Instant> lastBuild,
                          Instant now,
                          Instant documentModified,
                          boolean forceFull,
                          Predicate<String> outputExists) {
        List<DirectoryNode> directories = model.directories();
        String fullReason = null;
        if (forceFull) {
            fullReason = "full rebuild requested";
        } else if (lastBuild.isEmpty()) {
            fullReason = "no build marker";
        } else if (documentModified.isAfter(lastBuild.get())) {
            fullReason = "description document changed";
        }

        if (fullReason != null) {
            TreeSet<String> all = new TreeSet<>();
            directories.forEach(directory -> all.add(directory.path()));
            BuildPlan plan = new BuildPlan(true, fullReason, all, EnumSet.allOf(DateWindow.class));
            LOGGER.info("Planning full rebuild ({}): {} pages", fullReason, plan.pageCount());
            return plan;
        }

        Instant marker = lastBuild.get();
        TreeSet<String> pages = new TreeSet<>();
        boolean anyChange = false;
        for (DirectoryNode directory : directories) {
            boolean changed = directoryChanged(directory, marker);
            anyChange |= directory.modified().isAfter(marker);
            if (changed || !outputExists.test(OutputLayout.directoryPage(directory.path()))) {
                pages.add(directory.path());
            }
        }
        for (Map.Entry<String, Set<String>> dependency : model.dependencies().entrySet()) {
            if (targetChanged(model, dependency.getKey(), marker)) {
                pages.addAll(dependency.getValue());
            }
        }
        List<FileEntry> files = model.files();
        for (FileEntry entry : files) {
            if (entry.modified().isAfter(marker)) {
                anyChange = true;
                break;
            }
        }

        Set<DateWindow> windows = EnumSet.noneOf(DateWindow.class);
        for (DateWindow window : DateWindow.values()) {
            if (anyChange || !outputExists.test(window.fileName()) || agedOut(window, files, marker, now)) {
                windows.add(window);
            }
        }

        BuildPlan plan = new BuildPlan(false, "changes since " + marker, pages, windows);
        LOGGER.info("Planning incremental build since {}: {} directory pages, {} date pages",
                marker, pages.size(), windows.size());
        return plan;
    }

    private static boolean directoryChanged(DirectoryNode directory, Instant marker) {
        if (directory.modified().isAfter(marker)) {
            return true;
        }
        for (FileEntry entry : directory.files()) {
            if (entry.modified().isAfter(marker)) {
                return true;
            }
        }
        for (DirectoryNode child : directory.children()) {
            if (child.modified().isAfter(marker)) {
                return true;
            }
        }
        return false;
    }

    /** Whether something a page shows from elsewhere in the tree moved since {@code marker}. */
    static boolean targetChanged(ArchiveModel model, String target, Instant marker) {
        Optional<FileEntry> entry = model.file(target);
        if (entry.isPresent() && entry.get().modified().isAfter(marker)) {
            return true;
        }
        Optional<DirectoryNode> directory = model.directory(target);
        if (directory.isPresent() && directory.get().modified().isAfter(marker)) {
            return true;
        }
        // Uploads that keep the file's own time, removals and renames surface on the nearest directory still present.
        for (String parent = ArchivePaths.parent(target); parent != null; parent = ArchivePaths.parent(parent)) {
            Optional<DirectoryNode> existing = model.directory(parent);
            if (existing.isPresent()) {
                return existing.get().modified().isAfter(marker);
            }
        }
        return false;
    }

    private static boolean agedOut(DateWindow window, List<FileEntry> files, Instant marker, Instant now) {
        if (window.length().isEmpty()) {
            return false;
        }
        for (FileEntry entry : files) {
            if (window.includes(entry.modified(), marker) && !window.includes(entry.modified(), now)) {
                return true;
            }
        }
        return false;
    }
}
