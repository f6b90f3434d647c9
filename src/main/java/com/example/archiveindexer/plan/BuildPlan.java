package com.example.archiveindexer.plan;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Which outputs a run regenerates. The manifest, feed and directory map are always
 * part of a plan and are not listed.
 *
 * @param full           whether every output is regenerated
 * @param reason         why this plan was chosen, for the log
 * @param directoryPages archive paths of directories whose page is regenerated
 * @param windows        date listings that are regenerated
 */
public record BuildPlan(
        boolean full,
        String reason,
        SortedSet<String> directoryPages,
        Set<DateWindow> windows
) {
    public BuildPlan {
        directoryPages = Collections.unmodifiableSortedSet(new TreeSet<>(directoryPages));
        windows = windows.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(DateWindow.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(windows));
    }

    public boolean includesDirectory(String path) {
        return directoryPages.contains(path);
    }

    public boolean includesWindow(DateWindow window) {
        return windows.contains(window);
    }

    /**
     * Directory and date pages, excluding the three unconditional outputs.
     */
    public int pageCount() {
        return directoryPages.size() + windows.size();
    }
}
