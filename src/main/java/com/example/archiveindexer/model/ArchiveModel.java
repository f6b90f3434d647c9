package com.example.archiveindexer.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The whole archive for one build: the directory tree plus path lookups, the mention
 * multimap and the identifier clusters.
 */
public final class ArchiveModel {
    private static final Comparator<DirectoryNode> PATH_ORDER =
            Comparator.comparing(DirectoryNode::path, DirectoryNode.NAME_ORDER);

    private final DirectoryNode root;
    private final Map<String, DirectoryNode> directories = new LinkedHashMap<>();
    private final Map<String, FileEntry> files = new LinkedHashMap<>();
    private final Map<String, Set<String>> pagesShowing = new LinkedHashMap<>();
    private MentionIndex mentions = new MentionIndex();
    private List<IdentifierCluster> clusters = List.of();

    public ArchiveModel(String rootName, Instant rootModified) {
        this.root = new DirectoryNode(rootName, null, rootModified);
        directories.put(ArchivePaths.key(rootName), root);
    }

    public DirectoryNode root() {
        return root;
    }

    public DirectoryNode addDirectory(DirectoryNode parent, String name, Instant modified) {
        DirectoryNode child = new DirectoryNode(ArchivePaths.join(parent.path(), name), parent, modified);
        DirectoryNode existing = directories.putIfAbsent(ArchivePaths.key(child.path()), child);
        if (existing != null) {
            return existing;
        }
        parent.addChild(child);
        return child;
    }

    public void addFile(FileEntry entry) {
        if (files.putIfAbsent(ArchivePaths.key(entry.path()), entry) == null) {
            entry.directory().addFile(entry);
        }
    }

    public void removeFile(FileEntry entry) {
        if (files.remove(ArchivePaths.key(entry.path()), entry)) {
            entry.directory().removeFile(entry);
        }
    }

    public Optional<DirectoryNode> directory(String path) {
        return Optional.ofNullable(directories.get(ArchivePaths.key(path)));
    }

    public Optional<FileEntry> file(String path) {
        return Optional.ofNullable(files.get(ArchivePaths.key(path)));
    }

    /**
     * All directories ordered by path, ignoring case.
     */
    public List<DirectoryNode> directories() {
        List<DirectoryNode> sorted = new ArrayList<>(directories.values());
        sorted.sort(PATH_ORDER);
        return sorted;
    }

    /**
     * All file entries in discovery order.
     */
    public List<FileEntry> files() {
        return List.copyOf(files.values());
    }

    public int directoryCount() {
        return directories.size();
    }

    public int fileCount() {
        return files.size();
    }

    /**
     * Records that the page of {@code directoryPath} shows data about {@code targetPath},
     * which may live elsewhere in the tree or not exist at all.
     */
    public void addDependency(String targetPath, String directoryPath) {
        directory(directoryPath).ifPresent(page -> pagesShowing
                .computeIfAbsent(ArchivePaths.key(targetPath), ignored -> new TreeSet<>())
                .add(page.path()));
    }

    /**
     * Target path (NFC) to the directory pages that show it.
     */
    public Map<String, Set<String>> dependencies() {
        return Collections.unmodifiableMap(pagesShowing);
    }

    public MentionIndex mentions() {
        return mentions;
    }

    public List<IdentifierCluster> clusters() {
        return Collections.unmodifiableList(clusters);
    }

    void attach(MentionIndex index, List<IdentifierCluster> resolvedClusters) {
        this.mentions = index;
        this.clusters = List.copyOf(resolvedClusters);
    }

    public void sortEntries() {
        directories.values().forEach(DirectoryNode::sortEntries);
    }
}
