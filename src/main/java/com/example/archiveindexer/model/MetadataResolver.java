package com.example.archiveindexer.model;

import com.example.archiveindexer.BuildDiagnostics;
import com.example.archiveindexer.document.DocumentSection;
import com.example.archiveindexer.document.MetadataBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges the parsed document into the filesystem skeleton: own declarations, inherited
 * mentions, symlink display data and identifier clusters.
 */
public final class MetadataResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataResolver.class);
    private static final int MAX_LINK_HOPS = 8;
    private static final Comparator<FileEntry> DOCUMENT_ORDER = Comparator
            .comparingInt(FileEntry::documentOrder)
            .thenComparing(FileEntry::path);

    private final List<String> identifierKeys;
    private final List<String> noIndexEntryPrefixes;
    private final boolean excludeUndocumented;
    private final BuildDiagnostics diagnostics;

    public MetadataResolver(List<String> identifierKeys,
                            List<String> noIndexEntryPrefixes,
                            boolean excludeUndocumented,
                            BuildDiagnostics diagnostics) {
        this.identifierKeys = identifierKeys;
        this.noIndexEntryPrefixes = noIndexEntryPrefixes;
        this.excludeUndocumented = excludeUndocumented;
        this.diagnostics = diagnostics;
    }

    public ArchiveModel resolve(List<DocumentSection> sections, ArchiveModel model) {
        MentionIndex mentions = new MentionIndex();
        Map<String, MetadataBlock> missing = new LinkedHashMap<>();
        for (DocumentSection section : sections) {
            switch (section.kind()) {
                case DIRECTORY -> declareDirectory(model, section);
                case FILE -> declareFile(model, section, mentions, missing);
            }
        }

        for (DirectoryNode directory : model.directories()) {
            directory.inherit(mentions.mentionsOf(directory.path()));
        }
        for (FileEntry entry : model.files()) {
            entry.inherit(mentions.mentionsOf(entry.path()));
        }

        checkUndocumented(model);
        resolveSymlinks(model);
        List<IdentifierCluster> clusters = clusterIdentifiers(model);
        linkMissingAliases(model, missing);
        model.attach(mentions, clusters);
        model.sortEntries();
        LOGGER.info("Resolved {} directories, {} files, {} mentions, {} identifier clusters",
                model.directoryCount(), model.fileCount(), mentions.size(), clusters.size());
        return model;
    }

    private void declareDirectory(ArchiveModel model, DocumentSection section) {
        Optional<DirectoryNode> node = model.directory(section.path());
        if (node.isEmpty()) {
            diagnostics.warn(BuildDiagnostics.Kind.MISSING_DIRECTORY, section.path(),
                    "directory section at line " + section.lineNumber() + " has no directory on disk");
            return;
        }
        node.get().declare(section.metadata(), section.description());
    }

    private void declareFile(ArchiveModel model, DocumentSection section, MentionIndex mentions,
                             Map<String, MetadataBlock> missing) {
        String target = section.path();
        Optional<FileEntry> file = model.file(target);
        Optional<DirectoryNode> directory = file.isPresent() ? Optional.empty() : model.directory(target);
        if (file.isEmpty() && directory.isEmpty()) {
            diagnostics.warn(BuildDiagnostics.Kind.MISSING_FILE, target,
                    "entry at line " + section.lineNumber() + " has no file on disk");
            // Pages that would show the entry must notice when it is uploaded.
            missing.merge(target, section.metadata(), MetadataBlock::merge);
            for (String page : passThrough(section)) {
                model.addDependency(target, page);
            }
            return;
        }

        if (file.isPresent() && !section.nested()) {
            file.get().declare(section.metadata(), section.description(), section.ordinal());
            return;
        }

        Mention mention = new Mention(
                target,
                section.directory(),
                ArchivePaths.depth(section.directory()),
                section.relativeName(),
                section.description(),
                section.metadata(),
                section.ordinal()
        );
        mentions.add(mention);
        file.ifPresent(entry -> entry.markDocumented(section.ordinal()));

        for (String page : passThrough(section)) {
            model.directory(page).ifPresent(node -> node.addNestedMention(mention));
            model.addDependency(target, page);
        }
    }

    /**
     * The declaring directory and every directory between it and the target's own
     * directory. Empty for a plain entry in its own section.
     */
    private static List<String> passThrough(DocumentSection section) {
        List<String> pages = new ArrayList<>();
        String stop = ArchivePaths.parent(section.path());
        String current = section.directory();
        List<String> remaining = ArchivePaths.segments(section.relativeName());
        for (int i = 0; i < remaining.size() && !current.equals(stop); i++) {
            pages.add(current);
            current = ArchivePaths.join(current, remaining.get(i));
        }
        return pages;
    }

    private void checkUndocumented(ArchiveModel model) {
        for (FileEntry entry : model.files()) {
            if (entry.documented() || entry.isDirectoryLink()) {
                continue;
            }
            if (underNoIndexPrefix(entry.path())) {
                continue;
            }
            if (excludeUndocumented) {
                model.removeFile(entry);
                diagnostics.warn(BuildDiagnostics.Kind.UNDOCUMENTED_FILE, entry.path(), "excluded, no index entry");
            } else {
                diagnostics.warn(BuildDiagnostics.Kind.UNDOCUMENTED_FILE, entry.path(), "no index entry");
            }
        }
    }

    private boolean underNoIndexPrefix(String path) {
        for (String prefix : noIndexEntryPrefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private void resolveSymlinks(ArchiveModel model) {
        for (FileEntry entry : model.files()) {
            if (!entry.isSymlink()) {
                continue;
            }
            String target = entry.symlinkTarget().orElseThrow();
            if (!entry.symlinkInTree()) {
                LOGGER.debug("Symlink {} points outside the archive ({}); keeping local data", entry.path(), target);
                continue;
            }
            model.addDependency(target, entry.directory().path());
            if (entry.isDirectoryLink()) {
                Optional<DirectoryNode> linked = model.directory(target);
                if (linked.isPresent()) {
                    entry.linkTo(linked.get());
                } else {
                    diagnostics.warn(BuildDiagnostics.Kind.DANGLING_SYMLINK, entry.path(),
                            "target directory is not indexed: " + target);
                }
                continue;
            }
            Optional<FileEntry> source = followFileLink(model, entry);
            if (source.isPresent()) {
                entry.showAs(source.get());
            } else {
                diagnostics.warn(BuildDiagnostics.Kind.DANGLING_SYMLINK, entry.path(),
                        "target file is not indexed: " + target);
            }
        }
    }

    private Optional<FileEntry> followFileLink(ArchiveModel model, FileEntry link) {
        Set<String> visited = new LinkedHashSet<>();
        FileEntry current = link;
        for (int hop = 0; hop < MAX_LINK_HOPS; hop++) {
            if (!current.isSymlink() || !current.symlinkInTree()) {
                return current == link ? Optional.empty() : Optional.of(current);
            }
            String target = current.symlinkTarget().orElseThrow();
            if (!visited.add(target)) {
                return Optional.empty();
            }
            Optional<FileEntry> next = model.file(target);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.empty();
    }

    private List<IdentifierCluster> clusterIdentifiers(ArchiveModel model) {
        List<FileEntry> entries = new ArrayList<>(model.files());
        entries.sort(DOCUMENT_ORDER);

        Map<FileEntry, MetadataBlock> effective = new HashMap<>();
        for (FileEntry entry : entries) {
            effective.put(entry, ownAndInherited(entry));
        }
        for (FileEntry entry : entries) {
            MetadataBlock merged = effective.get(entry);
            Optional<FileEntry> source = entry.displaySource();
            if (source.isPresent()) {
                merged = merged.merge(effective.get(source.get()));
            }
            entry.resolveMetadata(merged);
        }

        DisjointSet sets = new DisjointSet(entries.size());
        Map<String, Integer> firstHolder = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            FileEntry entry = entries.get(i);
            Set<String> tokens = identifierTokens(effective.get(entry));
            entry.identify(tokens);
            for (String token : tokens) {
                Integer prior = firstHolder.putIfAbsent(token, i);
                if (prior != null) {
                    sets.union(prior, i);
                }
            }
        }

        Map<Integer, List<FileEntry>> groups = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            FileEntry entry = entries.get(i);
            if (entry.identifiers().isEmpty()) {
                continue;
            }
            groups.computeIfAbsent(sets.find(i), ignored -> new ArrayList<>()).add(entry);
        }

        List<IdentifierCluster> clusters = new ArrayList<>(groups.size());
        for (List<FileEntry> members : groups.values()) {
            TreeSet<String> identifiers = new TreeSet<>();
            MetadataBlock.Builder metadata = MetadataBlock.builder();
            for (FileEntry member : members) {
                identifiers.addAll(member.identifiers());
                metadata.addAll(member.resolvedMetadata());
            }
            IdentifierCluster cluster = new IdentifierCluster(members, identifiers, metadata.build());
            for (FileEntry member : members) {
                member.joinCluster(cluster);
                member.resolveMetadata(cluster.metadata());
                for (FileEntry alias : cluster.aliasesOf(member)) {
                    model.addDependency(member.path(), alias.directory().path());
                }
            }
            clusters.add(cluster);
        }
        return clusters;
    }

    /**
     * Declared entries missing from disk still list their identifiers. The pages of
     * present entries sharing one would gain an alias link when the file appears.
     */
    private void linkMissingAliases(ArchiveModel model, Map<String, MetadataBlock> missing) {
        if (missing.isEmpty()) {
            return;
        }
        Map<String, List<FileEntry>> holders = new HashMap<>();
        for (FileEntry entry : model.files()) {
            for (String token : entry.identifiers()) {
                holders.computeIfAbsent(token, ignored -> new ArrayList<>()).add(entry);
            }
        }
        missing.forEach((path, metadata) -> {
            for (String token : identifierTokens(metadata)) {
                for (FileEntry holder : holders.getOrDefault(token, List.of())) {
                    model.addDependency(path, holder.directory().path());
                }
            }
        });
    }

    private static MetadataBlock ownAndInherited(FileEntry entry) {
        MetadataBlock merged = entry.metadata();
        for (Mention mention : entry.inherited()) {
            merged = merged.merge(mention.metadata());
        }
        return merged;
    }

    private Set<String> identifierTokens(MetadataBlock metadata) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String key : identifierKeys) {
            for (String value : metadata.values(key)) {
                String trimmed = value.strip();
                if (!trimmed.isEmpty()) {
                    tokens.add(key.toLowerCase(Locale.ROOT) + ":" + trimmed);
                }
            }
        }
        return tokens;
    }
}
