package com.example.archiveindexer.model;

import com.example.archiveindexer.document.MetadataBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * Entries that declare a common identifier, directly or through a chain of shared
 * identifiers. They describe one logical work.
 */
public final class IdentifierCluster {
    private final List<FileEntry> members;
    private final SortedSet<String> identifiers;
    private final MetadataBlock metadata;

    IdentifierCluster(List<FileEntry> members, SortedSet<String> identifiers, MetadataBlock metadata) {
        this.members = List.copyOf(members);
        this.identifiers = identifiers;
        this.metadata = metadata;
    }

    /**
     * Members in document order, then path order.
     */
    public List<FileEntry> members() {
        return members;
    }

    public FileEntry canonical() {
        return members.get(0);
    }

    public SortedSet<String> identifiers() {
        return identifiers;
    }

    /**
     * Metadata of every member merged in member order.
     */
    public MetadataBlock metadata() {
        return metadata;
    }

    public List<FileEntry> aliasesOf(FileEntry entry) {
        List<FileEntry> others = new ArrayList<>(members.size());
        for (FileEntry member : members) {
            if (member != entry) {
                others.add(member);
            }
        }
        return others;
    }

    public boolean isLocalOnly() {
        return members.size() == 1;
    }
}
