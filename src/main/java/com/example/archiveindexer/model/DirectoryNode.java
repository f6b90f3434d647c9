package com.example.archiveindexer.model;

import com.example.archiveindexer.document.MetadataBlock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One directory of the archive. Children and files mirror the filesystem; descriptive
 * fields come from the document.
 */
public final class DirectoryNode {
    static final Comparator<String> NAME_ORDER = Comparator
            .comparing((String name) -> name.toLowerCase(java.util.Locale.ROOT))
            .thenComparing(Comparator.naturalOrder());

    private final String path;
    private final String name;
    private final DirectoryNode parent;
    private final Instant modified;
    private final List<DirectoryNode> children = new ArrayList<>();
    private final List<FileEntry> files = new ArrayList<>();
    private final List<Mention> nestedMentions = new ArrayList<>();
    private MetadataBlock metadata = MetadataBlock.empty();
    private String description = "";
    private boolean documented;
    private List<Mention> inherited = List.of();

    DirectoryNode(String path, DirectoryNode parent, Instant modified) {
        this.path = path;
        this.name = ArchivePaths.name(path);
        this.parent = parent;
        this.modified = modified;
    }

    public String path() {
        return path;
    }

    public String name() {
        return name;
    }

    public Optional<DirectoryNode> parent() {
        return Optional.ofNullable(parent);
    }

    public Instant modified() {
        return modified;
    }

    public List<DirectoryNode> children() {
        return Collections.unmodifiableList(children);
    }

    public List<FileEntry> files() {
        return Collections.unmodifiableList(files);
    }

    public int fileCount() {
        return files.size();
    }

    public int subdirectoryCount() {
        return children.size();
    }

    public MetadataBlock metadata() {
        return metadata;
    }

    public String description() {
        return description;
    }

    public boolean documented() {
        return documented;
    }

    /**
     * Descriptions of this directory written in ancestor sections, shallowest first.
     */
    public List<Mention> inherited() {
        return inherited;
    }

    /**
     * Nested-path declarations written in this directory's section, or passing through
     * this directory on their way to a deeper target.
     */
    public List<Mention> nestedMentions() {
        return Collections.unmodifiableList(nestedMentions);
    }

    void addChild(DirectoryNode child) {
        children.add(child);
    }

    void addFile(FileEntry entry) {
        files.add(entry);
    }

    void removeFile(FileEntry entry) {
        files.remove(entry);
    }

    void declare(MetadataBlock declared, String text) {
        metadata = metadata.merge(declared);
        description = appendParagraph(description, text);
        documented = true;
    }

    void inherit(List<Mention> chain) {
        inherited = chain;
    }

    void addNestedMention(Mention mention) {
        nestedMentions.add(mention);
    }

    void sortEntries() {
        children.sort(Comparator.comparing(DirectoryNode::name, NAME_ORDER));
        files.sort(Comparator.comparing(FileEntry::name, NAME_ORDER));
        nestedMentions.sort(Mention.INHERITANCE_ORDER);
    }

    static String appendParagraph(String existing, String addition) {
        if (addition == null || addition.isBlank()) {
            return existing;
        }
        if (existing.isBlank()) {
            return addition;
        }
        return existing + "\n\n" + addition;
    }

    @Override
    public String toString() {
        return "DirectoryNode[" + path + "]";
    }
}
