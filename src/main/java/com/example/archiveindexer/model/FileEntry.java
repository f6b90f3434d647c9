package com.example.archiveindexer.model;

import com.example.archiveindexer.checksum.Digests;
import com.example.archiveindexer.document.MetadataBlock;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One file present on disk, or a symlink to a file or directory. Size and time always
 * come from the filesystem (following symlinks); everything descriptive comes from the
 * document.
 */
public final class FileEntry {
    private final DirectoryNode directory;
    private final String name;
    private final String path;
    private final long size;
    private final Instant modified;
    private final String contentType;
    private final String symlinkTarget;
    private final boolean symlinkInTree;
    private final boolean directoryLink;

    private Digests digests;
    private MetadataBlock metadata = MetadataBlock.empty();
    private MetadataBlock resolvedMetadata = MetadataBlock.empty();
    private String description = "";
    private boolean documented;
    private int documentOrder = Integer.MAX_VALUE;
    private List<Mention> inherited = List.of();
    private Set<String> identifiers = Set.of();
    private IdentifierCluster cluster;
    private FileEntry displaySource;
    private DirectoryNode linkedDirectory;

    private FileEntry(DirectoryNode directory,
                      String name,
                      long size,
                      Instant modified,
                      String contentType,
                      String symlinkTarget,
                      boolean symlinkInTree,
                      boolean directoryLink) {
        this.directory = directory;
        this.name = name;
        this.path = ArchivePaths.join(directory.path(), name);
        this.size = size;
        this.modified = modified;
        this.contentType = contentType;
        this.symlinkTarget = symlinkTarget;
        this.symlinkInTree = symlinkInTree;
        this.directoryLink = directoryLink;
    }

    public static FileEntry regular(DirectoryNode directory, String name, long size, Instant modified, String contentType) {
        return new FileEntry(directory, name, size, modified, contentType, null, false, false);
    }

    /**
     * A symlink to a file. Size and time are the target's.
     *
     * @param target archive path of the target when it lies inside the tree, else the raw link text
     */
    public static FileEntry fileLink(DirectoryNode directory, String name, long size, Instant modified,
                                     String contentType, String target, boolean inTree) {
        return new FileEntry(directory, name, size, modified, contentType, target, inTree, false);
    }

    public static FileEntry directoryLink(DirectoryNode directory, String name, Instant modified,
                                          String target, boolean inTree) {
        return new FileEntry(directory, name, 0L, modified, null, target, inTree, true);
    }

    public DirectoryNode directory() {
        return directory;
    }

    public String name() {
        return name;
    }

    public String path() {
        return path;
    }

    public long size() {
        return size;
    }

    public Instant modified() {
        return modified;
    }

    public Optional<String> contentType() {
        return Optional.ofNullable(contentType);
    }

    public boolean isSymlink() {
        return symlinkTarget != null;
    }

    public Optional<String> symlinkTarget() {
        return Optional.ofNullable(symlinkTarget);
    }

    public boolean symlinkInTree() {
        return symlinkInTree;
    }

    public boolean isDirectoryLink() {
        return directoryLink;
    }

    public Optional<Digests> digests() {
        return Optional.ofNullable(digests);
    }

    public void setDigests(Digests digests) {
        this.digests = digests;
    }

    /**
     * Metadata declared in the entry's own directory section.
     */
    public MetadataBlock metadata() {
        return metadata;
    }

    /**
     * Own metadata, then metadata from mentions, symlink target and identifier aliases.
     */
    public MetadataBlock resolvedMetadata() {
        return resolvedMetadata;
    }

    /**
     * Description declared in the entry's own directory section. Never replaced by a
     * mention from further up.
     */
    public String description() {
        return description;
    }

    /**
     * Own description, or the symlink target's when this entry has none.
     */
    public String displayDescription() {
        if (!description.isBlank() || displaySource == null) {
            return description;
        }
        return displaySource.displayDescription();
    }

    public boolean documented() {
        return documented;
    }

    public int documentOrder() {
        return documentOrder;
    }

    /**
     * Descriptions written for this path in ancestor sections, shallowest first.
     */
    public List<Mention> inherited() {
        return inherited;
    }

    public Set<String> identifiers() {
        return identifiers;
    }

    public Optional<IdentifierCluster> cluster() {
        return Optional.ofNullable(cluster);
    }

    /**
     * The entry a file symlink resolved to, if it lies in the indexed tree.
     */
    public Optional<FileEntry> displaySource() {
        return Optional.ofNullable(displaySource);
    }

    public Optional<DirectoryNode> linkedDirectory() {
        return Optional.ofNullable(linkedDirectory);
    }

    void declare(MetadataBlock declared, String text, int order) {
        metadata = metadata.merge(declared);
        description = DirectoryNode.appendParagraph(description, text);
        markDocumented(order);
    }

    void markDocumented(int order) {
        documented = true;
        documentOrder = Math.min(documentOrder, order);
    }

    void inherit(List<Mention> chain) {
        inherited = chain;
    }

    void resolveMetadata(MetadataBlock value) {
        resolvedMetadata = value;
    }

    void identify(Set<String> tokens) {
        identifiers = tokens;
    }

    void joinCluster(IdentifierCluster value) {
        cluster = value;
    }

    void showAs(FileEntry source) {
        displaySource = source;
    }

    void linkTo(DirectoryNode target) {
        linkedDirectory = target;
    }

    @Override
    public String toString() {
        return "FileEntry[" + path + "]";
    }
}
