package com.example.archiveindexer.document;

/**
 * One directory or file block of the description document, in source order.
 *
 * @param ordinal      position in the document, used to break ties deterministically
 * @param lineNumber   line of the heading
 * @param kind         directory heading or file heading
 * @param directory    canonical path of the enclosing directory section
 * @param relativeName file heading text relative to {@code directory}; empty for directories
 * @param metadata     the block of {@code key: value} lines under the heading
 * @param description  the free text, passed through unmodified
 */
public record DocumentSection(
        int ordinal,
        int lineNumber,
        SectionKind kind,
        String directory,
        String relativeName,
        MetadataBlock metadata,
        String description
) {
    public String path() {
        return kind == SectionKind.DIRECTORY ? directory : directory + "/" + relativeName;
    }

    /**
     * Number of path segments in the file heading; 0 for directory sections.
     */
    public int depth() {
        if (kind == SectionKind.DIRECTORY) {
            return 0;
        }
        return relativeName.split("/", -1).length;
    }

    public boolean nested() {
        return depth() > 1;
    }
}
