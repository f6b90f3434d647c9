package com.example.archiveindexer.model;

import com.example.archiveindexer.document.MetadataBlock;

import java.util.Comparator;

/**
 * A description of {@code targetPath} written in an ancestor's section.
 *
 * @param targetPath         the described path
 * @param declaringDirectory directory whose section holds the declaration
 * @param declaringDepth     segment count of {@code declaringDirectory}
 * @param relativeName       the heading as written, relative to the declaring directory
 * @param description        raw description text
 * @param metadata           metadata declared with the mention
 * @param documentOrder      ordinal of the declaring section
 */
public record Mention(
        String targetPath,
        String declaringDirectory,
        int declaringDepth,
        String relativeName,
        String description,
        MetadataBlock metadata,
        int documentOrder
) {
    /**
     * Shallowest declaring directory first, then document order.
     */
    public static final Comparator<Mention> INHERITANCE_ORDER = Comparator
            .comparingInt(Mention::declaringDepth)
            .thenComparingInt(Mention::documentOrder);
}
