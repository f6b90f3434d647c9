package com.example.archiveindexer.render;

import java.util.List;

/**
 * Flat values handed to the templates. Descriptions are raw markup; every other string
 * is escaped by the template.
 */
public final class PageViews {
    private PageViews() {
    }

    public record Crumb(String name, String url) {
    }

    public record MetadataView(String key, List<String> values) {
    }

    /**
     * A description of the page's subject written in an ancestor's section.
     */
    public record MentionView(String declaringDirectory, String declaringUrl, String relativeName, String description) {
    }

    public record AliasView(String path, String url) {
    }

    /**
     * A nested-path declaration shown on a directory page.
     */
    public record NestedView(String relativeName, String targetPath, String targetUrl, String description) {
    }

    public record EntryView(
            String name,
            String displayName,
            String anchor,
            String url,
            String path,
            String directoryPath,
            String directoryUrl,
            long size,
            long timestamp,
            String date,
            String md5,
            String sha512,
            String contentType,
            String description,
            boolean symlink,
            boolean directoryLink,
            String symlinkTarget,
            List<String> identifiers,
            List<MetadataView> metadata,
            List<MentionView> inherited,
            List<AliasView> aliases
    ) {
    }

    public record SubdirectoryView(
            String name,
            String displayName,
            String path,
            String url,
            String description,
            int fileCount,
            int subdirectoryCount,
            String date
    ) {
    }

    public record DirectoryView(
            String path,
            String name,
            String displayName,
            String url,
            String parentPath,
            String parentUrl,
            List<Crumb> crumbs,
            String description,
            String date,
            int fileCount,
            int subdirectoryCount,
            List<MetadataView> metadata,
            List<MentionView> inherited,
            List<NestedView> nested,
            List<SubdirectoryView> subdirectories,
            List<EntryView> files
    ) {
    }

    public record WindowLink(String label, String url, boolean current) {
    }

    public record FeedItem(String title, String link, String guid, String pubDate, String description, String directoryPath) {
    }
}
