package com.example.archiveindexer;

import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable runtime settings for one build.
 */
public record IndexerConfig(
        String rootName,
        Path treeDirectory,
        Path documentPath,
        Path outputDirectory,
        Path checksumCacheFile,
        Path buildMarkerFile,
        Path lockFile,
        int threadCount,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        List<String> reservedDirectories,
        List<String> noIndexEntryPrefixes,
        boolean excludeUndocumented,
        List<String> identifierKeys,
        String siteUrl,
        String archiveBaseUrl,
        String indexBaseUrl,
        int feedSize,
        ZoneId timeZone,
        boolean forceFull,
        boolean triggerSearchReindex,
        Optional<String> searchReindexUrl,
        Optional<String> cacheInvalidationUrl,
        String notificationKeyHeader,
        Optional<String> notificationKey,
        Duration notificationTimeout,
        Optional<Set<PosixFilePermission>> outputFilePermissions,
        boolean s3PublishEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
    /**
     * Applies command-line switches. A switch can only turn an option on.
     */
    public IndexerConfig withInvocation(boolean full, boolean reindex) {
        return new IndexerConfig(
                rootName,
                treeDirectory,
                documentPath,
                outputDirectory,
                checksumCacheFile,
                buildMarkerFile,
                lockFile,
                threadCount,
                excludeFilePatterns,
                excludeDirectoryPatterns,
                reservedDirectories,
                noIndexEntryPrefixes,
                excludeUndocumented,
                identifierKeys,
                siteUrl,
                archiveBaseUrl,
                indexBaseUrl,
                feedSize,
                timeZone,
                forceFull || full,
                triggerSearchReindex || reindex,
                searchReindexUrl,
                cacheInvalidationUrl,
                notificationKeyHeader,
                notificationKey,
                notificationTimeout,
                outputFilePermissions,
                s3PublishEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }
}
