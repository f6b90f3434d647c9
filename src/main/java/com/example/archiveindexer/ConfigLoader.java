package com.example.archiveindexer;

import com.example.archiveindexer.model.ArchivePaths;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class ConfigLoader {
    private static final String DEFAULT_ROOT_NAME = "if-archive";
    private static final int DEFAULT_FEED_SIZE = 30;
    private static final int DEFAULT_NOTIFICATION_TIMEOUT_SECONDS = 10;
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Index",
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            "*~"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information",
            "lost+found"
    );
    private static final List<String> DEFAULT_IDENTIFIER_KEYS = List.of("ifid", "tuid");

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public IndexerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.treeDirectory == null || raw.treeDirectory.isBlank()) {
            throw new IllegalArgumentException("Config must include treeDirectory.");
        }
        if (raw.documentPath == null || raw.documentPath.isBlank()) {
            throw new IllegalArgumentException("Config must include documentPath.");
        }

        String rootName = optionalString(raw.rootName, DEFAULT_ROOT_NAME);
        if (rootName.contains("/") || rootName.startsWith(".")) {
            throw new IllegalArgumentException("rootName must be a single directory name: " + rootName);
        }
        Path treeDirectory = Path.of(raw.treeDirectory);
        Path documentPath = Path.of(raw.documentPath);
        Path outputDirectory = Path.of(optionalString(raw.outputDirectory, "indexes"));
        Path stateDirectory = Optional.ofNullable(raw.stateDirectory)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElse(outputDirectory.resolve(".indexer"));
        Path checksumCacheFile = optionalPath(raw.checksumCacheFile, stateDirectory.resolve("checksums.json"));
        Path buildMarkerFile = optionalPath(raw.buildMarkerFile, stateDirectory.resolve("build-marker.json"));
        Path lockFile = optionalPath(raw.lockFile, stateDirectory.resolve("build.lock"));

        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        int feedSize = raw.feedSize != null && raw.feedSize > 0 ? raw.feedSize : DEFAULT_FEED_SIZE;
        int timeoutSeconds = raw.notificationTimeoutSeconds != null && raw.notificationTimeoutSeconds > 0
                ? raw.notificationTimeoutSeconds
                : DEFAULT_NOTIFICATION_TIMEOUT_SECONDS;

        ZoneId timeZone;
        try {
            timeZone = ZoneId.of(optionalString(raw.timeZone, "UTC"));
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Unknown timeZone: " + raw.timeZone, ex);
        }

        Optional<Set<PosixFilePermission>> permissions = Optional.ofNullable(raw.outputFilePermissions)
                .filter(value -> !value.isBlank())
                .map(PosixFilePermissions::fromString);

        List<String> identifierKeys = raw.identifierKeys == null || raw.identifierKeys.isEmpty()
                ? DEFAULT_IDENTIFIER_KEYS
                : cleanList(raw.identifierKeys);

        Optional<String> searchReindexUrl = optionalValue(raw.searchReindexUrl);
        boolean triggerSearchReindex = raw.triggerSearchReindex != null && raw.triggerSearchReindex;

        boolean s3PublishEnabled = raw.s3PublishEnabled != null && raw.s3PublishEnabled;
        Optional<String> s3Bucket = optionalValue(raw.s3Bucket);
        if (s3PublishEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3PublishEnabled is true.");
        }

        return new IndexerConfig(
                rootName,
                treeDirectory,
                documentPath,
                outputDirectory,
                checksumCacheFile,
                buildMarkerFile,
                lockFile,
                threadCount,
                mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns),
                mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns),
                archivePaths(rootName, "reservedDirectories", raw.reservedDirectories),
                archivePaths(rootName, "noIndexEntryPrefixes", raw.noIndexEntryPrefixes),
                raw.excludeUndocumented != null && raw.excludeUndocumented,
                identifierKeys,
                optionalString(raw.siteUrl, "http://localhost"),
                optionalString(raw.archiveBaseUrl, "/"),
                optionalString(raw.indexBaseUrl, "/indexes/"),
                feedSize,
                timeZone,
                raw.forceFull != null && raw.forceFull,
                triggerSearchReindex,
                searchReindexUrl,
                optionalValue(raw.cacheInvalidationUrl),
                optionalString(raw.notificationKeyHeader, "X-Auth-Key"),
                optionalValue(raw.notificationKey),
                Duration.ofSeconds(timeoutSeconds),
                permissions,
                s3PublishEnabled,
                s3Bucket,
                optionalValue(raw.s3Prefix),
                optionalValue(raw.s3Region)
        );
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    // Entries are archive paths; a bare name is taken as relative to the root.
    private List<String> archivePaths(String rootName, String key, List<String> values) {
        List<String> paths = new ArrayList<>();
        for (String value : cleanList(values)) {
            String path = value.replaceAll("^/+|/+$", "");
            if (ArchivePaths.segments(path).contains("..")) {
                throw new IllegalArgumentException(key + " entries must not contain '..': " + value);
            }
            paths.add(path.equals(rootName) || path.startsWith(rootName + "/") ? path : rootName + "/" + path);
        }
        return List.copyOf(paths);
    }

    private List<String> cleanList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(value -> value != null && !value.isBlank()).map(String::strip).toList();
    }

    private Path optionalPath(String value, Path fallback) {
        return value == null || value.isBlank() ? fallback : Path.of(value);
    }

    private Optional<String> optionalValue(String value) {
        return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String rootName;
        public String treeDirectory;
        public String documentPath;
        public String outputDirectory;
        public String stateDirectory;
        public String checksumCacheFile;
        public String buildMarkerFile;
        public String lockFile;
        public Integer threadCount;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public List<String> reservedDirectories;
        public List<String> noIndexEntryPrefixes;
        public Boolean excludeUndocumented;
        public List<String> identifierKeys;
        public String siteUrl;
        public String archiveBaseUrl;
        public String indexBaseUrl;
        public Integer feedSize;
        public String timeZone;
        public Boolean forceFull;
        public Boolean triggerSearchReindex;
        public String searchReindexUrl;
        public String cacheInvalidationUrl;
        public String notificationKeyHeader;
        public String notificationKey;
        public Integer notificationTimeoutSeconds;
        public String outputFilePermissions;
        public Boolean s3PublishEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
