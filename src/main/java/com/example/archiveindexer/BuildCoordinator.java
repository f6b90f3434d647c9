package com.example.archiveindexer;

import com.example.archiveindexer.checksum.ChecksumCache;
import com.example.archiveindexer.checksum.ChecksumPass;
import com.example.archiveindexer.document.DocumentSection;
import com.example.archiveindexer.document.IndexDocumentParser;
import com.example.archiveindexer.model.ArchiveModel;
import com.example.archiveindexer.model.ArchivePaths;
import com.example.archiveindexer.model.MetadataResolver;
import com.example.archiveindexer.notify.ArtifactPublisher;
import com.example.archiveindexer.notify.BuildNotifier;
import com.example.archiveindexer.plan.BuildPlan;
import com.example.archiveindexer.plan.IncrementalPlanner;
import com.example.archiveindexer.plan.OutputLayout;
import com.example.archiveindexer.render.Addressing;
import com.example.archiveindexer.render.Renderer;
import com.example.archiveindexer.scan.FileStatSource;
import com.example.archiveindexer.scan.FilesystemCorrelator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one build: lock, parse, scan, resolve, checksum, plan, render, commit, notify.
 * Persisted state only advances after every step before the commit succeeded.
 */
public final class BuildCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BuildCoordinator.class);

    private final IndexerConfig config;
    private final FileStatSource statSource;
    private final Clock clock;
    private final BuildNotifier notifier;
    private final ArtifactPublisher publisher;
    private final Addressing addressing;

    public BuildCoordinator(IndexerConfig config,
                            FileStatSource statSource,
                            Clock clock,
                            BuildNotifier notifier,
                            ArtifactPublisher publisher) {
        this.config = config;
        this.statSource = statSource;
        this.clock = clock;
        this.notifier = notifier;
        this.publisher = publisher;
        this.addressing = new Addressing(config.siteUrl(), config.archiveBaseUrl(), config.indexBaseUrl());
    }

    public BuildReport run() throws IndexBuildException, IOException, InterruptedException {
        Instant start = clock.instant();
        try (BuildLock lock = BuildLock.acquire(config.lockFile(), clock)) {
            BuildDiagnostics diagnostics = new BuildDiagnostics();
            BuildStateStore stateStore = new BuildStateStore(config.buildMarkerFile());
            Optional<BuildState> previous = stateStore.load();

            // Parse before anything else so a broken document leaves no trace.
            List<DocumentSection> sections = new IndexDocumentParser(config.rootName()).parse(config.documentPath());
            Instant documentModified = statSource.statTarget(config.documentPath()).modified();

            ArchiveModel model = new FilesystemCorrelator(
                    config.treeDirectory(),
                    config.rootName(),
                    config.excludeFilePatterns(),
                    config.excludeDirectoryPatterns(),
                    config.reservedDirectories(),
                    statSource,
                    diagnostics
            ).scan();
            new MetadataResolver(
                    config.identifierKeys(),
                    config.noIndexEntryPrefixes(),
                    config.excludeUndocumented(),
                    diagnostics
            ).resolve(sections, model);

            ChecksumCache cache = new ChecksumCache(config.checksumCacheFile(), statSource);
            cache.load();
            Path treeDirectory = config.treeDirectory();
            new ChecksumPass(cache, config.threadCount(), diagnostics,
                    path -> ArchivePaths.toFilesystem(treeDirectory, path)).run(model.files());

            Path outputDirectory = config.outputDirectory();
            BuildPlan plan = new IncrementalPlanner().plan(
                    model,
                    previous.map(BuildState::lastBuild),
                    start,
                    documentModified,
                    config.forceFull(),
                    name -> Files.exists(OutputLayout.resolve(outputDirectory, name)));
            Renderer renderer = new Renderer(addressing, config.rootName(), config.feedSize(), config.timeZone());
            List<String> written = renderer.render(model, plan, outputDirectory, start);

            commit(cache, stateStore, start);
            applyPermissions(outputDirectory, written);
            notifyAndPublish(outputDirectory);

            Duration elapsed = Duration.between(start, clock.instant());
            LOGGER.info("Build finished: {} files written, {} digests recomputed, {} warnings",
                    written.size(), cache.recomputedCount(), diagnostics.count());
            return new BuildReport(plan.full(), plan.reason(), written, cache.recomputedCount(),
                    diagnostics.all(), elapsed);
        }
    }

    private void commit(ChecksumCache cache, BuildStateStore stateStore, Instant start) throws CommitFailureException {
        try {
            cache.commit();
        } catch (IOException ex) {
            throw new CommitFailureException("Failed to commit checksum cache " + cache.path(), ex);
        }
        try {
            stateStore.save(new BuildState(start));
        } catch (IOException ex) {
            throw new CommitFailureException("Failed to commit build marker " + stateStore.path(), ex);
        }
        LOGGER.info("Committed build marker {}", start);
    }

    private void applyPermissions(Path outputDirectory, List<String> written) {
        if (config.outputFilePermissions().isEmpty()) {
            return;
        }
        Set<PosixFilePermission> permissions = config.outputFilePermissions().get();
        for (String name : written) {
            Path file = OutputLayout.resolve(outputDirectory, name);
            try {
                Files.setPosixFilePermissions(file, permissions);
            } catch (UnsupportedOperationException ex) {
                LOGGER.info("Filesystem does not support POSIX permissions; leaving modes unchanged");
                return;
            } catch (IOException ex) {
                LOGGER.warn("Failed to set permissions on {}", file, ex);
            }
        }
    }

    private void notifyAndPublish(Path outputDirectory) {
        notifier.invalidateCachedUrls(List.of(addressing.absolute(addressing.outputUrl(OutputLayout.MANIFEST))));
        if (config.triggerSearchReindex()) {
            notifier.requestSearchReindex();
        }
        publisher.enqueue(OutputLayout.resolve(outputDirectory, OutputLayout.MANIFEST));
        publisher.enqueue(OutputLayout.resolve(outputDirectory, OutputLayout.FEED));
    }
}
