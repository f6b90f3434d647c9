package com.example.archiveindexer;

import com.example.archiveindexer.notify.ArtifactPublisher;
import com.example.archiveindexer.notify.BuildNotifier;
import com.example.archiveindexer.notify.HttpBuildNotifier;
import com.example.archiveindexer.notify.S3ArtifactPublisher;
import com.example.archiveindexer.scan.FileStatSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_LOCK_HELD = 3;
    private static final String USAGE = "Usage: java -jar archive-indexer.jar [--full] [--reindex] <config.json>";

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Path configPath = null;
        boolean full = false;
        boolean reindex = false;
        for (String arg : args) {
            switch (arg) {
                case "--full" -> full = true;
                case "--reindex" -> reindex = true;
                default -> {
                    if (arg.startsWith("-") || configPath != null) {
                        LOGGER.error(USAGE);
                        return EXIT_USAGE;
                    }
                    configPath = Path.of(arg);
                }
            }
        }
        if (configPath == null) {
            LOGGER.error(USAGE);
            return EXIT_USAGE;
        }

        IndexerConfig config;
        try {
            config = new ConfigLoader().load(configPath).withInvocation(full, reindex);
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.error("Cannot load configuration {}", configPath, ex);
            return EXIT_USAGE;
        }

        try (BuildNotifier notifier = createNotifier(config);
             ArtifactPublisher publisher = createPublisher(config)) {
            BuildReport report = new BuildCoordinator(config, FileStatSource.system(), Clock.systemUTC(),
                    notifier, publisher).run();
            LOGGER.info("{} build complete in {}s ({})", report.full() ? "Full" : "Incremental",
                    report.elapsed().toSeconds(), report.reason());
            return EXIT_OK;
        } catch (LockHeldException ex) {
            LOGGER.error(ex.getMessage());
            return EXIT_LOCK_HELD;
        } catch (MalformedDocumentException ex) {
            LOGGER.error("Description document {} is malformed: {}", config.documentPath(), ex.getMessage());
            return EXIT_FAILURE;
        } catch (IndexBuildException | IOException | RuntimeException ex) {
            LOGGER.error("Build failed", ex);
            return EXIT_FAILURE;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.error("Build interrupted", ex);
            return EXIT_FAILURE;
        }
    }

    private static BuildNotifier createNotifier(IndexerConfig config) {
        if (config.searchReindexUrl().isEmpty() && config.cacheInvalidationUrl().isEmpty()) {
            return BuildNotifier.noop();
        }
        return new HttpBuildNotifier(
                config.searchReindexUrl().orElse(null),
                config.cacheInvalidationUrl().orElse(null),
                config.notificationKeyHeader(),
                config.notificationKey().orElse(null),
                config.notificationTimeout());
    }

    private static ArtifactPublisher createPublisher(IndexerConfig config) {
        if (!config.s3PublishEnabled()) {
            return ArtifactPublisher.noop();
        }
        return new S3ArtifactPublisher(config.outputDirectory(), config.s3Bucket().orElseThrow(),
                config.s3Prefix().orElse(null), config.s3Region());
    }
}
