package com.example.archiveindexer.notify;

import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mirrors generated files into an S3 bucket from a single background worker. Keys follow
 * each file's location under the output directory, below an optional prefix. A path queued
 * again before its upload starts is sent once.
 */
public final class S3ArtifactPublisher implements ArtifactPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactPublisher.class);
    static final String CACHE_CONTROL = "public, max-age=300";

    private final BlockingQueue<Upload> queue = new LinkedBlockingQueue<>();
    private final Set<Path> queued = ConcurrentHashMap.newKeySet();
    private final AtomicInteger published = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final S3Client s3Client;
    private final Path outputDirectory;
    private final String bucket;
    private final String prefix;
    private final Tika tika = new Tika();
    private final Thread worker;
    private volatile boolean closed;

    public S3ArtifactPublisher(Path outputDirectory, String bucket, String prefix, Optional<String> region) {
        this(outputDirectory, bucket, prefix, region
                .map(Region::of)
                .map(r -> S3Client.builder().region(r).build())
                .orElseGet(() -> S3Client.builder().build()));
    }

    S3ArtifactPublisher(Path outputDirectory, String bucket, String prefix, S3Client s3Client) {
        this.outputDirectory = outputDirectory.toAbsolutePath().normalize();
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix.replaceAll("^/+|/+$", "");
        this.s3Client = s3Client;
        this.worker = new Thread(this::drain, "s3-publish");
        this.worker.start();
    }

    @Override
    public void enqueue(Path path) {
        if (closed) {
            LOGGER.warn("Publisher already closed; not uploading {}", path);
            return;
        }
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(outputDirectory)) {
            LOGGER.warn("Not publishing {}: outside the output directory {}", path, outputDirectory);
            return;
        }
        if (queued.add(normalized)) {
            queue.offer(Upload.of(normalized));
        }
    }

    /**
     * Stops accepting work, waits for queued uploads and closes the S3 client.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(Upload.END);
        try {
            worker.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for pending S3 uploads", ex);
        } finally {
            s3Client.close();
        }
        LOGGER.info("Published {} files to s3://{}/{} ({} failed)", published.get(), bucket, prefix, failed.get());
    }

    int publishedCount() {
        return published.get();
    }

    int failedCount() {
        return failed.get();
    }

    private void drain() {
        try {
            Upload upload;
            while ((upload = queue.take()) != Upload.END) {
                queued.remove(upload.path());
                put(upload.path());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("S3 publish worker interrupted; {} uploads dropped", queue.size(), ex);
        }
    }

    private void put(Path path) {
        String key = keyFor(path);
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType(path))
                .cacheControl(CACHE_CONTROL)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromFile(path));
            published.incrementAndGet();
            LOGGER.debug("Uploaded {} as s3://{}/{}", path, bucket, key);
        } catch (RuntimeException ex) {
            failed.incrementAndGet();
            LOGGER.warn("Failed to upload {} to s3://{}/{}", path, bucket, key, ex);
        }
    }

    String keyFor(Path path) {
        String relative = outputDirectory.relativize(path.toAbsolutePath().normalize())
                .toString()
                .replace('\\', '/');
        return prefix.isEmpty() ? relative : prefix + "/" + relative;
    }

    // Generated pages are always UTF-8; say so for every textual type.
    String contentType(Path path) {
        String detected = tika.detect(path.getFileName().toString());
        if (detected.startsWith("text/") || detected.endsWith("xml")) {
            return detected + "; charset=utf-8";
        }
        return detected;
    }

    private record Upload(Path path) {
        private static final Upload END = new Upload(null);

        private static Upload of(Path path) {
            return new Upload(path);
        }
    }
}
