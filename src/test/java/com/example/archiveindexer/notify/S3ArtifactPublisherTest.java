package com.example.archiveindexer.notify;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class S3ArtifactPublisherTest {
    private static final class RecordingS3Client implements S3Client {
        private final List<PutObjectRequest> requests = new CopyOnWriteArrayList<>();
        private final String failingKey;
        private volatile boolean closed;

        private RecordingS3Client(String failingKey) {
            this.failingKey = failingKey;
        }

        @Override
        public PutObjectResponse putObject(PutObjectRequest request, RequestBody body) {
            if (request.key().equals(failingKey)) {
                throw S3Exception.builder().message("denied").statusCode(403).build();
            }
            requests.add(request);
            return PutObjectResponse.builder().build();
        }

        @Override
        public String serviceName() {
            return SERVICE_NAME;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void uploadsUnderPrefixWithTypedHeaders() throws Exception {
        Path output = Files.createTempDirectory("publish");
        Path manifest = Files.writeString(output.resolve("Master-Index.xml"), "<ifarchive/>");
        Path page = Files.createDirectories(output.resolve("if-archive")).resolve("index.html");
        Files.writeString(page, "<html></html>");
        RecordingS3Client client = new RecordingS3Client(null);

        S3ArtifactPublisher publisher = new S3ArtifactPublisher(output, "bucket", "/indexes/", client);
        publisher.enqueue(manifest);
        publisher.enqueue(page);
        publisher.close();

        assertEquals(2, publisher.publishedCount());
        assertTrue(client.closed);
        PutObjectRequest first = client.requests.get(0);
        assertEquals("bucket", first.bucket());
        assertEquals("indexes/Master-Index.xml", first.key());
        assertEquals("application/xml; charset=utf-8", first.contentType());
        assertEquals(S3ArtifactPublisher.CACHE_CONTROL, first.cacheControl());
        assertEquals("indexes/if-archive/index.html", client.requests.get(1).key());
        assertEquals("text/html; charset=utf-8", client.requests.get(1).contentType());
    }

    @Test
    void skipsPathsOutsideOutputAndAfterClose() throws Exception {
        Path output = Files.createTempDirectory("publish");
        Path elsewhere = Files.createTempFile("elsewhere", ".xml");
        RecordingS3Client client = new RecordingS3Client(null);

        S3ArtifactPublisher publisher = new S3ArtifactPublisher(output, "bucket", null, client);
        publisher.enqueue(elsewhere);
        publisher.close();
        publisher.enqueue(Files.writeString(output.resolve("feed.xml"), "<rss/>"));

        assertTrue(client.requests.isEmpty());
        assertEquals(0, publisher.publishedCount());
    }

    @Test
    void failedUploadIsCountedNotThrown() throws Exception {
        Path output = Files.createTempDirectory("publish");
        Path feed = Files.writeString(output.resolve("feed.xml"), "<rss/>");
        Path manifest = Files.writeString(output.resolve("Master-Index.xml"), "<ifarchive/>");
        RecordingS3Client client = new RecordingS3Client("feed.xml");

        S3ArtifactPublisher publisher = new S3ArtifactPublisher(output, "bucket", "", client);
        publisher.enqueue(feed);
        publisher.enqueue(manifest);
        publisher.close();

        assertEquals(1, publisher.failedCount());
        assertEquals(1, publisher.publishedCount());
        assertEquals("Master-Index.xml", client.requests.get(0).key());
    }
}
