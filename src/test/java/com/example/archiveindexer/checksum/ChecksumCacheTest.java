package com.example.archiveindexer.checksum;

import com.example.archiveindexer.scan.InMemoryFileStatSource;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChecksumCacheTest {
    private static final Path FILE = Path.of("/tree/if-archive/game.z5");
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void computesKnownDigests() throws Exception {
        Digests digests = new DigestCalculator().compute(new ByteArrayInputStream("abc".getBytes(StandardCharsets.UTF_8)));
        assertEquals("900150983cd24fb0d6963f7d28e17f72", digests.md5());
        assertTrue(digests.sha512().startsWith("ddaf35a193617aba"));
        assertEquals(128, digests.sha512().length());
    }

    @Test
    void recomputesOnlyWhenSizeOrTimeChanges() throws Exception {
        Path dir = Files.createTempDirectory("checksums");
        InMemoryFileStatSource source = new InMemoryFileStatSource().file(FILE, "zork", T0);

        ChecksumCache first = new ChecksumCache(dir.resolve("checksums.json"), source);
        first.load();
        Digests original = first.lookup("if-archive/game.z5", FILE);
        assertEquals(1, first.recomputedCount());
        first.commit();

        ChecksumCache second = new ChecksumCache(dir.resolve("checksums.json"), source);
        second.load();
        assertEquals(original, second.lookup("if-archive/game.z5", FILE));
        assertEquals(0, second.recomputedCount());
        assertEquals(1, source.openCount());

        // Same size, new time.
        source.file(FILE, "zorl", T0.plusSeconds(60));
        Digests changed = second.lookup("if-archive/game.z5", FILE);
        assertEquals(1, second.recomputedCount());
        assertFalse(original.md5().equals(changed.md5()));

        // Same time, new size.
        source.file(FILE, "zork2", T0.plusSeconds(60));
        second.lookup("if-archive/game.z5", FILE);
        assertEquals(2, second.recomputedCount());
    }

    @Test
    void unreadableCacheStartsCold() throws Exception {
        Path dir = Files.createTempDirectory("checksums");
        Path cacheFile = dir.resolve("checksums.json");
        Files.writeString(cacheFile, "{ not json");
        InMemoryFileStatSource source = new InMemoryFileStatSource().file(FILE, "zork", T0);

        ChecksumCache cache = new ChecksumCache(cacheFile, source);
        cache.load();
        cache.lookup("if-archive/game.z5", FILE);

        assertEquals(1, cache.recomputedCount());
    }

    @Test
    void commitKeepsOnlyRecordsSeenThisRunAndLeavesNoTempFile() throws Exception {
        Path dir = Files.createTempDirectory("checksums");
        Path cacheFile = dir.resolve("checksums.json");
        Path other = Path.of("/tree/if-archive/old.txt");
        InMemoryFileStatSource source = new InMemoryFileStatSource()
                .file(FILE, "zork", T0)
                .file(other, "old", T0);

        ChecksumCache first = new ChecksumCache(cacheFile, source);
        first.lookup("if-archive/game.z5", FILE);
        first.lookup("if-archive/old.txt", other);
        first.commit();

        ChecksumCache second = new ChecksumCache(cacheFile, source);
        second.load();
        second.lookup("if-archive/game.z5", FILE);
        second.commit();

        String json = Files.readString(cacheFile);
        assertTrue(json.contains("if-archive/game.z5"));
        assertFalse(json.contains("if-archive/old.txt"));
        try (var files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void vanishedFileRaisesIOException() {
        InMemoryFileStatSource source = new InMemoryFileStatSource();
        ChecksumCache cache = new ChecksumCache(Path.of("unused.json"), source);
        assertThrows(NoSuchFileException.class, () -> cache.lookup("if-archive/game.z5", FILE));
    }
}
