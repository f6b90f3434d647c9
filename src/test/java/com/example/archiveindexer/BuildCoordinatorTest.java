package com.example.archiveindexer;

import com.example.archiveindexer.notify.ArtifactPublisher;
import com.example.archiveindexer.notify.BuildNotifier;
import com.example.archiveindexer.render.Addressing;
import com.example.archiveindexer.scan.FileStatSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildCoordinatorTest {
    private static final String DOCUMENT = String.join("\n",
            "if-archive:",
            "The archive root.",
            "# README",
            "Read this first.",
            "# games/zcode/classic/advent.z5",
            "ifid: ADVENT-0001",
            "Root mention of the adventure.",
            "",
            "if-archive/games:",
            "# zcode/classic/advent.z5",
            "ifid: ADVENT-0001",
            "Games mention of the adventure.",
            "-----",
            "# advent-copy.z5",
            "ifid: ADVENT-0001",
            "A second copy.",
            "",
            "if-archive/games/zcode:",
            "# classic/advent.z5",
            "ifid: ADVENT-0001",
            "Zcode mention of the adventure.",
            "",
            "if-archive/games/zcode/classic:",
            "# advent.z5",
            "ifid: ADVENT-0001",
            "",
            "The adventure itself.",
            "");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.now().plus(Duration.ofHours(1)), ZoneOffset.UTC);
    private Path workspace;
    private Path output;
    private Path document;

    @BeforeEach
    void createArchive() throws Exception {
        workspace = Files.createTempDirectory("indexer");
        Path root = Files.createDirectories(workspace.resolve("tree/if-archive"));
        Path classic = Files.createDirectories(root.resolve("games/zcode/classic"));
        Files.writeString(root.resolve("README"), "Welcome.");
        Files.writeString(root.resolve("games/advent-copy.z5"), "xyzzy");
        Files.writeString(classic.resolve("advent.z5"), "xyzzy");
        document = workspace.resolve("Master-Index");
        Files.writeString(document, DOCUMENT);
        output = workspace.resolve("out");
    }

    private IndexerConfig config(Map<String, Object> overrides) throws Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("treeDirectory", workspace.resolve("tree").toString());
        values.put("documentPath", document.toString());
        values.put("outputDirectory", output.toString());
        values.put("threadCount", 2);
        values.put("siteUrl", "https://example.org");
        values.put("indexBaseUrl", "/indexes/");
        values.putAll(overrides);
        Path file = workspace.resolve("config.json");
        mapper.writeValue(file.toFile(), values);
        return new ConfigLoader().load(file);
    }

    private BuildReport build(IndexerConfig config) throws Exception {
        return build(config, clock);
    }

    private BuildReport build(IndexerConfig config, Clock at) throws Exception {
        return new BuildCoordinator(config, FileStatSource.system(), at,
                BuildNotifier.noop(), ArtifactPublisher.noop()).run();
    }

    private Map<String, byte[]> snapshot() throws Exception {
        Map<String, byte[]> files = new TreeMap<>();
        if (!Files.exists(output)) {
            return files;
        }
        try (Stream<Path> walk = Files.walk(output)) {
            for (Path path : walk.filter(Files::isRegularFile).toList()) {
                String name = output.relativize(path).toString();
                if (!name.endsWith("build.lock")) {
                    files.put(name, Files.readAllBytes(path));
                }
            }
        }
        return files;
    }

    private static void assertSameFiles(Map<String, byte[]> expected, Map<String, byte[]> actual) {
        assertEquals(expected.keySet(), actual.keySet());
        for (Map.Entry<String, byte[]> entry : expected.entrySet()) {
            assertArrayEquals(entry.getValue(), actual.get(entry.getKey()), entry.getKey());
        }
    }

    @Test
    void buildsEveryOutputOnFirstRun() throws Exception {
        BuildReport report = build(config(Map.of()));

        assertTrue(report.full());
        assertEquals("no build marker", report.reason());
        assertEquals(3, report.digestsRecomputed());
        assertTrue(report.warnings().isEmpty(), () -> report.warnings().toString());
        assertTrue(Files.exists(output.resolve("if-archive/games/zcode/index.html")));
        assertTrue(Files.exists(output.resolve("date_4.html")));
        assertTrue(Files.exists(output.resolve(".indexer/checksums.json")));
        assertTrue(Files.exists(output.resolve(".indexer/build-marker.json")));
        assertFalse(Files.exists(output.resolve(".indexer/build.lock")));
    }

    @Test
    void nestedMentionsInheritInDepthOrder() throws Exception {
        build(config(Map.of()));

        String page = Files.readString(output.resolve("if-archive/games/zcode/classic/index.html"));
        int own = page.indexOf("The adventure itself.");
        int fromRoot = page.indexOf("Root mention of the adventure.");
        int fromGames = page.indexOf("Games mention of the adventure.");
        int fromZcode = page.indexOf("Zcode mention of the adventure.");
        assertTrue(own >= 0 && fromRoot > own && fromGames > fromRoot && fromZcode > fromGames);
        assertEquals(1, occurrences(page, "id=\"" + Addressing.anchorId("advent.z5") + "\""));
        assertEquals(3, occurrences(page, "<li>From <a href="));
        assertEquals(1, occurrences(page, "<li>ifid: ADVENT-0001</li>"));
        assertEquals(1, occurrences(page, "class=\"aliases\""));
        assertTrue(page.contains("href=\"/indexes/if-archive/games/#" + Addressing.anchorId("advent-copy.z5") + "\""));

        String manifest = Files.readString(output.resolve("Master-Index.xml"));
        assertEquals(1, occurrences(manifest, "<path>if-archive/games/zcode/classic/advent.z5</path>"));
        assertEquals(3, occurrences(manifest, "<inherited from="));
        assertTrue(manifest.indexOf("<inherited from=\"if-archive\" ") < manifest.indexOf("<inherited from=\"if-archive/games\" "));
        assertTrue(manifest.indexOf("<inherited from=\"if-archive/games\" ") < manifest.indexOf("<inherited from=\"if-archive/games/zcode\" "));
        assertEquals(2, occurrences(manifest, "<identifier>ifid:ADVENT-0001</identifier>"));
        assertEquals(2, occurrences(manifest, "<metadata key=\"ifid\">ADVENT-0001</metadata>"));
        assertTrue(manifest.contains("<md5>" + md5Of("xyzzy") + "</md5>"));
    }

    @Test
    void uploadOfMentionedFileRegeneratesDeclaringPage() throws Exception {
        Files.writeString(document, DOCUMENT.replace("Read this first.\n",
                "Read this first.\n# games/zcode/new.z5\nArriving soon.\n"));
        IndexerConfig config = config(Map.of());
        build(config);
        Path rootPage = output.resolve("if-archive/index.html");
        assertFalse(Files.readString(rootPage).contains("Arriving soon."));

        // The upload keeps the file's original time; only its directory moves.
        Path zcode = workspace.resolve("tree/if-archive/games/zcode");
        Path uploaded = Files.writeString(zcode.resolve("new.z5"), "frotz");
        Files.setLastModifiedTime(uploaded, FileTime.from(Instant.parse("2001-01-01T00:00:00Z")));
        Files.setLastModifiedTime(zcode, FileTime.from(clock.instant().plus(Duration.ofMinutes(1))));
        BuildReport second = build(config, Clock.offset(clock, Duration.ofHours(1)));

        assertFalse(second.full());
        assertTrue(second.written().contains("if-archive/index.html"), () -> second.written().toString());
        assertTrue(Files.readString(rootPage).contains("Arriving soon."));
        assertTrue(Files.readString(output.resolve("if-archive/games/index.html")).contains("Arriving soon."));
    }

    @Test
    void unchangedTreeReusesDigestsAndPages() throws Exception {
        IndexerConfig config = config(Map.of());
        build(config);

        BuildReport second = build(config);

        assertFalse(second.full());
        assertEquals(0, second.digestsRecomputed());
        assertEquals(List.of("dirlist.html", "Master-Index.xml", "feed.xml"), second.written());
    }

    @Test
    void fullAndMarkerlessRebuildsAreIdentical() throws Exception {
        IndexerConfig config = config(Map.of());
        build(config);
        Map<String, byte[]> first = snapshot();

        BuildReport forced = build(config.withInvocation(true, false));
        assertTrue(forced.full());
        assertSameFiles(first, snapshot());

        Files.delete(output.resolve(".indexer/build-marker.json"));
        BuildReport markerless = build(config);
        assertTrue(markerless.full());
        assertSameFiles(first, snapshot());
    }

    @Test
    void heldLockChangesNothing() throws Exception {
        IndexerConfig config = config(Map.of());
        build(config);
        Map<String, byte[]> before = snapshot();
        Files.writeString(config.lockFile(), "held by another build");

        LockHeldException ex = assertThrows(LockHeldException.class, () -> build(config));

        assertEquals(config.lockFile(), ex.lockFile());
        assertSameFiles(before, snapshot());
        assertTrue(Files.exists(config.lockFile()));
    }

    @Test
    void malformedDocumentChangesNothing() throws Exception {
        IndexerConfig config = config(Map.of());
        build(config);
        Map<String, byte[]> before = snapshot();
        Files.writeString(document, "# orphan.z5\nNo directory heading above.\n");

        MalformedDocumentException ex = assertThrows(MalformedDocumentException.class, () -> build(config));

        assertEquals(1, ex.lineNumber());
        assertSameFiles(before, snapshot());
        assertFalse(Files.exists(config.lockFile()));
    }

    @Test
    void failedCacheCommitLeavesMarkerUnwritten() throws Exception {
        Path blocker = Files.writeString(workspace.resolve("blocker"), "not a directory");
        IndexerConfig config = config(Map.of("checksumCacheFile", blocker.resolve("checksums.json").toString()));

        assertThrows(CommitFailureException.class, () -> build(config));

        assertFalse(Files.exists(config.buildMarkerFile()));
        assertFalse(Files.exists(config.lockFile()));
    }

    @Test
    void notifiesAndPublishesAfterCommit() throws Exception {
        List<String> purged = new ArrayList<>();
        List<Path> published = new ArrayList<>();
        int[] reindexed = {0};
        BuildNotifier notifier = new BuildNotifier() {
            @Override
            public void requestSearchReindex() {
                reindexed[0]++;
            }

            @Override
            public void invalidateCachedUrls(List<String> urls) {
                purged.addAll(urls);
            }
        };
        IndexerConfig config = config(Map.of("outputFilePermissions", "rw-r-----")).withInvocation(false, true);

        new BuildCoordinator(config, FileStatSource.system(), clock, notifier, published::add).run();

        assertEquals(List.of("https://example.org/indexes/Master-Index.xml"), purged);
        assertEquals(1, reindexed[0]);
        assertEquals(List.of(output.resolve("Master-Index.xml"), output.resolve("feed.xml")), published);
        assertEquals(PosixFilePermissions.fromString("rw-r-----"),
                Files.getPosixFilePermissions(output.resolve("if-archive/index.html")));
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int at = text.indexOf(needle); at >= 0; at = text.indexOf(needle, at + 1)) {
            count++;
        }
        return count;
    }

    private static String md5Of(String text) throws Exception {
        byte[] digest = java.security.MessageDigest.getInstance("MD5").digest(text.getBytes(java.nio.charset.StandardCharsets.UTF_8));
        return java.util.HexFormat.of().formatHex(digest);
    }
}
