package com.example.archiveindexer.render;

import com.example.archiveindexer.AtomicFiles;
import com.example.archiveindexer.checksum.Digests;
import com.example.archiveindexer.document.MetadataBlock;
import com.example.archiveindexer.model.ArchiveModel;
import com.example.archiveindexer.model.ArchivePaths;
import com.example.archiveindexer.model.DirectoryNode;
import com.example.archiveindexer.model.FileEntry;
import com.example.archiveindexer.model.IdentifierCluster;
import com.example.archiveindexer.model.Mention;
import com.example.archiveindexer.plan.BuildPlan;
import com.example.archiveindexer.plan.DateWindow;
import com.example.archiveindexer.plan.OutputLayout;
import com.example.archiveindexer.render.PageViews.AliasView;
import com.example.archiveindexer.render.PageViews.Crumb;
import com.example.archiveindexer.render.PageViews.DirectoryView;
import com.example.archiveindexer.render.PageViews.EntryView;
import com.example.archiveindexer.render.PageViews.FeedItem;
import com.example.archiveindexer.render.PageViews.MentionView;
import com.example.archiveindexer.render.PageViews.MetadataView;
import com.example.archiveindexer.render.PageViews.NestedView;
import com.example.archiveindexer.render.PageViews.SubdirectoryView;
import com.example.archiveindexer.render.PageViews.WindowLink;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.extension.AbstractExtension;
import io.pebbletemplates.pebble.extension.Filter;
import io.pebbletemplates.pebble.loader.ClasspathLoader;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the resolved model through the Pebble templates under {@code templates/}.
 * Every file is written through {@link AtomicFiles}. Output depends only on the model,
 * the plan and the {@code now} passed in.
 */
public final class Renderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Renderer.class);

    private static final Comparator<FileEntry> NEWEST_FIRST = Comparator
            .comparing(FileEntry::modified, Comparator.reverseOrder())
            .thenComparing(entry -> entry.name().toLowerCase(Locale.ROOT))
            .thenComparing(entry -> entry.path().toLowerCase(Locale.ROOT));

    private final Addressing addressing;
    private final String rootName;
    private final int feedSize;
    private final DateTimeFormatter dateFormat;
    private final PebbleEngine engine;

    public Renderer(Addressing addressing, String rootName, int feedSize, ZoneId zone) {
        this.addressing = addressing;
        this.rootName = rootName;
        this.feedSize = feedSize;
        this.dateFormat = DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH).withZone(zone);
        this.engine = createEngine();
    }

    private static PebbleEngine createEngine() {
        ClasspathLoader loader = new ClasspathLoader(Renderer.class.getClassLoader());
        loader.setPrefix("templates");
        return new PebbleEngine.Builder()
                .loader(loader)
                .strictVariables(false)
                .addEscapingStrategy(XmlEscapingStrategy.NAME, new XmlEscapingStrategy())
                .extension(new AbstractExtension() {
                    @Override
                    public Map<String, Filter> getFilters() {
                        return Map.of(CdataFilter.NAME, new CdataFilter());
                    }
                })
                .build();
    }

    /**
     * Writes every output the plan names plus the directory map, manifest and feed.
     *
     * @return names of the files written, relative to {@code outputDirectory}
     */
    public List<String> render(ArchiveModel model, BuildPlan plan, Path outputDirectory, Instant now) throws IOException {
        List<String> written = new ArrayList<>();

        for (DirectoryNode directory : model.directories()) {
            if (plan.includesDirectory(directory.path())) {
                String name = OutputLayout.directoryPage(directory.path());
                write(outputDirectory, name, "directory.html", Map.of(
                        "rootName", rootName,
                        "feedUrl", addressing.outputUrl(OutputLayout.FEED),
                        "directory", directoryView(model, directory)));
                written.add(name);
            }
        }

        List<FileEntry> byDate = datedEntries(model);
        for (DateWindow window : DateWindow.values()) {
            if (plan.includesWindow(window)) {
                write(outputDirectory, window.fileName(), "datelist.html", dateListContext(window, byDate, now));
                written.add(window.fileName());
            }
        }

        write(outputDirectory, OutputLayout.DIRECTORY_MAP, "dirlist.html", Map.of(
                "rootName", rootName,
                "directories", directoryMap(model)));
        written.add(OutputLayout.DIRECTORY_MAP);

        write(outputDirectory, OutputLayout.MANIFEST, "manifest.xml", Map.of(
                "rootName", rootName,
                "directories", manifestDirectories(model)));
        written.add(OutputLayout.MANIFEST);

        write(outputDirectory, OutputLayout.FEED, "feed.xml", feedContext(byDate));
        written.add(OutputLayout.FEED);

        LOGGER.info("Rendered {} files into {}", written.size(), outputDirectory);
        return written;
    }

    private void write(Path outputDirectory, String name, String templateName, Map<String, Object> context) throws IOException {
        PebbleTemplate template = engine.getTemplate(templateName);
        StringWriter writer = new StringWriter();
        template.evaluate(writer, context, Locale.ENGLISH);
        AtomicFiles.write(OutputLayout.resolve(outputDirectory, name), writer.toString().getBytes(StandardCharsets.UTF_8));
        LOGGER.debug("Wrote {}", name);
    }

    private DirectoryView directoryView(ArchiveModel model, DirectoryNode directory) {
        List<Crumb> crumbs = new ArrayList<>();
        DirectoryNode current = directory.parent().orElse(null);
        while (current != null) {
            crumbs.add(0, new Crumb(current.name(), addressing.directoryUrl(current)));
            current = current.parent().orElse(null);
        }

        List<SubdirectoryView> subdirectories = new ArrayList<>();
        for (DirectoryNode child : directory.children()) {
            subdirectories.add(subdirectoryView(child, child.name()));
        }
        List<EntryView> files = new ArrayList<>();
        for (FileEntry entry : directory.files()) {
            files.add(entryView(entry));
        }
        List<NestedView> nested = new ArrayList<>();
        for (Mention mention : directory.nestedMentions()) {
            nested.add(new NestedView(mention.relativeName(), mention.targetPath(),
                    mentionTargetUrl(model, mention), mention.description()));
        }

        return new DirectoryView(
                directory.path(),
                directory.name(),
                Addressing.displayName(directory.path()),
                addressing.directoryUrl(directory),
                directory.parent().map(DirectoryNode::path).orElse(null),
                directory.parent().map(addressing::directoryUrl).orElse(null),
                crumbs,
                directory.description(),
                dateFormat.format(directory.modified()),
                directory.fileCount(),
                directory.subdirectoryCount(),
                metadataViews(directory.metadata()),
                mentionViews(directory.inherited()),
                nested,
                subdirectories,
                files);
    }

    /** Links the on-disk spelling of the target, which may differ from the document's in normalization. */
    private String mentionTargetUrl(ArchiveModel model, Mention mention) {
        String target = mention.targetPath();
        Optional<FileEntry> entry = model.file(target);
        if (entry.isPresent()) {
            return addressing.entryUrl(entry.get());
        }
        Optional<DirectoryNode> directory = model.directory(target);
        if (directory.isPresent()) {
            return addressing.directoryUrl(directory.get());
        }
        return addressing.directoryUrl(ArchivePaths.parent(target)) + "#" + Addressing.anchorId(ArchivePaths.name(target));
    }

    private SubdirectoryView subdirectoryView(DirectoryNode directory, String name) {
        return new SubdirectoryView(
                name,
                Addressing.displayName(name),
                directory.path(),
                addressing.directoryUrl(directory),
                directory.description(),
                directory.fileCount(),
                directory.subdirectoryCount(),
                dateFormat.format(directory.modified()));
    }

    private EntryView entryView(FileEntry entry) {
        Digests digests = entry.digests().orElse(null);
        String url;
        String description = entry.displayDescription();
        if (entry.isDirectoryLink()) {
            url = entry.linkedDirectory()
                    .map(addressing::directoryUrl)
                    .orElse(addressing.fileUrl(entry.path()));
            if (description.isBlank()) {
                description = "Symlink to " + Addressing.escapeHtml(entry.symlinkTarget().orElse(""));
            }
        } else {
            url = addressing.fileUrl(entry.path());
        }

        List<AliasView> aliases = new ArrayList<>();
        IdentifierCluster cluster = entry.cluster().orElse(null);
        if (cluster != null) {
            for (FileEntry alias : cluster.aliasesOf(entry)) {
                aliases.add(new AliasView(alias.path(), addressing.entryUrl(alias)));
            }
        }

        return new EntryView(
                entry.name(),
                Addressing.displayName(entry.name()),
                Addressing.anchorId(entry.name()),
                url,
                entry.path(),
                entry.directory().path(),
                addressing.directoryUrl(entry.directory()),
                entry.size(),
                entry.modified().getEpochSecond(),
                dateFormat.format(entry.modified()),
                digests == null ? null : digests.md5(),
                digests == null ? null : digests.sha512(),
                entry.contentType().orElse(null),
                description,
                entry.isSymlink(),
                entry.isDirectoryLink(),
                entry.symlinkTarget().orElse(null),
                cluster == null ? List.of() : List.copyOf(cluster.identifiers()),
                metadataViews(entry.resolvedMetadata()),
                mentionViews(entry.inherited()),
                aliases);
    }

    private List<MetadataView> metadataViews(MetadataBlock metadata) {
        List<MetadataView> views = new ArrayList<>();
        for (Map.Entry<String, List<String>> item : metadata.asMap().entrySet()) {
            views.add(new MetadataView(item.getKey(), item.getValue()));
        }
        return views;
    }

    private List<MentionView> mentionViews(List<Mention> mentions) {
        List<MentionView> views = new ArrayList<>(mentions.size());
        for (Mention mention : mentions) {
            views.add(new MentionView(mention.declaringDirectory(),
                    addressing.directoryUrl(mention.declaringDirectory()),
                    mention.relativeName(),
                    mention.description()));
        }
        return views;
    }

    private static List<FileEntry> datedEntries(ArchiveModel model) {
        List<FileEntry> entries = new ArrayList<>();
        for (FileEntry entry : model.files()) {
            if (!entry.isDirectoryLink()) {
                entries.add(entry);
            }
        }
        entries.sort(NEWEST_FIRST);
        return entries;
    }

    private Map<String, Object> dateListContext(DateWindow window, List<FileEntry> byDate, Instant now) {
        List<EntryView> entries = new ArrayList<>();
        for (FileEntry entry : byDate) {
            if (!window.includes(entry.modified(), now)) {
                break;
            }
            entries.add(entryView(entry));
        }
        List<WindowLink> windows = new ArrayList<>();
        for (DateWindow other : DateWindow.values()) {
            windows.add(new WindowLink(other.label().orElse("all"),
                    addressing.outputUrl(other.fileName()), other == window));
        }
        Map<String, Object> context = new HashMap<>();
        context.put("rootName", rootName);
        context.put("interval", window.label().orElse(null));
        context.put("windows", windows);
        context.put("entries", entries);
        return context;
    }

    private List<SubdirectoryView> directoryMap(ArchiveModel model) {
        List<SubdirectoryView> views = new ArrayList<>();
        for (DirectoryNode directory : model.directories()) {
            views.add(subdirectoryView(directory, directory.path()));
        }
        return views;
    }

    private List<DirectoryView> manifestDirectories(ArchiveModel model) {
        List<DirectoryView> views = new ArrayList<>();
        for (DirectoryNode directory : model.directories()) {
            views.add(directoryView(model, directory));
        }
        return views;
    }

    private Map<String, Object> feedContext(List<FileEntry> byDate) {
        List<FeedItem> items = new ArrayList<>();
        for (FileEntry entry : byDate.subList(0, Math.min(feedSize, byDate.size()))) {
            String link = addressing.absolute(addressing.fileUrl(entry.path()));
            items.add(new FeedItem(
                    entry.name(),
                    link,
                    link + "?t=" + entry.modified().getEpochSecond(),
                    rfc1123(entry.modified()),
                    entry.displayDescription(),
                    entry.directory().path()));
        }
        Map<String, Object> context = new HashMap<>();
        context.put("rootName", rootName);
        context.put("channelLink", addressing.absolute(addressing.outputUrl(OutputLayout.DIRECTORY_MAP)));
        context.put("feedLink", addressing.absolute(addressing.outputUrl(OutputLayout.FEED)));
        context.put("lastBuildDate", byDate.isEmpty() ? null : rfc1123(byDate.get(0).modified()));
        context.put("items", items);
        return context;
    }

    private static String rfc1123(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atZone(ZoneOffset.UTC));
    }
}
