package com.example.archiveindexer.document;

import com.example.archiveindexer.MalformedDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the composed description document into ordered {@link DocumentSection} records.
 * <p>
 * A directory block starts with its canonical path followed by a colon
 * ({@code if-archive/games:}). File blocks inside it start with {@code # name}, where
 * the name may be a nested sub-path ({@code # zcode/advent.z5}). Either heading may be
 * followed by {@code key: value} metadata lines and then free description text. Rule
 * lines ({@code -----}) separate blocks.
 */
public final class IndexDocumentParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(IndexDocumentParser.class);

    private static final Pattern RULE = Pattern.compile("^ *[-=+*]{3,}[-=+* ]*$");
    private static final Pattern META_START = Pattern.compile("^ {0,3}([A-Za-z0-9_-]+):(?:\\s+(.*))?$");
    private static final Pattern META_CONTINUATION = Pattern.compile("^ {4}\\s*(\\S.*)$");
    private static final int TAB_WIDTH = 8;

    private final String rootName;

    public IndexDocumentParser(String rootName) {
        this.rootName = rootName;
    }

    public List<DocumentSection> parse(Path document) throws IOException, MalformedDocumentException {
        try (BufferedReader reader = Files.newBufferedReader(document, StandardCharsets.UTF_8)) {
            List<DocumentSection> sections = parse(reader);
            LOGGER.info("Parsed {} sections from {}", sections.size(), document);
            return sections;
        }
    }

    public List<DocumentSection> parse(String text) throws MalformedDocumentException {
        try {
            return parse(new StringReader(text));
        } catch (IOException ex) {
            throw new IllegalStateException("StringReader failed", ex);
        }
    }

    public List<DocumentSection> parse(Reader source) throws IOException, MalformedDocumentException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<DocumentSection> sections = new ArrayList<>();
        Block directory = null;
        Block file = null;
        boolean afterRule = false;
        int lineNumber = 0;

        String raw;
        while ((raw = reader.readLine()) != null) {
            lineNumber++;
            String line = expandTabs(raw).stripTrailing();

            if (isDirectoryHeading(line)) {
                String path = line.substring(0, line.length() - 1);
                validateDirectoryPath(path, lineNumber);
                file = finish(file, sections);
                directory = finish(directory, sections);
                directory = new Block(SectionKind.DIRECTORY, lineNumber, path, "");
                afterRule = false;
                continue;
            }

            if (RULE.matcher(line).matches()) {
                file = finish(file, sections);
                afterRule = true;
                continue;
            }

            if (isFileHeading(line)) {
                if (directory == null) {
                    throw new MalformedDocumentException("File heading outside any directory section", lineNumber);
                }
                String name = fileName(line, lineNumber);
                file = finish(file, sections);
                file = new Block(SectionKind.FILE, lineNumber, directory.directory, name);
                afterRule = false;
                continue;
            }

            if (line.isBlank()) {
                Block current = file != null ? file : directory;
                if (current != null && !afterRule) {
                    current.blank();
                }
                continue;
            }

            if (directory == null) {
                throw new MalformedDocumentException("Text before the first directory heading", lineNumber);
            }
            if (afterRule) {
                throw new MalformedDocumentException("Text after a rule line outside any section", lineNumber);
            }
            (file != null ? file : directory).accept(line);
        }

        // Directory blocks finish after their file blocks; restore heading order.
        finish(file, sections);
        finish(directory, sections);
        sections.sort((a, b) -> Integer.compare(a.lineNumber(), b.lineNumber()));
        List<DocumentSection> ordered = new ArrayList<>(sections.size());
        for (int i = 0; i < sections.size(); i++) {
            DocumentSection section = sections.get(i);
            ordered.add(new DocumentSection(i, section.lineNumber(), section.kind(), section.directory(),
                    section.relativeName(), section.metadata(), section.description()));
        }
        return ordered;
    }

    private boolean isDirectoryHeading(String line) {
        if (!line.endsWith(":") || !line.startsWith(rootName)) {
            return false;
        }
        if (line.length() == rootName.length() + 1) {
            return true;
        }
        return line.charAt(rootName.length()) == '/';
    }

    private void validateDirectoryPath(String path, int lineNumber) throws MalformedDocumentException {
        String[] segments = path.split("/", -1);
        for (String segment : segments) {
            if (!validSegment(segment)) {
                throw new MalformedDocumentException("Unparsable directory heading: " + path, lineNumber);
            }
        }
    }

    private static boolean isFileHeading(String line) {
        if (line.isEmpty() || line.charAt(0) != '#') {
            return false;
        }
        return line.length() == 1 || line.charAt(1) != '#';
    }

    private static String fileName(String line, int lineNumber) throws MalformedDocumentException {
        String name = line.substring(1).strip();
        if (name.isEmpty()) {
            throw new MalformedDocumentException("File heading without a name", lineNumber);
        }
        if (name.startsWith("/")) {
            throw new MalformedDocumentException("File heading with an absolute path: " + name, lineNumber);
        }
        if (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
        }
        for (String segment : name.split("/", -1)) {
            if (!validSegment(segment)) {
                throw new MalformedDocumentException("Unparsable file heading: " + name, lineNumber);
            }
        }
        return name;
    }

    private static boolean validSegment(String segment) {
        return !segment.isEmpty() && !segment.equals(".") && !segment.equals("..");
    }

    private static Block finish(Block block, List<DocumentSection> sections) {
        if (block != null) {
            sections.add(block.toSection());
        }
        return null;
    }

    static String expandTabs(String value) {
        int pos = value.indexOf('\t');
        if (pos < 0) {
            return value;
        }
        StringBuilder builder = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\t') {
                int spaces = TAB_WIDTH - (builder.length() % TAB_WIDTH);
                builder.append(" ".repeat(spaces));
            } else {
                builder.append(ch);
            }
        }
        return builder.toString();
    }

    /**
     * Accumulates one heading's metadata and description lines.
     */
    private static final class Block {
        private final SectionKind kind;
        private final int lineNumber;
        private final String directory;
        private final String relativeName;
        private final MetadataBlock.Builder metadata = MetadataBlock.builder();
        private final List<String> descriptionLines = new ArrayList<>();
        private boolean inMetadata = true;
        private String currentKey;

        private Block(SectionKind kind, int lineNumber, String directory, String relativeName) {
            this.kind = kind;
            this.lineNumber = lineNumber;
            this.directory = directory;
            this.relativeName = relativeName;
        }

        void blank() {
            inMetadata = false;
            currentKey = null;
            descriptionLines.add("");
        }

        void accept(String line) {
            if (inMetadata) {
                Matcher start = META_START.matcher(line);
                if (start.matches()) {
                    currentKey = start.group(1);
                    String value = start.group(2);
                    if (value == null || value.isBlank()) {
                        metadata.declare(currentKey);
                    } else {
                        metadata.add(currentKey, value.strip());
                    }
                    return;
                }
                if (currentKey != null) {
                    Matcher continuation = META_CONTINUATION.matcher(line);
                    if (continuation.matches()) {
                        metadata.add(currentKey, continuation.group(1).strip());
                        return;
                    }
                }
                inMetadata = false;
                currentKey = null;
            }
            descriptionLines.add(line);
        }

        DocumentSection toSection() {
            int start = 0;
            int end = descriptionLines.size();
            while (start < end && descriptionLines.get(start).isBlank()) {
                start++;
            }
            while (end > start && descriptionLines.get(end - 1).isBlank()) {
                end--;
            }
            String description = String.join("\n", descriptionLines.subList(start, end));
            return new DocumentSection(-1, lineNumber, kind, directory, relativeName, metadata.build(), description);
        }
    }
}
