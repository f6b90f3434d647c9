package com.example.archiveindexer.scan;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory tree for tests. Paths are normalized absolute paths.
 */
public final class InMemoryFileStatSource implements FileStatSource {
    private final Map<Path, Node> nodes = new HashMap<>();
    private final AtomicInteger opens = new AtomicInteger();

    private record Node(FileKind kind, byte[] content, Instant modified, Path linkTarget, boolean worldReadable) {
    }

    public InMemoryFileStatSource directory(Path path, Instant modified) {
        return directory(path, modified, true);
    }

    public InMemoryFileStatSource directory(Path path, Instant modified, boolean worldReadable) {
        nodes.put(path.normalize(), new Node(FileKind.DIRECTORY, null, modified, null, worldReadable));
        return this;
    }

    public InMemoryFileStatSource file(Path path, String content, Instant modified) {
        nodes.put(path.normalize(), new Node(FileKind.FILE, content.getBytes(), modified, null, true));
        return this;
    }

    public InMemoryFileStatSource symlink(Path path, Path target, Instant modified) {
        nodes.put(path.normalize(), new Node(FileKind.SYMLINK, null, modified, target, true));
        return this;
    }

    public InMemoryFileStatSource remove(Path path) {
        nodes.remove(path.normalize());
        return this;
    }

    public int openCount() {
        return opens.get();
    }

    @Override
    public FileStat stat(Path path) throws IOException {
        Node node = node(path);
        long size = node.content() == null ? 0 : node.content().length;
        return new FileStat(node.kind(), size, node.modified(), node.worldReadable());
    }

    @Override
    public FileStat statTarget(Path path) throws IOException {
        return stat(resolve(path));
    }

    @Override
    public Path readLink(Path path) throws IOException {
        Node node = node(path);
        if (node.kind() != FileKind.SYMLINK) {
            throw new IOException("Not a link: " + path);
        }
        return node.linkTarget();
    }

    @Override
    public List<Path> list(Path directory) throws IOException {
        Path normalized = directory.normalize();
        if (node(normalized).kind() != FileKind.DIRECTORY) {
            throw new IOException("Not a directory: " + directory);
        }
        List<Path> children = new ArrayList<>();
        for (Path candidate : nodes.keySet()) {
            if (normalized.equals(candidate.getParent())) {
                children.add(candidate);
            }
        }
        children.sort(Comparator.comparing(child -> child.getFileName().toString()));
        return children;
    }

    @Override
    public InputStream open(Path path) throws IOException {
        Node node = node(resolve(path));
        if (node.kind() != FileKind.FILE) {
            throw new IOException("Not a file: " + path);
        }
        opens.incrementAndGet();
        return new ByteArrayInputStream(node.content());
    }

    private Path resolve(Path path) throws IOException {
        Path current = path.normalize();
        for (int hop = 0; hop < 16; hop++) {
            Node node = node(current);
            if (node.kind() != FileKind.SYMLINK) {
                return current;
            }
            current = current.getParent().resolve(node.linkTarget()).normalize();
        }
        throw new IOException("Too many links: " + path);
    }

    private Node node(Path path) throws IOException {
        Node node = nodes.get(path.normalize());
        if (node == null) {
            throw new NoSuchFileException(path.toString());
        }
        return node;
    }
}
