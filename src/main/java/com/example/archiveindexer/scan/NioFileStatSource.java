package com.example.archiveindexer.scan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class NioFileStatSource implements FileStatSource {
    private static final LinkOption[] NO_FOLLOW = {LinkOption.NOFOLLOW_LINKS};
    private static final LinkOption[] FOLLOW = {};

    @Override
    public FileStat stat(Path path) throws IOException {
        return read(path, NO_FOLLOW);
    }

    @Override
    public FileStat statTarget(Path path) throws IOException {
        return read(path, FOLLOW);
    }

    @Override
    public Path readLink(Path path) throws IOException {
        return Files.readSymbolicLink(path);
    }

    @Override
    public List<Path> list(Path directory) throws IOException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        }
        entries.sort(Comparator.comparing(entry -> entry.getFileName().toString()));
        return entries;
    }

    @Override
    public InputStream open(Path path) throws IOException {
        return Files.newInputStream(path);
    }

    private FileStat read(Path path, LinkOption[] options) throws IOException {
        BasicFileAttributes attrs;
        boolean worldReadable = true;
        try {
            PosixFileAttributes posix = Files.readAttributes(path, PosixFileAttributes.class, options);
            worldReadable = posix.isSymbolicLink() || posix.permissions().contains(PosixFilePermission.OTHERS_READ);
            attrs = posix;
        } catch (UnsupportedOperationException ex) {
            attrs = Files.readAttributes(path, BasicFileAttributes.class, options);
        }
        return new FileStat(kindOf(attrs), attrs.size(), attrs.lastModifiedTime().toInstant(), worldReadable);
    }

    private static FileKind kindOf(BasicFileAttributes attrs) {
        if (attrs.isSymbolicLink()) {
            return FileKind.SYMLINK;
        }
        if (attrs.isDirectory()) {
            return FileKind.DIRECTORY;
        }
        if (attrs.isRegularFile()) {
            return FileKind.FILE;
        }
        return FileKind.OTHER;
    }
}
