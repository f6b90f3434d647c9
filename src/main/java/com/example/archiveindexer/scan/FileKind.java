package com.example.archiveindexer.scan;

public enum FileKind {
    FILE,
    DIRECTORY,
    SYMLINK,
    OTHER
}
