package com.example.archiveindexer.document;

public enum SectionKind {
    DIRECTORY,
    FILE
}
