package com.example.archiveindexer;

/**
 * Raised when the description document has a structural error. Nothing has been written
 * when this is thrown.
 */
public class MalformedDocumentException extends IndexBuildException {
    private final int lineNumber;

    public MalformedDocumentException(String message, int lineNumber) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
