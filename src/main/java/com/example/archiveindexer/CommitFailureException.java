package com.example.archiveindexer;

/**
 * Persisting the checksum cache or the build marker failed after pages were written.
 * The run counts as failed so the next run redoes the same window.
 */
public class CommitFailureException extends IndexBuildException {
    public CommitFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
