package com.example.archiveindexer;

/**
 * Base type for conditions that stop an index build outright.
 */
public class IndexBuildException extends Exception {
    public IndexBuildException(String message) {
        super(message);
    }

    public IndexBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
