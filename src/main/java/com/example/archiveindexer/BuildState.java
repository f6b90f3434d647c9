package com.example.archiveindexer;

import java.time.Instant;

/**
 * Persisted build marker: the start time of the last fully successful build.
 */
public record BuildState(Instant lastBuild) {
}
