package com.example.archiveindexer.plan;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The chronological listings. Each window page lists files whose modification time
 * plus the window length reaches {@code now}.
 */
public enum DateWindow {
    ALL("date.html", null, null),
    WEEK("date_1.html", Duration.ofDays(7), "week"),
    MONTH("date_2.html", Duration.ofDays(31), "month"),
    QUARTER("date_3.html", Duration.ofDays(93), "three months"),
    YEAR("date_4.html", Duration.ofDays(366), "year");

    private final String fileName;
    private final Duration length;
    private final String label;

    DateWindow(String fileName, Duration length, String label) {
        this.fileName = fileName;
        this.length = length;
        this.label = label;
    }

    public String fileName() {
        return fileName;
    }

    public Optional<Duration> length() {
        return Optional.ofNullable(length);
    }

    /**
     * Human label used in page titles; empty for the all-time listing.
     */
    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public boolean includes(Instant modified, Instant now) {
        return length == null || !modified.plus(length).isBefore(now);
    }
}
