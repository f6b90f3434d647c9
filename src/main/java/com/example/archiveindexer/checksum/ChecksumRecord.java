package com.example.archiveindexer.checksum;

/**
 * Persisted cache line: digests of {@code path} as it was at {@code size} bytes and
 * modification time {@code mtime} (epoch milliseconds).
 */
public record ChecksumRecord(
        String path,
        long size,
        long mtime,
        String md5,
        String sha512
) {
    public boolean matches(long liveSize, long liveMtime) {
        return size == liveSize && mtime == liveMtime;
    }

    public Digests digests() {
        return new Digests(md5, sha512);
    }
}
