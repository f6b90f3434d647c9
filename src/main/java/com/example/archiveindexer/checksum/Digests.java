package com.example.archiveindexer.checksum;

/**
 * Hex-encoded MD5 and SHA-512 of one file's content.
 */
public record Digests(String md5, String sha512) {
}
