package com.example.archiveindexer.render;

import com.example.archiveindexer.model.DirectoryNode;
import com.example.archiveindexer.model.FileEntry;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Turns archive paths into link targets, anchor ids and display text.
 * <p>
 * Link targets are percent-encoded per segment. Anchor ids are derived from a digest of
 * the name so any name yields a valid, stable id. Break hints only ever appear in
 * display text.
 */
public final class Addressing {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final int ANCHOR_LENGTH = 10;
    private static final int BREAK_THRESHOLD = 20;
    private static final String BREAK_HINT = "<wbr>";

    private final String siteUrl;
    private final String archiveBaseUrl;
    private final String indexBaseUrl;

    /**
     * @param siteUrl        scheme and host, used to make relative links absolute
     * @param archiveBaseUrl prefix under which archive files are served
     * @param indexBaseUrl   prefix under which the generated pages are served
     */
    public Addressing(String siteUrl, String archiveBaseUrl, String indexBaseUrl) {
        this.siteUrl = stripTrailingSlash(siteUrl);
        this.archiveBaseUrl = withTrailingSlash(archiveBaseUrl);
        this.indexBaseUrl = withTrailingSlash(indexBaseUrl);
    }

    public String fileUrl(String path) {
        return archiveBaseUrl + encodePath(path);
    }

    public String directoryUrl(String directoryPath) {
        return indexBaseUrl + encodePath(directoryPath) + "/";
    }

    public String directoryUrl(DirectoryNode directory) {
        return directoryUrl(directory.path());
    }

    /**
     * Link to an entry's row on its directory page.
     */
    public String entryUrl(FileEntry entry) {
        return directoryUrl(entry.directory()) + "#" + anchorId(entry.name());
    }

    /**
     * URL of a generated file given its name relative to the output directory.
     */
    public String outputUrl(String relativeName) {
        return indexBaseUrl + encodePath(relativeName);
    }

    public String absolute(String url) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        return siteUrl + (url.startsWith("/") ? url : "/" + url);
    }

    public static String encodePath(String path) {
        StringBuilder builder = new StringBuilder(path.length() + 16);
        int start = 0;
        while (true) {
            int slash = path.indexOf('/', start);
            String segment = slash < 0 ? path.substring(start) : path.substring(start, slash);
            appendEncoded(builder, segment);
            if (slash < 0) {
                return builder.toString();
            }
            builder.append('/');
            start = slash + 1;
        }
    }

    public static String encodeSegment(String segment) {
        StringBuilder builder = new StringBuilder(segment.length() + 16);
        appendEncoded(builder, segment);
        return builder.toString();
    }

    private static void appendEncoded(StringBuilder builder, String segment) {
        for (byte b : segment.getBytes(StandardCharsets.UTF_8)) {
            int ch = b & 0xFF;
            if (isUnreserved(ch)) {
                builder.append((char) ch);
            } else {
                builder.append('%').append(HEX[ch >> 4]).append(HEX[ch & 0x0F]);
            }
        }
    }

    private static boolean isUnreserved(int ch) {
        return (ch >= 'A' && ch <= 'Z')
                || (ch >= 'a' && ch <= 'z')
                || (ch >= '0' && ch <= '9')
                || ch == '-' || ch == '.' || ch == '_' || ch == '~';
    }

    /**
     * In-page id for an entry name: {@code f} followed by ten base-36 digits of the
     * first 48 bits of its SHA-512.
     */
    public static String anchorId(String name) {
        byte[] digest = sha512(name.getBytes(StandardCharsets.UTF_8));
        byte[] prefix = new byte[6];
        System.arraycopy(digest, 0, prefix, 0, prefix.length);
        String base36 = new BigInteger(1, prefix).toString(36);
        return "f" + "0".repeat(ANCHOR_LENGTH - base36.length()) + base36;
    }

    /**
     * HTML-escaped name with break hints after separators when the name is long.
     */
    public static String displayName(String name) {
        if (name.length() <= BREAK_THRESHOLD) {
            return escapeHtml(name);
        }
        StringBuilder builder = new StringBuilder(name.length() + 32);
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            appendEscaped(builder, ch);
            if ((ch == '/' || ch == '.' || ch == '_' || ch == '-') && i < name.length() - 1) {
                builder.append(BREAK_HINT);
            }
        }
        return builder.toString();
    }

    public static String escapeHtml(String value) {
        StringBuilder builder = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            appendEscaped(builder, value.charAt(i));
        }
        return builder.toString();
    }

    private static void appendEscaped(StringBuilder builder, char ch) {
        switch (ch) {
            case '&' -> builder.append("&amp;");
            case '<' -> builder.append("&lt;");
            case '>' -> builder.append("&gt;");
            case '"' -> builder.append("&quot;");
            case '\'' -> builder.append("&#39;");
            default -> builder.append(ch);
        }
    }

    private static byte[] sha512(byte[] value) {
        try {
            return MessageDigest.getInstance("SHA-512").digest(value);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }

    private static String withTrailingSlash(String value) {
        return value.endsWith("/") ? value : value + "/";
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
