package com.example.archiveindexer.render;

import io.pebbletemplates.pebble.extension.escaper.EscapingStrategy;

/**
 * Entity-escapes markup characters and drops code points XML 1.0 does not allow.
 */
final class XmlEscapingStrategy implements EscapingStrategy {
    static final String NAME = "xml";

    @Override
    public String escape(String input) {
        if (input == null) {
            return null;
        }
        StringBuilder builder = new StringBuilder(input.length() + 16);
        input.codePoints().forEach(cp -> {
            switch (cp) {
                case '&' -> builder.append("&amp;");
                case '<' -> builder.append("&lt;");
                case '>' -> builder.append("&gt;");
                case '"' -> builder.append("&quot;");
                case '\'' -> builder.append("&apos;");
                default -> {
                    if (isXmlChar(cp)) {
                        builder.appendCodePoint(cp);
                    }
                }
            }
        });
        return builder.toString();
    }

    static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }
}
