package com.example.archiveindexer.render;

import io.pebbletemplates.pebble.extension.Filter;
import io.pebbletemplates.pebble.extension.escaper.SafeString;
import io.pebbletemplates.pebble.template.EvaluationContext;
import io.pebbletemplates.pebble.template.PebbleTemplate;

import java.util.List;
import java.util.Map;

/**
 * Wraps raw text in a CDATA section so descriptions reach XML readers unmodified.
 */
final class CdataFilter implements Filter {
    static final String NAME = "cdata";

    @Override
    public List<String> getArgumentNames() {
        return null;
    }

    @Override
    public Object apply(Object input, Map<String, Object> args, PebbleTemplate self,
                        EvaluationContext context, int lineNumber) {
        String text = input == null ? "" : input.toString();
        return new SafeString(wrap(text));
    }

    static String wrap(String text) {
        StringBuilder builder = new StringBuilder(text.length() + 16);
        text.codePoints()
                .filter(XmlEscapingStrategy::isXmlChar)
                .forEach(builder::appendCodePoint);
        return "<![CDATA[" + builder.toString().replace("]]>", "]]]]><![CDATA[>") + "]]>";
    }
}
