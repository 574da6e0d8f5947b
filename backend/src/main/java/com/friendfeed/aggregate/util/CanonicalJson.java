package com.friendfeed.aggregate.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Two-space indented JSON with {@code "key": value} spacing and one array element per line.
 */
public final class CanonicalJson {
    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    private CanonicalJson() {
    }

    public static ObjectWriter writer(ObjectMapper mapper) {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withSeparators(Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
                .withObjectEmptySeparator("")
                .withArrayEmptySeparator(""));
        printer.indentObjectsWith(INDENTER);
        printer.indentArraysWith(INDENTER);
        return mapper.writer(printer);
    }

    public static String write(ObjectMapper mapper, Object value) throws JsonProcessingException {
        return writer(mapper).writeValueAsString(value);
    }
}
