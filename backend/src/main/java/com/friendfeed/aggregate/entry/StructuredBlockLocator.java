package com.friendfeed.aggregate.entry;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the JSON object declared inside a {@code ```json} fence of an issue body.
 */
public final class StructuredBlockLocator {
    private static final Pattern FENCED_BLOCK = Pattern.compile("```json\\s*\\{[\\s\\S]*?\\}\\s*```");
    private static final Pattern OBJECT_TEXT = Pattern.compile("\\{[\\s\\S]*\\}");

    private StructuredBlockLocator() {
    }

    /**
     * Returns the raw object text, braces included, of the first fenced block.
     */
    public static Optional<String> locate(String body) {
        if (body == null || body.isEmpty()) {
            return Optional.empty();
        }
        Matcher fence = FENCED_BLOCK.matcher(body);
        if (!fence.find()) {
            return Optional.empty();
        }
        Matcher object = OBJECT_TEXT.matcher(fence.group());
        if (!object.find()) {
            return Optional.empty();
        }
        return Optional.of(object.group());
    }

    public static String replaceFirst(String body, String target, String replacement) {
        int index = body.indexOf(target);
        if (index < 0) {
            return body;
        }
        return body.substring(0, index) + replacement + body.substring(index + target.length());
    }
}
