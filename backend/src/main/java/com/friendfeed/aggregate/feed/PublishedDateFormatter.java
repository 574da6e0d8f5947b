package com.friendfeed.aggregate.feed;

import com.friendfeed.config.AggregatorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

/**
 * Parses the date strings feeds and stored posts carry, and renders instants with a dayjs-style
 * pattern such as {@code YYYY-MM-DD HH:mm:ss}.
 */
@Component
public class PublishedDateFormatter {
    private static final List<String> DAYJS_TOKENS = List.of(
        "YYYY", "MMMM", "dddd", "SSS", "YY", "MMM", "MM", "DD", "ddd", "dd", "HH", "hh", "mm", "ss", "ZZ",
        "M", "D", "d", "H", "h", "m", "s", "Z", "A", "a"
    );

    private static final DateTimeFormatter RFC_822_ZONE_NAME = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern("[EEE, ]d MMM yyyy HH:mm[:ss] z")
        .toFormatter(Locale.ENGLISH);
    private static final DateTimeFormatter RFC_822_OFFSET = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern("[EEE, ]d MMM yyyy HH:mm[:ss] [XX][X]")
        .toFormatter(Locale.ENGLISH);
    private static final DateTimeFormatter SPACED_LOCAL_DATE_TIME =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss][.SSS]", Locale.ROOT);
    private static final DateTimeFormatter SLASHED_DATE =
        DateTimeFormatter.ofPattern("yyyy/M/d[ H:mm[:ss]]", Locale.ROOT);

    private final DateTimeFormatter outputFormatter;
    private final ZoneId zone;

    @Autowired
    public PublishedDateFormatter(AggregatorProperties properties) {
        this(properties.getDateFormat(), ZoneId.of(properties.getTimeZone()));
    }

    public PublishedDateFormatter(String dayjsPattern, ZoneId zone) {
        this.outputFormatter = DateTimeFormatter.ofPattern(toJavaPattern(dayjsPattern), Locale.ENGLISH);
        this.zone = zone;
    }

    /**
     * Formats a raw feed date, or returns an empty string when it is missing or unparsable.
     */
    public String format(String raw) {
        Instant instant = parse(raw);
        return instant == null ? "" : format(instant);
    }

    public String format(Instant instant) {
        return outputFormatter.format(instant.atZone(zone));
    }

    public Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        Instant parsed = parseWith(outputFormatter, value);
        if (parsed != null) {
            return parsed;
        }
        for (DateTimeFormatter formatter : List.of(
            DateTimeFormatter.RFC_1123_DATE_TIME,
            RFC_822_OFFSET,
            RFC_822_ZONE_NAME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.ISO_INSTANT,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            SPACED_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE,
            SLASHED_DATE
        )) {
            parsed = parseWith(formatter, value);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private Instant parseWith(DateTimeFormatter formatter, String value) {
        try {
            TemporalAccessor temporal = formatter.parseBest(
                value,
                ZonedDateTime::from,
                OffsetDateTime::from,
                Instant::from,
                LocalDateTime::from,
                LocalDate::from
            );
            if (temporal instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            if (temporal instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            if (temporal instanceof Instant instant) {
                return instant;
            }
            if (temporal instanceof LocalDateTime local) {
                return local.atZone(zone).toInstant();
            }
            if (temporal instanceof LocalDate date) {
                return date.atStartOfDay(zone).toInstant();
            }
            return null;
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * Translates dayjs format tokens into a {@link DateTimeFormatter} pattern. Text in square
     * brackets is kept literally, as dayjs does.
     */
    public static String toJavaPattern(String dayjsPattern) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < dayjsPattern.length()) {
            char c = dayjsPattern.charAt(i);
            if (c == '[') {
                int close = dayjsPattern.indexOf(']', i + 1);
                if (close > i) {
                    appendLiteral(out, dayjsPattern.substring(i + 1, close));
                    i = close + 1;
                    continue;
                }
            }
            String token = tokenAt(dayjsPattern, i);
            if (token != null) {
                out.append(javaToken(token));
                i += token.length();
                continue;
            }
            appendLiteral(out, String.valueOf(c));
            i++;
        }
        return out.toString();
    }

    private static String tokenAt(String pattern, int offset) {
        for (String token : DAYJS_TOKENS) {
            if (pattern.startsWith(token, offset)) {
                return token;
            }
        }
        return null;
    }

    private static String javaToken(String token) {
        return switch (token) {
            case "YYYY" -> "yyyy";
            case "YY" -> "yy";
            case "DD" -> "dd";
            case "D" -> "d";
            case "dddd" -> "EEEE";
            case "ddd", "dd" -> "EEE";
            case "d" -> "e";
            case "ZZ" -> "XX";
            case "Z" -> "XXX";
            case "A", "a" -> "a";
            default -> token;
        };
    }

    private static void appendLiteral(StringBuilder out, String literal) {
        if (literal.isEmpty()) {
            return;
        }
        boolean needsQuoting = literal.chars().anyMatch(ch -> Character.isLetter(ch) || "'[]{}#".indexOf(ch) >= 0);
        if (!needsQuoting) {
            out.append(literal);
            return;
        }
        out.append('\'').append(literal.replace("'", "''")).append('\'');
    }
}
