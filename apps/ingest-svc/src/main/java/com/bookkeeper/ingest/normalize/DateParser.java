package com.bookkeeper.ingest.normalize;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tries a fixed list of date layouts seen in US bank exports, most specific first.
 */
public final class DateParser {

    static final List<String> DEFAULT_PATTERNS = List.of(
            "uuuu-MM-dd",
            "M/d/uuuu",
            "M/d/uu",
            "uuuu/M/d",
            "M-d-uuuu",
            "uuuuMMdd",
            "d MMM uuuu",
            "d-MMM-uuuu",
            "d-MMM-uu",
            "MMM d, uuuu",
            "MMM d uuuu",
            "MMMM d, uuuu"
    );

    private final List<DateTimeFormatter> formatters;

    private DateParser(List<DateTimeFormatter> formatters) {
        this.formatters = List.copyOf(formatters);
    }

    public static DateParser defaults() {
        return withExtraPatterns(List.of());
    }

    /**
     * Extra patterns are tried before the defaults.
     */
    public static DateParser withExtraPatterns(List<String> extraPatterns) {
        List<DateTimeFormatter> formatters = new ArrayList<>();
        for (String pattern : extraPatterns) {
            formatters.add(formatter(pattern));
        }
        for (String pattern : DEFAULT_PATTERNS) {
            formatters.add(formatter(pattern));
        }
        return new DateParser(formatters);
    }

    public Optional<LocalDate> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Optional<LocalDate> parsed = tryFormatters(value);
        if (parsed.isPresent()) {
            return parsed;
        }
        // timestamps such as 2024-01-05T10:22:00 or 01/05/2024 10:22 AM
        int cut = value.indexOf('T') > 0 ? value.indexOf('T') : value.indexOf(' ');
        if (cut > 0) {
            return tryFormatters(value.substring(0, cut));
        }
        return Optional.empty();
    }

    public boolean parses(String raw) {
        return parse(raw).isPresent();
    }

    private Optional<LocalDate> tryFormatters(String value) {
        for (DateTimeFormatter formatter : formatters) {
            try {
                return Optional.of(LocalDate.parse(value, formatter));
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
