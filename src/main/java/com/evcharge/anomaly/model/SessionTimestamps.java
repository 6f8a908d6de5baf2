package com.evcharge.anomaly.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Lenient parsing of session start/end cells and the canonical text form used in findings.
 *
 * Accepted inputs:
 *   2024-03-01T10:15[:30[.123]]        ISO local date-time
 *   2024-03-01T10:15:30Z / +05:30      ISO with offset, converted to UTC
 *   2024-03-01 10:15[:30[.123]]
 *   2024/03/01 10:15[:30]
 *   03/01/2024 10:15[:30]              month first
 *   03-01-2024 10:15[:30]              month first
 *   25/03/2024, 25-03-2024             day first, only when month first is impossible
 *   2024-03-01                         midnight
 */
public final class SessionTimestamps {

    public static final DateTimeFormatter CANONICAL = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            withTime("uuuu-MM-dd"),
            withTime("uuuu/MM/dd"),
            withTime("MM/dd/uuuu"),
            withTime("MM-dd-uuuu"),
            withTime("dd/MM/uuuu"),
            withTime("dd-MM-uuuu"));

    private SessionTimestamps() {}

    /**
     * @return the parsed local date-time, or null when the cell is blank or not a recognised timestamp
     */
    public static LocalDateTime parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String text = raw.trim();

        LocalDateTime parsed = attempt(() -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        if (parsed == null) {
            parsed = attempt(() -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime());
        }
        for (int i = 0; parsed == null && i < LOCAL_FORMATS.size(); i++) {
            DateTimeFormatter format = LOCAL_FORMATS.get(i);
            parsed = attempt(() -> LocalDateTime.parse(text, format));
        }
        if (parsed == null) {
            parsed = attempt(() -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay());
        }
        return parsed;
    }

    public static String format(LocalDateTime timestamp) {
        return timestamp == null ? null : CANONICAL.format(timestamp);
    }

    private static LocalDateTime attempt(Supplier<LocalDateTime> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static DateTimeFormatter withTime(String datePattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(datePattern)
                .appendLiteral(' ')
                .appendPattern("HH:mm")
                .optionalStart()
                .appendLiteral(':')
                .appendPattern("ss")
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                .optionalEnd()
                .optionalEnd()
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
