package com.gomflow.smartagent.fusion;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reads the timestamp formats payment apps print on their receipts.
 * Values without an offset are taken in the configured local zone.
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            pattern("yyyy-MM-dd HH:mm[:ss]"),
            pattern("MMM d, yyyy h:mm[:ss] a"),
            pattern("MMM d, yyyy, h:mm[:ss] a"),
            pattern("MMM d yyyy h:mm[:ss] a"),
            pattern("d MMM yyyy h:mm[:ss] a"),
            pattern("d MMM yyyy HH:mm[:ss]"),
            pattern("MM/dd/yyyy h:mm[:ss] a"),
            pattern("MM/dd/yyyy HH:mm[:ss]"),
            pattern("dd/MM/yyyy HH:mm[:ss]"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            pattern("MMM d, yyyy"),
            pattern("d MMM yyyy"),
            pattern("MM/dd/yyyy"));

    private TimestampParser() {
    }

    public static Optional<Instant> parse(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim().replaceAll("\\s+", " ");

        Optional<Instant> parsed = attempt(() -> OffsetDateTime.parse(value).toInstant());
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            if (parsed.isPresent()) {
                return parsed;
            }
            parsed = attempt(() -> LocalDateTime.parse(value, format).atZone(zone).toInstant());
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            if (parsed.isPresent()) {
                return parsed;
            }
            parsed = attempt(() -> LocalDate.parse(value, format).atStartOfDay(zone).toInstant());
        }
        return parsed;
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
