package com.kotsin.ledger.layout;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Parses the date column of a ledger, trying a fixed ordered list of formats.
 */
public final class DateCells {

    public static final DateTimeFormatter WRITE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-M-d"),
            strict("uuuu/M/d"),
            strict("uuuu.M.d"));

    private static final DateTimeFormatter DATE_TIME_FORMAT = strict("uuuu-M-d H:m:s");

    private DateCells() {
    }

    public static Optional<LocalDate> parse(String text) {
        String value = text == null ? "" : text.strip();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, f));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return Optional.of(LocalDateTime.parse(value, DATE_TIME_FORMAT).toLocalDate());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return WRITE_FORMAT.format(date);
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
