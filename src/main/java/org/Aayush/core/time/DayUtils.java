package org.Aayush.core.time;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Shared day-granular date helpers for slice and coverage logic.
 *
 * <p>All days are calendar dates without zone. Two textual forms are accepted on input:
 * ISO ({@code 2025-11-01}, optionally with a time suffix that is ignored) and the short UK form
 * ({@code 1-Nov-25}) used by stored slice files. Output is always ISO.</p>
 */
public final class DayUtils {

    // Two-digit years resolve into 2000..2099.
    private static final DateTimeFormatter UK_SHORT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 2000)
            .toFormatter(Locale.ENGLISH);

    private static final DateTimeFormatter UK_LONG = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-yyyy")
            .toFormatter(Locale.ENGLISH);

    /**
     * Prevents instantiation of this utility class.
     */
    private DayUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses one day in ISO or UK short form.
     *
     * @param text day text; surrounding whitespace is ignored.
     * @return parsed calendar day.
     * @throws IllegalArgumentException when the text is blank or in neither form.
     */
    public static LocalDate parseDay(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("day text must be non-blank");
        }
        String trimmed = text.trim();
        int timeSeparator = trimmed.indexOf('T');
        if (timeSeparator == 10) {
            trimmed = trimmed.substring(0, timeSeparator);
        }
        try {
            return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeException isoFailure) {
            try {
                return LocalDate.parse(trimmed, UK_LONG);
            } catch (DateTimeException longFailure) {
                try {
                    return LocalDate.parse(trimmed, UK_SHORT);
                } catch (DateTimeException shortFailure) {
                    throw new IllegalArgumentException("unrecognised day format: " + text, shortFailure);
                }
            }
        }
    }

    /**
     * Formats a day in ISO form.
     */
    public static String formatIso(LocalDate day) {
        return day.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /**
     * Formats a day in UK short form, for example {@code 1-Nov-25}.
     */
    public static String formatUk(LocalDate day) {
        return day.format(UK_SHORT);
    }

    /**
     * Converts a day to its epoch-day index.
     */
    public static int toEpochDay(LocalDate day) {
        return Math.toIntExact(day.toEpochDay());
    }

    /**
     * Converts an epoch-day index back to a day.
     */
    public static LocalDate fromEpochDay(int epochDay) {
        return LocalDate.ofEpochDay(epochDay);
    }

    /**
     * Returns inclusive day count between two days.
     *
     * @param start first day.
     * @param end last day; must not precede {@code start}.
     * @return number of days in {@code [start, end]}.
     */
    public static int inclusiveDayCount(LocalDate start, LocalDate end) {
        long days = ChronoUnit.DAYS.between(start, end);
        if (days < 0) {
            throw new IllegalArgumentException("end " + end + " precedes start " + start);
        }
        return Math.toIntExact(days + 1);
    }
}
