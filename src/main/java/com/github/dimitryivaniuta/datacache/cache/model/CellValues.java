package com.github.dimitryivaniuta.datacache.cache.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Types a raw source cell. The result is always one of the value types {@link Row} documents.
 */
public final class CellValues {
    private CellValues() {}

    private static final Pattern INTEGRAL = Pattern.compile("^[-+]?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?$");

    /**
     * Raw CSV cell -> typed value. Blank is {@code null}.
     */
    public static Object infer(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim();

        if (INTEGRAL.matcher(s).matches()) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException overflow) {
                return finiteOrText(s);
            }
        }
        if (DECIMAL.matcher(s).matches()) {
            return finiteOrText(s);
        }
        return temporalOrText(s);
    }

    // out of double range (e.g. 1e400) stays text
    private static Object finiteOrText(String s) {
        double d = Double.parseDouble(s);
        return Double.isFinite(d) ? (Object) d : s;
    }

    /**
     * Strings in strict ISO date / date-time shape become {@link LocalDate} / {@link LocalDateTime};
     * anything else (including impossible dates such as 2015-02-30) stays text.
     */
    private static Object temporalOrText(String s) {
        if (ISO_DATE.matcher(s).matches()) {
            try {
                return LocalDate.parse(s);
            } catch (DateTimeParseException ignored) {
                return s;
            }
        }
        if (ISO_DATE_TIME.matcher(s).matches()) {
            try {
                return LocalDateTime.parse(s);
            } catch (DateTimeParseException ignored) {
                return s;
            }
        }
        return s;
    }
}
