package com.enterprise.querybuilder.param;

import com.enterprise.querybuilder.core.BoundValue;

import java.math.BigDecimal;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Renders encoded bind values as SQL literals. Used for debug output only:
 * the text it produces is never sent to a database.
 */
public final class SqlLiteralFormatter {

    private SqlLiteralFormatter() {}

    public static String format(BoundValue bound) {
        return format(bound.value());
    }

    /**
     * Like {@link #format(BoundValue)}, but a value of an unknown type (a
     * driver object passed through as a {@code BoundValue}) renders as its
     * quoted {@code toString()} instead of failing.
     */
    public static String formatLenient(BoundValue bound) {
        Object value = bound.value();
        if (value == null || isSupported(value)) {
            return format(value);
        }
        return quote(String.valueOf(value));
    }

    /**
     * Formats a value as an ANSI SQL literal. {@code null} renders as {@code NULL}.
     *
     * @throws IllegalArgumentException if the type is not supported
     */
    public static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof LocalDate ld) {
            return "DATE '" + ld + "'";
        }
        if (value instanceof LocalTime lt) {
            return "TIME '" + lt + "'";
        }
        if (value instanceof LocalDateTime ldt) {
            return "TIMESTAMP '" + ldt.toString().replace('T', ' ') + "'";
        }
        if (value instanceof OffsetDateTime odt) {
            return "TIMESTAMP WITH TIME ZONE '" + odt.toString().replace('T', ' ') + "'";
        }
        if (value instanceof UUID u) {
            return quote(u.toString());
        }
        if (value instanceof byte[] bytes) {
            return "X'" + HexFormat.of().withUpperCase().formatHex(bytes) + "'";
        }
        if (value instanceof Timestamp ts) {
            return "TIMESTAMP '" + ts + "'";
        }
        if (value instanceof java.sql.Date d) {
            return "DATE '" + d + "'";
        }
        if (value instanceof Time t) {
            return "TIME '" + t + "'";
        }

        throw new IllegalArgumentException(
                "Unsupported literal type: " + value.getClass().getName());
    }

    private static boolean isSupported(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean
                || value instanceof LocalDate || value instanceof LocalTime
                || value instanceof LocalDateTime || value instanceof OffsetDateTime
                || value instanceof UUID || value instanceof byte[]
                || value instanceof Timestamp || value instanceof java.sql.Date
                || value instanceof Time;
    }

    private static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
