package com.acled.client.core.endpoint;

import com.acled.client.core.exception.FieldParseException;
import com.acled.client.core.model.Region;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Strict parsers for the string-typed columns of raw records. Each failure names the wire field. */
final class FieldParsers {

    private FieldParsers() {}

    /** Free-text column; may be empty but must be present. */
    static String text(String field, String text) throws FieldParseException {
        if (text == null) throw new FieldParseException(field, null);
        return text;
    }

    /** {@code YYYY-MM-DD} only. */
    static LocalDate date(String field, String text) throws FieldParseException {
        if (text == null) throw new FieldParseException(field, null);
        try {
            return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new FieldParseException(field, text, e);
        }
    }

    /** Non-negative decimal integer, as used for Unix timestamps. */
    static long unsignedLong(String field, String text) throws FieldParseException {
        if (text == null || text.isEmpty() || text.charAt(0) == '-') {
            throw new FieldParseException(field, text);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new FieldParseException(field, text, e);
        }
    }

    /** Plain decimal or scientific notation; no surrounding whitespace, {@code NaN} or type suffixes. */
    static double decimal(String field, String text) throws FieldParseException {
        if (text == null) throw new FieldParseException(field, null);
        try {
            return new BigDecimal(text).doubleValue();
        } catch (NumberFormatException e) {
            throw new FieldParseException(field, text, e);
        }
    }

    static Region region(String field, String text) throws FieldParseException {
        return Region.fromName(text).orElseThrow(() -> new FieldParseException(field, text));
    }
}
