package com.acled.client.core.exception;

/** A raw record field did not hold text in the format its typed counterpart requires. */
public class FieldParseException extends AcledException {
    private final String field;
    private final String rawValue;

    public FieldParseException(String field, String rawValue) {
        this(field, rawValue, null);
    }

    public FieldParseException(String field, String rawValue, Throwable cause) {
        super("API response could not be parsed: " + field, cause);
        this.field = field;
        this.rawValue = rawValue;
    }

    /** Wire name of the offending field, e.g. {@code event_date}. */
    public String field() {
        return field;
    }

    public String rawValue() {
        return rawValue;
    }
}
