package com.al.obstranslator.exception;

import lombok.Getter;

/**
 * A header card is present but its value cannot be read as the expected type.
 */
@Getter
public class MalformedValueException extends TranslationException {

    private final transient Object value;

    public MalformedValueException(String headerKey, Object value, String expected) {
        super("MALFORMED_VALUE", headerKey,
                String.format("Header key %s has value '%s', expected %s", headerKey, value, expected));
        this.value = value;
    }

    public MalformedValueException(String headerKey, Object value, String expected, Throwable cause) {
        super("MALFORMED_VALUE", headerKey,
                String.format("Header key %s has value '%s', expected %s", headerKey, value, expected), cause);
        this.value = value;
    }
}
