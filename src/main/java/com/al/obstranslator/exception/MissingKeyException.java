package com.al.obstranslator.exception;

/**
 * A header card needed to resolve a field is absent from the record.
 */
public class MissingKeyException extends TranslationException {

    public MissingKeyException(String headerKey) {
        super("MISSING_KEY", headerKey, "Header key not found: " + headerKey);
    }
}
