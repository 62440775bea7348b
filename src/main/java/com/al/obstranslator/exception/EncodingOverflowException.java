package com.al.obstranslator.exception;

import lombok.Getter;

/**
 * An identifier component does not fit its fixed-width decimal slot.
 */
@Getter
public class EncodingOverflowException extends TranslationException {

    private final String component;

    public EncodingOverflowException(String component, String message) {
        super("ENCODING_OVERFLOW", null, message);
        this.component = component;
    }
}
