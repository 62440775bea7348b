package com.al.obstranslator.exception;

import com.al.obstranslator.model.ObservationField;
import lombok.Getter;

/**
 * Base type for failures while resolving one observation field.
 *
 * <p>
 * The field is attached by the translator when the failure passes through it;
 * the first (innermost) field wins, so a failure in {@code detector-num} raised
 * while resolving {@code observation-id} still names {@code detector-num}.
 */
@Getter
public abstract class TranslationException extends RuntimeException {

    private final String errorCode;
    private final String headerKey;
    private ObservationField field;

    protected TranslationException(String errorCode, String headerKey, String message) {
        super(message);
        this.errorCode = errorCode;
        this.headerKey = headerKey;
    }

    protected TranslationException(String errorCode, String headerKey, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.headerKey = headerKey;
    }

    /**
     * Attach the failing field unless one is already set.
     */
    public TranslationException onField(ObservationField failedField) {
        if (this.field == null) {
            this.field = failedField;
        }
        return this;
    }
}
