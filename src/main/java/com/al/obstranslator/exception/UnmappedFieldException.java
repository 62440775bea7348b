package com.al.obstranslator.exception;

import com.al.obstranslator.model.ObservationField;

/**
 * No resolution strategy is configured for the requested field.
 */
public class UnmappedFieldException extends TranslationException {

    public UnmappedFieldException(ObservationField field) {
        super("UNMAPPED_FIELD", null, "No translation configured for field " + field.getConfigKey());
        onField(field);
    }
}
