package com.al.obstranslator.dto;

import com.al.obstranslator.exception.TranslationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A field that could not be translated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationError {

    /**
     * Field being translated when the failure occurred (e.g. "observation-id")
     */
    private String field;

    /**
     * Innermost field that failed (e.g. "detector-num"), may equal field
     */
    private String failedField;

    /**
     * Error code for programmatic handling (MISSING_KEY, MALFORMED_VALUE, ...)
     */
    private String errorCode;

    /**
     * Header key involved, if any
     */
    private String headerKey;

    private String message;

    public static TranslationError from(String field, TranslationException e) {
        return TranslationError.builder()
                .field(field)
                .failedField(e.getField() != null ? e.getField().getConfigKey() : field)
                .errorCode(e.getErrorCode())
                .headerKey(e.getHeaderKey())
                .message(e.getMessage())
                .build();
    }
}
