package com.al.obstranslator.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for batch header translation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchTranslationRequest {

    /**
     * Headers to translate, one map of cards per exposure.
     * Maximum 100 headers per batch.
     */
    @NotEmpty(message = "Headers list cannot be empty")
    @Size(min = 1, max = 100, message = "Batch size must be between 1 and 100 headers")
    private List<Map<String, Object>> headers;
}
