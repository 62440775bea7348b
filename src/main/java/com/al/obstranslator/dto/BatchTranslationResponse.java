package com.al.obstranslator.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for batch translation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchTranslationResponse {

    private int totalHeaders;

    /**
     * Headers translated without any field error
     */
    private int successCount;

    /**
     * Headers translated with at least one field error
     */
    private int partialCount;

    /**
     * Headers that could not be translated at all
     */
    private int failureCount;

    private List<ItemResult> results = new ArrayList<>();

    private List<ItemFailure> failures = new ArrayList<>();

    private long processingTimeMs;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemResult {
        /**
         * Index of the header in the batch (0-based)
         */
        private int index;
        private TranslationResult result;
        private long processingTimeMs;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemFailure {
        private int index;
        private String error;
    }
}
