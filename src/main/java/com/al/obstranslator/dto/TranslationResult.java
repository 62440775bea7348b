package com.al.obstranslator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translated attributes of one header, supporting partial success: fields
 * that failed are listed in errors and absent from attributes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationResult {

    /**
     * Attribute values keyed by field config key, in vocabulary order
     */
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @Builder.Default
    private List<TranslationError> errors = new ArrayList<>();

    /**
     * Header keys consulted during translation
     */
    @Builder.Default
    private Set<String> usedKeys = new LinkedHashSet<>();

    /**
     * Header keys read directly by each field
     */
    @Builder.Default
    private Map<String, Set<String>> provenance = new LinkedHashMap<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public boolean isFullSuccess() {
        return !hasErrors();
    }
}
