package com.al.obstranslator.service;

import com.al.obstranslator.dto.TranslationResult;
import com.al.obstranslator.model.HeaderRecord;
import com.al.obstranslator.translator.FieldResolutionTable;
import com.al.obstranslator.translator.ObservationTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Entry point for translating header records.
 */
@Service
@Slf4j
public class TranslationService {

    private final FieldResolutionTable resolutionTable;
    private final MeterRegistry meterRegistry;

    @Autowired
    public TranslationService(FieldResolutionTable resolutionTable, MeterRegistry meterRegistry) {
        this.resolutionTable = resolutionTable;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Translator for callers that only need some fields.
     */
    public ObservationTranslator newTranslator(HeaderRecord header) {
        return new ObservationTranslator(header, resolutionTable);
    }

    /**
     * Translate every supported field of a header.
     *
     * @param header raw header cards
     * @return attributes plus per-field errors
     * @throws IllegalArgumentException if the header is empty or holds
     *                                  unsupported value types
     */
    public TranslationResult translate(Map<String, ?> header) {
        if (header == null || header.isEmpty()) {
            throw new IllegalArgumentException("Header must contain at least one card");
        }
        Timer.Sample sample = Timer.start(meterRegistry);

        HeaderRecord record = HeaderRecord.of(header);
        TranslationResult result = newTranslator(record).translateAll();

        String status = result.isFullSuccess() ? "success" : "partial";
        meterRegistry.counter("obs.translation.count", "status", status).increment();
        sample.stop(meterRegistry.timer("obs.translation.duration"));

        log.info("Translated header with {} cards: {} attributes, {} errors, {} keys used",
                record.size(), result.getAttributes().size(), result.getErrors().size(),
                result.getUsedKeys().size());
        return result;
    }
}
