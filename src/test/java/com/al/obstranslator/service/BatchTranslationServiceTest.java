package com.al.obstranslator.service;

import com.al.obstranslator.config.TranslatorProperties;
import com.al.obstranslator.dto.BatchTranslationResponse;
import com.al.obstranslator.dto.TranslationError;
import com.al.obstranslator.dto.TranslationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class BatchTranslationServiceTest {

    @Mock
    private TranslationService translationService;

    private BatchTranslationService batchService;

    @BeforeEach
    public void setUp() {
        TranslatorProperties properties = new TranslatorProperties();
        properties.setBatchThreads(2);
        batchService = new BatchTranslationService(translationService, properties);
    }

    @AfterEach
    public void tearDown() {
        batchService.shutdown();
    }

    @Test
    public void testTranslateBatch_CountsOutcomesPerIndex() {
        Map<String, Object> good = Map.of("CAM-ID", "camA");
        Map<String, Object> partial = Map.of("CAM-ID", "camB");
        Map<String, Object> empty = Map.of();

        TranslationResult partialResult = new TranslationResult();
        partialResult.getErrors().add(TranslationError.builder().field("location").build());

        when(translationService.translate(good)).thenReturn(new TranslationResult());
        when(translationService.translate(partial)).thenReturn(partialResult);
        when(translationService.translate(empty))
                .thenThrow(new IllegalArgumentException("Header must contain at least one card"));

        BatchTranslationResponse response = batchService.translateBatch(List.of(good, partial, empty));

        assertEquals(3, response.getTotalHeaders());
        assertEquals(1, response.getSuccessCount());
        assertEquals(1, response.getPartialCount());
        assertEquals(1, response.getFailureCount());
        assertEquals(0, response.getResults().get(0).getIndex());
        assertEquals(1, response.getResults().get(1).getIndex());
        assertEquals(2, response.getFailures().get(0).getIndex());
        assertEquals("Header must contain at least one card", response.getFailures().get(0).getError());
    }
}
