package com.al.obstranslator.service;

import com.al.obstranslator.config.TranslatorProperties;
import com.al.obstranslator.dto.BatchTranslationResponse;
import com.al.obstranslator.dto.BatchTranslationResponse.ItemFailure;
import com.al.obstranslator.dto.BatchTranslationResponse.ItemResult;
import com.al.obstranslator.dto.TranslationResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Translates many headers in parallel. Each header gets its own translator,
 * so no state is shared between worker threads.
 */
@Service
@Slf4j
public class BatchTranslationService {

    private final TranslationService translationService;
    private final ExecutorService executorService;

    @Autowired
    public BatchTranslationService(TranslationService translationService, TranslatorProperties properties) {
        this.translationService = translationService;
        int threadPoolSize = properties.getBatchThreads() > 0
                ? properties.getBatchThreads()
                : Math.max(4, Runtime.getRuntime().availableProcessors());
        this.executorService = Executors.newFixedThreadPool(threadPoolSize);
        log.info("BatchTranslationService initialized with {} threads", threadPoolSize);
    }

    /**
     * Translate a list of headers in parallel.
     *
     * @param headers raw headers, one per exposure
     * @return per-index results and failures; result order follows input order
     */
    public BatchTranslationResponse translateBatch(List<Map<String, Object>> headers) {
        long startTime = System.currentTimeMillis();
        log.info("Starting batch translation: {} headers", headers.size());

        List<CompletableFuture<ItemResult>> futures = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            final int index = i;
            final Map<String, Object> header = headers.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> {
                long itemStart = System.currentTimeMillis();
                TranslationResult result = translationService.translate(header);
                return new ItemResult(index, result, System.currentTimeMillis() - itemStart);
            }, executorService));
        }

        BatchTranslationResponse response = new BatchTranslationResponse();
        response.setTotalHeaders(headers.size());

        for (int i = 0; i < futures.size(); i++) {
            try {
                ItemResult item = futures.get(i).join();
                response.getResults().add(item);
                if (item.getResult().isFullSuccess()) {
                    response.setSuccessCount(response.getSuccessCount() + 1);
                } else {
                    response.setPartialCount(response.getPartialCount() + 1);
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Failed to translate header at index {}: {}", i, cause.getMessage());
                response.getFailures().add(new ItemFailure(i, cause.getMessage()));
                response.setFailureCount(response.getFailureCount() + 1);
            }
        }

        response.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        log.info("Batch translation completed: {} success, {} partial, {} failures, {}ms total",
                response.getSuccessCount(), response.getPartialCount(), response.getFailureCount(),
                response.getProcessingTimeMs());
        return response;
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }
}
