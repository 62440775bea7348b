package com.al.obstranslator.controller;

import com.al.obstranslator.dto.BatchTranslationRequest;
import com.al.obstranslator.dto.BatchTranslationResponse;
import com.al.obstranslator.dto.TranslationResult;
import com.al.obstranslator.service.BatchTranslationService;
import com.al.obstranslator.service.TranslationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/translate")
@Slf4j
@Tag(name = "Translation", description = "FITS header to observation attribute translation")
public class TranslationController {

    private final TranslationService translationService;
    private final BatchTranslationService batchTranslationService;

    @Autowired
    public TranslationController(TranslationService translationService,
            BatchTranslationService batchTranslationService) {
        this.translationService = translationService;
        this.batchTranslationService = batchTranslationService;
    }

    @Operation(summary = "Translate one header", description = "Translates a header (JSON object of cards) into standardized observation attributes. Fields that fail are reported in the errors list.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Header translated, possibly with field errors"),
            @ApiResponse(responseCode = "400", description = "Empty header or unsupported value types")
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TranslationResult> translate(
            @Parameter(description = "Header cards keyed by FITS keyword") @RequestBody Map<String, Object> header) {
        log.debug("Received header with {} cards", header.size());
        return ResponseEntity.ok(translationService.translate(header));
    }

    @Operation(summary = "Translate a batch of headers", description = "Translates up to 100 headers in parallel.")
    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchTranslationResponse> translateBatch(@Valid @RequestBody BatchTranslationRequest request) {
        return ResponseEntity.ok(batchTranslationService.translateBatch(request.getHeaders()));
    }
}
