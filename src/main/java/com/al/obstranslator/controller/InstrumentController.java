package com.al.obstranslator.controller;

import com.al.obstranslator.device.FilterDefinition;
import com.al.obstranslator.dto.InstrumentDescription;
import com.al.obstranslator.service.InstrumentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/instrument")
@Tag(name = "Instrument", description = "Instrument, detector and filter definitions")
public class InstrumentController {

    private final InstrumentService instrumentService;

    public InstrumentController(InstrumentService instrumentService) {
        this.instrumentService = instrumentService;
    }

    @Operation(summary = "Describe the instrument", description = "Identifier bounds, detectors and filters used to populate the data registry.")
    @GetMapping
    public ResponseEntity<InstrumentDescription> describe() {
        return ResponseEntity.ok(instrumentService.describe());
    }

    @Operation(summary = "Look up a filter by physical name or alias")
    @GetMapping("/filters/{name}")
    public ResponseEntity<FilterDefinition> filter(@PathVariable String name) {
        return instrumentService.findFilter(name)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
