package com.architecture.design.nodeforge.controller;

import com.architecture.design.nodeforge.dto.ConversionRequest;
import com.architecture.design.nodeforge.dto.ConversionResponse;
import com.architecture.design.nodeforge.service.ConversionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST entry point for converting an analysed widget tree into target nodes, components and a library.
 */
@RestController
@RequestMapping("/api/conversions")
@Slf4j
@RequiredArgsConstructor
public class ConversionController {

    private final ConversionService conversionService;

    /**
     * Run one conversion. Style problems are reported in the body; only malformed input or
     * inconsistent themes produce a 400.
     */
    @PostMapping
    public ResponseEntity<ConversionResponse> convert(@Valid @RequestBody ConversionRequest request) {
        log.info("Conversion requested: {} reusable widget(s), {} theme(s)",
                request.getReusableWidgets() != null ? request.getReusableWidgets().size() : 0,
                request.getThemes() != null ? request.getThemes().size() : 0);
        return ResponseEntity.ok(conversionService.convert(request));
    }
}
